package com.aiinpocket.stakepool.model.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record CompoundReceipt(
        String staker,
        Long depositId,
        BigDecimal grossReward,
        BigDecimal commission,
        BigDecimal reinvested,
        int depositCount,
        Instant compoundedAt
) {}
