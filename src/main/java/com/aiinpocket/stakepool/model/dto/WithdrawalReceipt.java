package com.aiinpocket.stakepool.model.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 提領結果。
 * grossReward 含質押獎勵與任務/成就獎勵；payout = principal + netReward。
 */
public record WithdrawalReceipt(
        String staker,
        BigDecimal grossReward,
        BigDecimal commission,
        BigDecimal netReward,
        BigDecimal principal,
        BigDecimal payout,
        Instant withdrawnAt
) {}
