package com.aiinpocket.stakepool.model.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 存款結果：gross 為用戶送出的金額，principal 為扣除手續費後入帳的本金。
 */
public record DepositReceipt(
        String staker,
        Long depositId,
        BigDecimal gross,
        BigDecimal commission,
        BigDecimal principal,
        int lockupDays,
        int rateBps,
        int depositCount,
        Instant depositedAt
) {}
