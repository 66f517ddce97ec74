package com.aiinpocket.stakepool.model.dto;

import java.math.BigDecimal;

/**
 * 三種獎勵計算結果，以及可另外領取的任務/成就獎勵。
 */
public record RewardBreakdown(
        String staker,
        BigDecimal baseRewards,
        BigDecimal boostedRewards,
        BigDecimal rarityBoostedRewards,
        BigDecimal bonusRewards,
        long totalBoostBps,
        int feeDiscountBps
) {}
