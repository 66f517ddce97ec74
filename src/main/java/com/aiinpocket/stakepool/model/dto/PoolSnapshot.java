package com.aiinpocket.stakepool.model.dto;

import java.math.BigDecimal;

/**
 * 資金池快照。rewardReserve = custodyBalance - totalPoolBalance。
 */
public record PoolSnapshot(
        BigDecimal totalPoolBalance,
        BigDecimal custodyBalance,
        BigDecimal rewardReserve,
        long uniqueUsersCount,
        boolean paused,
        boolean migrated,
        String treasury,
        BigDecimal totalRewardsPaid,
        BigDecimal totalCommission
) {}
