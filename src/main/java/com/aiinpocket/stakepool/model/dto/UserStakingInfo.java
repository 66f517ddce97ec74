package com.aiinpocket.stakepool.model.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record UserStakingInfo(
        String staker,
        BigDecimal totalDeposited,
        int depositCount,
        BigDecimal pendingRewards,
        BigDecimal totalWithdrawnToday,
        boolean autoCompoundEnabled,
        Instant lastClaimAt,
        int activeSkillCount,
        boolean banned,
        boolean flagged,
        List<DepositView> deposits
) {
    public record DepositView(
            Long id,
            BigDecimal amount,
            Instant depositedAt,
            int lockupDays,
            int rateBps,
            Instant unlockAt
    ) {}
}
