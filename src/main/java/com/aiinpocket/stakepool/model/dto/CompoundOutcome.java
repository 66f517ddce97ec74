package com.aiinpocket.stakepool.model.dto;

import com.aiinpocket.stakepool.exception.StakingError;

import java.math.BigDecimal;

/**
 * 單一用戶的自動複利結果。
 * 批次處理時每位用戶各自一筆，失敗不影響其他用戶。
 */
public record CompoundOutcome(
        String staker,
        Status status,
        BigDecimal reinvested,
        StakingError reason,
        String message
) {
    public enum Status {
        COMPOUNDED,
        SKIPPED,
        FAILED
    }

    public static CompoundOutcome compounded(String staker, BigDecimal reinvested) {
        return new CompoundOutcome(staker, Status.COMPOUNDED, reinvested, null, null);
    }

    public static CompoundOutcome skipped(String staker, StakingError reason) {
        return new CompoundOutcome(staker, Status.SKIPPED, null, reason, reason.getDefaultMessage());
    }

    public static CompoundOutcome failed(String staker, StakingError reason, String message) {
        return new CompoundOutcome(staker, Status.FAILED, null, reason, message);
    }

    public boolean isCompounded() {
        return status == Status.COMPOUNDED;
    }
}
