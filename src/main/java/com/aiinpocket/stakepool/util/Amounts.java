package com.aiinpocket.stakepool.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 金額運算工具。
 * 所有金額固定 8 位小數，一律無條件捨去（向零截斷），避免超發獎勵。
 */
public final class Amounts {

    public static final int SCALE = 8;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    /** 10000 bps = 100% */
    public static final long BPS_DENOMINATOR = 10_000L;

    private Amounts() {
    }

    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) return ZERO;
        return value.setScale(SCALE, RoundingMode.DOWN);
    }

    /**
     * 計算 amount 的 bps 比例，截斷至 8 位小數。
     */
    public static BigDecimal bps(BigDecimal amount, long bps) {
        return amount.multiply(BigDecimal.valueOf(bps))
                .divide(BigDecimal.valueOf(BPS_DENOMINATOR), SCALE, RoundingMode.DOWN);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : ZERO;
    }
}
