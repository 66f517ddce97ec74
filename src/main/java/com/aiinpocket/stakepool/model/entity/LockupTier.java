package com.aiinpocket.stakepool.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 鎖倉級距設定。
 * 啟動時由設定檔建立，之後只有管理員能調整利率或停用。
 */
@Entity
@Table(name = "lockup_tier")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LockupTier {

    @Id
    @Column(name = "lockup_days")
    private Integer lockupDays;

    /** 基礎年化利率（bps） */
    @Column(name = "base_apy_bps", nullable = false)
    private Integer baseApyBps;

    @Column(name = "min_stake", nullable = false, precision = 38, scale = 8)
    private BigDecimal minStake;

    @Column(name = "max_stake", nullable = false, precision = 38, scale = 8)
    private BigDecimal maxStake;

    /** 停用後不接受新存款，既有存款照常累積 */
    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
