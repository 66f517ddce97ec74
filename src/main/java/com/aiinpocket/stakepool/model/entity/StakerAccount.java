package com.aiinpocket.stakepool.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 質押用戶帳戶。
 * 首次存款時建立，之後永不刪除（保留稽核紀錄）。
 */
@Entity
@Table(name = "staker_account")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StakerAccount {

    @Id
    @Column(length = 64)
    private String address;

    /** 目前提領窗口內已提領的淨額 */
    @Column(name = "total_withdrawn_today", nullable = false, precision = 38, scale = 8)
    @Builder.Default
    private BigDecimal totalWithdrawnToday = BigDecimal.ZERO;

    /** 提領窗口起點（滾動 24 小時） */
    @Column(name = "withdraw_window_start")
    private Instant withdrawWindowStart;

    @Column(name = "auto_compound_enabled", nullable = false)
    @Builder.Default
    private boolean autoCompoundEnabled = false;

    /** 獎勵結算點：獎勵從 max(存入時間, 此時間) 開始累積 */
    @Column(name = "last_claim_at")
    private Instant lastClaimAt;

    @Column(name = "last_compound_at")
    private Instant lastCompoundAt;

    /** 任務系統發放、尚未領取的獎勵 */
    @Column(name = "quest_rewards", nullable = false, precision = 38, scale = 8)
    @Builder.Default
    private BigDecimal questRewards = BigDecimal.ZERO;

    /** 成就系統發放、尚未領取的獎勵 */
    @Column(name = "achievement_rewards", nullable = false, precision = 38, scale = 8)
    @Builder.Default
    private BigDecimal achievementRewards = BigDecimal.ZERO;

    /** 首次存款時間（null = 從未存款） */
    @Column(name = "first_deposit_at")
    private Instant firstDepositAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public BigDecimal getPendingBonusRewards() {
        return questRewards.add(achievementRewards);
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
