package com.aiinpocket.stakepool.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * 單筆質押存款。
 * 建立後內容不可變，只會因全額提領或緊急提領而整筆刪除。
 * 同一用戶的存款以 id 遞增順序代表存入順序。
 */
@Entity
@Table(name = "stake_deposit", indexes = {
        @Index(name = "idx_deposit_staker", columnList = "staker_address")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StakeDeposit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 存款人地址 */
    @Column(name = "staker_address", nullable = false, length = 64, updatable = false)
    private String stakerAddress;

    /** 扣除手續費後的本金 */
    @Column(nullable = false, precision = 38, scale = 8, updatable = false)
    private BigDecimal amount;

    @Column(name = "deposited_at", nullable = false, updatable = false)
    private Instant depositedAt;

    /** 鎖倉天數（0 / 30 / 90 / 180 / 365） */
    @Column(name = "lockup_days", nullable = false, updatable = false)
    private Integer lockupDays;

    /** 存入當下的級距年化利率快照（bps），之後調整級距不影響此筆 */
    @Column(name = "rate_bps", nullable = false, updatable = false)
    private Integer rateBps;

    public Duration getLockupDuration() {
        return Duration.ofDays(lockupDays);
    }
}
