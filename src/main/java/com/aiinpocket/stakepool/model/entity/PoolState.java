package com.aiinpocket.stakepool.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 資金池全域狀態（單列表，id 固定為 1）。
 * totalPoolBalance 必須永遠等於所有存款本金總和。
 */
@Entity
@Table(name = "pool_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PoolState {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    /** 池內所有用戶本金總和 */
    @Column(name = "total_pool_balance", nullable = false, precision = 38, scale = 8)
    @Builder.Default
    private BigDecimal totalPoolBalance = BigDecimal.ZERO;

    /** 曾經存款過的不重複地址數 */
    @Column(name = "unique_users_count", nullable = false)
    @Builder.Default
    private Long uniqueUsersCount = 0L;

    @Column(nullable = false)
    @Builder.Default
    private boolean migrated = false;

    @Column(nullable = false)
    @Builder.Default
    private boolean paused = false;

    /** 手續費收款地址 */
    @Column(nullable = false, length = 64)
    private String treasury;

    /** 累計發放給用戶的淨獎勵 */
    @Column(name = "total_rewards_paid", nullable = false, precision = 38, scale = 8)
    @Builder.Default
    private BigDecimal totalRewardsPaid = BigDecimal.ZERO;

    /** 累計收取的手續費 */
    @Column(name = "total_commission", nullable = false, precision = 38, scale = 8)
    @Builder.Default
    private BigDecimal totalCommission = BigDecimal.ZERO;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
