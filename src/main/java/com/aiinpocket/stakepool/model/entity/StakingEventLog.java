package com.aiinpocket.stakepool.model.entity;

import com.aiinpocket.stakepool.model.enums.StakingEventType;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "staking_event_log", indexes = {
        @Index(name = "idx_event_staker", columnList = "staker_address")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StakingEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 事件相關地址（全域事件為操作者地址） */
    @Column(name = "staker_address", nullable = false, length = 64)
    private String stakerAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private StakingEventType eventType;

    @Column(precision = 38, scale = 8)
    private BigDecimal amount;

    @Column(length = 500)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
