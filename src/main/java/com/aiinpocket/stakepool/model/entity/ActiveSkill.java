package com.aiinpocket.stakepool.model.entity;

import com.aiinpocket.stakepool.model.enums.Rarity;
import com.aiinpocket.stakepool.model.enums.SkillType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 用戶目前啟用中的技能。
 * 只由受信任的市集通知建立/移除；同一用戶同一來源 NFT 只能有一筆。
 */
@Entity
@Table(name = "active_skill", uniqueConstraints = {
        @UniqueConstraint(name = "uk_skill_staker_source", columnNames = {"staker_address", "source_id"})
}, indexes = {
        @Index(name = "idx_skill_staker", columnList = "staker_address")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActiveSkill {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "staker_address", nullable = false, length = 64)
    private String stakerAddress;

    /** 來源 NFT 編號 */
    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "skill_type", nullable = false, length = 30)
    private SkillType skillType;

    /** 效果強度（bps） */
    @Column(name = "effect_bps", nullable = false)
    private Integer effectBps;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Rarity rarity = Rarity.COMMON;

    @Column(name = "activated_at", nullable = false)
    private Instant activatedAt;
}
