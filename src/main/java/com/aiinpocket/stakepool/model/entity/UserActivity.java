package com.aiinpocket.stakepool.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 防詐活動紀錄。
 * 每次質押操作都會更新；操作窗口為滾動 24 小時（自窗口內第一個操作起算）。
 */
@Entity
@Table(name = "user_activity")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserActivity {

    @Id
    @Column(length = 64)
    private String address;

    /** 目前窗口內的操作次數 */
    @Column(name = "actions_today", nullable = false)
    @Builder.Default
    private int actionsToday = 0;

    @Column(name = "window_start")
    private Instant windowStart;

    /** 本窗口是否已撞到每日上限 */
    @Column(name = "cap_hit_in_window", nullable = false)
    @Builder.Default
    private boolean capHitInWindow = false;

    /** 最近一次撞上限的窗口起點 */
    @Column(name = "last_cap_window_start")
    private Instant lastCapWindowStart;

    /** 連續撞上限的窗口數 */
    @Column(name = "consecutive_cap_windows", nullable = false)
    @Builder.Default
    private int consecutiveCapWindows = 0;

    @Column(name = "suspicious_score", nullable = false)
    @Builder.Default
    private int suspiciousScore = 0;

    /** 可疑分數達門檻後自動標記，不會自動封鎖 */
    @Column(nullable = false)
    @Builder.Default
    private boolean flagged = false;

    @Column(nullable = false)
    @Builder.Default
    private boolean banned = false;

    @Column(name = "ban_reason", length = 200)
    private String banReason;

    @Column(name = "banned_at")
    private Instant bannedAt;
}
