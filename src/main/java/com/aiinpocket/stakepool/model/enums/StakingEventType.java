package com.aiinpocket.stakepool.model.enums;

/**
 * 帳本稽核事件類型。
 */
public enum StakingEventType {
    DEPOSIT,
    WITHDRAW,
    WITHDRAW_ALL,
    COMPOUND,
    AUTO_COMPOUND,
    EMERGENCY_WITHDRAW,
    AUTO_COMPOUND_TOGGLED,
    SKILL_ACTIVATED,
    SKILL_DEACTIVATED,
    QUEST_REWARD,
    ACHIEVEMENT_REWARD,
    USER_BANNED,
    USER_UNBANNED,
    USER_FLAGGED,
    POOL_PAUSED,
    POOL_UNPAUSED,
    TREASURY_CHANGED,
    POOL_MIGRATED,
    RESERVE_FUNDED,
    TIER_UPDATED
}
