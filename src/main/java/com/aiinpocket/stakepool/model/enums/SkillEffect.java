package com.aiinpocket.stakepool.model.enums;

/**
 * 技能作用的對象。
 */
public enum SkillEffect {
    /** 提高獎勵累積 */
    REWARD_BOOST,
    /** 縮短鎖倉時間 */
    LOCK_REDUCTION,
    /** 降低提領手續費 */
    FEE_DISCOUNT,
    /** 自動化功能，不影響數值 */
    AUTOMATION,
    NONE
}
