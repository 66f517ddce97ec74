package com.aiinpocket.stakepool.model.enums;

import lombok.Getter;

@Getter
public enum SkillType {

    // 獎勵加成
    STAKE_BOOST_I(SkillEffect.REWARD_BOOST),
    STAKE_BOOST_II(SkillEffect.REWARD_BOOST),
    STAKE_BOOST_III(SkillEffect.REWARD_BOOST),

    AUTO_COMPOUND(SkillEffect.AUTOMATION),
    LOCK_REDUCER(SkillEffect.LOCK_REDUCTION),

    // 手續費折扣
    FEE_REDUCER_I(SkillEffect.FEE_DISCOUNT),
    FEE_REDUCER_II(SkillEffect.FEE_DISCOUNT),

    // 市集專用，質押端不計算
    PRIORITY_LISTING(SkillEffect.NONE);

    private final SkillEffect effect;

    SkillType(SkillEffect effect) {
        this.effect = effect;
    }
}
