package com.aiinpocket.stakepool.model.enums;

import lombok.Getter;

/**
 * 技能 NFT 稀有度。
 * 預設倍率以百分比表示（100 = 1x），可由設定檔覆寫。
 */
@Getter
public enum Rarity {
    COMMON(100),
    UNCOMMON(150),
    RARE(200),
    EPIC(300),
    LEGENDARY(500);

    private final int defaultMultiplierPercent;

    Rarity(int defaultMultiplierPercent) {
        this.defaultMultiplierPercent = defaultMultiplierPercent;
    }
}
