package com.aiinpocket.stakepool.config;

import com.aiinpocket.stakepool.model.enums.Rarity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

@ConfigurationProperties(prefix = "staking")
public record StakingProperties(
        String owner,
        String treasury,
        String trustedNotifier,
        int commissionBps,
        BigDecimal minDeposit,
        BigDecimal maxDeposit,
        BigDecimal dailyWithdrawalLimit,
        Duration withdrawalWindow,
        int maxDepositsPerUser,
        int maxActiveSkills,
        int maxModifierBps,
        Map<Integer, Integer> tierApyBps,
        Map<Rarity, Integer> rarityMultipliers,
        AutoCompoundParams autoCompound,
        AntiFraudParams antiFraud
) {
    public record AutoCompoundParams(
            Duration interval,
            BigDecimal minReward
    ) {}

    public record AntiFraudParams(
            int maxActionsPerDay,
            int suspiciousThreshold,
            Duration window
    ) {}
}
