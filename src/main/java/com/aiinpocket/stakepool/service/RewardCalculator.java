package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.model.entity.ActiveSkill;
import com.aiinpocket.stakepool.model.entity.StakeDeposit;
import com.aiinpocket.stakepool.model.enums.SkillEffect;
import com.aiinpocket.stakepool.util.Amounts;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 獎勵累積計算（純函數，不讀寫任何狀態）。
 *
 * <p>單筆存款獎勵 = 本金 × 利率 bps × 經過秒數 / (10000 × 一年秒數)，
 * 經過時間從 max(存入時間, 結算點) 起算，結果截斷至 8 位小數。
 *
 * <p>技能加成：
 * <ul>
 *   <li>獎勵加成：所有 REWARD_BOOST 技能的 bps 相加，boosted = base × (10000 + bps) / 10000</li>
 *   <li>稀有度版本：每個技能 bps × 稀有度倍率% / 100 後再相加</li>
 *   <li>鎖倉縮短與手續費折扣：相加後上限為 maxModifierBps（預設 50%）</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class RewardCalculator {

    public static final long SECONDS_PER_YEAR = 365L * 24 * 60 * 60;

    private static final BigDecimal YEAR_BPS = BigDecimal.valueOf(Amounts.BPS_DENOMINATOR)
            .multiply(BigDecimal.valueOf(SECONDS_PER_YEAR));

    private final TierRegistryService tierRegistry;
    private final StakingProperties properties;

    public BigDecimal calculateRewards(List<StakeDeposit> deposits, Instant checkpoint, Instant now) {
        BigDecimal total = Amounts.ZERO;
        for (StakeDeposit deposit : deposits) {
            total = total.add(depositReward(deposit, checkpoint, now));
        }
        return total;
    }

    public BigDecimal depositReward(StakeDeposit deposit, Instant checkpoint, Instant now) {
        Instant from = deposit.getDepositedAt();
        if (checkpoint != null && checkpoint.isAfter(from)) {
            from = checkpoint;
        }
        long seconds = Duration.between(from, now).getSeconds();
        if (seconds <= 0) {
            return Amounts.ZERO;
        }
        return deposit.getAmount()
                .multiply(BigDecimal.valueOf(deposit.getRateBps()))
                .multiply(BigDecimal.valueOf(seconds))
                .divide(YEAR_BPS, Amounts.SCALE, RoundingMode.DOWN);
    }

    public BigDecimal calculateBoostedRewards(List<StakeDeposit> deposits, List<ActiveSkill> skills,
                                              Instant checkpoint, Instant now) {
        return applyBoost(calculateRewards(deposits, checkpoint, now), totalBoostBps(skills));
    }

    public BigDecimal calculateBoostedRewardsWithRarityMultiplier(List<StakeDeposit> deposits,
                                                                  List<ActiveSkill> skills,
                                                                  Instant checkpoint, Instant now) {
        return applyBoost(calculateRewards(deposits, checkpoint, now), rarityWeightedBoostBps(skills));
    }

    /** 所有獎勵加成技能的 bps 總和 */
    public long totalBoostBps(List<ActiveSkill> skills) {
        return skills.stream()
                .filter(s -> s.getSkillType().getEffect() == SkillEffect.REWARD_BOOST)
                .mapToLong(ActiveSkill::getEffectBps)
                .sum();
    }

    public long rarityWeightedBoostBps(List<ActiveSkill> skills) {
        return skills.stream()
                .filter(s -> s.getSkillType().getEffect() == SkillEffect.REWARD_BOOST)
                .mapToLong(s -> (long) s.getEffectBps() * tierRegistry.rarityMultiplier(s.getRarity()) / 100)
                .sum();
    }

    public BigDecimal applyBoost(BigDecimal base, long boostBps) {
        if (boostBps <= 0) {
            return base;
        }
        return base.multiply(BigDecimal.valueOf(Amounts.BPS_DENOMINATOR + boostBps))
                .divide(BigDecimal.valueOf(Amounts.BPS_DENOMINATOR), Amounts.SCALE, RoundingMode.DOWN);
    }

    /**
     * 技能縮短後的鎖倉時間（最多縮短 maxModifierBps）。
     */
    public Duration calculateReducedLockTime(Duration lockup, List<ActiveSkill> skills) {
        long reduction = clampModifier(sumEffect(skills, SkillEffect.LOCK_REDUCTION));
        if (reduction == 0) {
            return lockup;
        }
        long seconds = lockup.getSeconds() * (Amounts.BPS_DENOMINATOR - reduction) / Amounts.BPS_DENOMINATOR;
        return Duration.ofSeconds(seconds);
    }

    /** 手續費折扣 bps（最多 maxModifierBps） */
    public int calculateFeeDiscount(List<ActiveSkill> skills) {
        return (int) clampModifier(sumEffect(skills, SkillEffect.FEE_DISCOUNT));
    }

    /**
     * 加成後的年化利率（bps），供前端顯示。
     */
    public long calculateBoostedApy(int baseApyBps, long boostBps) {
        if (boostBps <= 0) {
            return baseApyBps;
        }
        return baseApyBps * (Amounts.BPS_DENOMINATOR + boostBps) / Amounts.BPS_DENOMINATOR;
    }

    private long sumEffect(List<ActiveSkill> skills, SkillEffect effect) {
        return skills.stream()
                .filter(s -> s.getSkillType().getEffect() == effect)
                .mapToLong(ActiveSkill::getEffectBps)
                .sum();
    }

    private long clampModifier(long bps) {
        return Math.max(0, Math.min(bps, properties.maxModifierBps()));
    }
}
