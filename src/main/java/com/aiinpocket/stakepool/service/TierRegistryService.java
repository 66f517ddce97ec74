package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.CacheConfig;
import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.entity.LockupTier;
import com.aiinpocket.stakepool.model.enums.Rarity;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import com.aiinpocket.stakepool.repository.LockupTierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * 鎖倉級距與稀有度倍率。
 *
 * <p>級距利率在存款當下快照到存款上，調整利率只影響之後的新存款。
 * 停用的級距不接受新存款，既有存款照常計息。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TierRegistryService {

    /** 允許的鎖倉天數 */
    public static final List<Integer> ADMISSIBLE_LOCKUP_DAYS = List.of(0, 30, 90, 180, 365);

    private static final int MAX_APY_BPS = 10_000;

    private static final Map<Integer, Integer> FALLBACK_APY_BPS = Map.of(
            0, 1000, 30, 1200, 90, 1500, 180, 2000, 365, 2500);

    private final LockupTierRepository tierRepo;
    private final StakingProperties properties;
    private final AccessPolicy accessPolicy;
    private final GuardedOperationExecutor executor;
    private final StakingEventRecorder eventRecorder;
    private final Clock clock;

    /**
     * 取得可存款的級距。天數不在允許清單內或級距不存在 → INVALID_LOCKUP_DURATION；已停用 → TIER_INACTIVE。
     */
    @Cacheable(cacheNames = CacheConfig.LOCKUP_TIERS, key = "#lockupDays")
    @Transactional(readOnly = true)
    public LockupTier requireTier(int lockupDays) {
        LockupTier tier = findTier(lockupDays);
        if (!tier.isActive()) {
            throw new StakingException(StakingError.TIER_INACTIVE,
                    String.format("%d 天鎖倉級距已停用", lockupDays));
        }
        return tier;
    }

    /**
     * 級距目前的基礎年化利率（bps），不論是否啟用。
     */
    @Transactional(readOnly = true)
    public int rateFor(int lockupDays) {
        return findTier(lockupDays).getBaseApyBps();
    }

    @Transactional(readOnly = true)
    public List<LockupTier> lockupConfig() {
        return tierRepo.findAllByOrderByLockupDaysAsc();
    }

    /** 稀有度倍率（百分比），設定檔未覆寫時使用預設值 */
    public int rarityMultiplier(Rarity rarity) {
        Map<Rarity, Integer> overrides = properties.rarityMultipliers();
        if (overrides != null && overrides.containsKey(rarity)) {
            return overrides.get(rarity);
        }
        return rarity.getDefaultMultiplierPercent();
    }

    @CacheEvict(cacheNames = CacheConfig.LOCKUP_TIERS, allEntries = true)
    public LockupTier setTierApy(String caller, int lockupDays, int apyBps) {
        accessPolicy.requireOwner(caller);
        if (apyBps < 0 || apyBps > MAX_APY_BPS) {
            throw new StakingException(StakingError.INVALID_APY,
                    String.format("年化利率 %d bps 超出範圍 0~%d", apyBps, MAX_APY_BPS));
        }
        return executor.execute("setTierApy", () -> {
            LockupTier tier = findTier(lockupDays);
            int previous = tier.getBaseApyBps();
            tier.setBaseApyBps(apyBps);
            tier.setUpdatedAt(clock.instant());
            eventRecorder.record(caller, StakingEventType.TIER_UPDATED,
                    String.format("lockup=%dd apy %d -> %d bps", lockupDays, previous, apyBps));
            log.info("[級距] {} 天級距利率 {} -> {} bps", lockupDays, previous, apyBps);
            return tierRepo.save(tier);
        });
    }

    @CacheEvict(cacheNames = CacheConfig.LOCKUP_TIERS, allEntries = true)
    public LockupTier toggleTierStatus(String caller, int lockupDays) {
        accessPolicy.requireOwner(caller);
        return executor.execute("toggleTierStatus", () -> {
            LockupTier tier = findTier(lockupDays);
            tier.setActive(!tier.isActive());
            tier.setUpdatedAt(clock.instant());
            eventRecorder.record(caller, StakingEventType.TIER_UPDATED,
                    String.format("lockup=%dd active=%s", lockupDays, tier.isActive()));
            log.info("[級距] {} 天級距已{}", lockupDays, tier.isActive() ? "啟用" : "停用");
            return tierRepo.save(tier);
        });
    }

    /**
     * 補齊缺少的級距（已存在的不覆寫，保留管理員調整過的利率）。
     *
     * @return 新建立的級距數
     */
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.LOCKUP_TIERS, allEntries = true)
    public int ensureDefaultTiers() {
        int created = 0;
        for (Integer days : ADMISSIBLE_LOCKUP_DAYS) {
            if (tierRepo.existsById(days)) {
                continue;
            }
            tierRepo.save(LockupTier.builder()
                    .lockupDays(days)
                    .baseApyBps(configuredApy(days))
                    .minStake(properties.minDeposit())
                    .maxStake(properties.maxDeposit())
                    .updatedAt(clock.instant())
                    .build());
            created++;
        }
        return created;
    }

    private int configuredApy(int days) {
        Map<Integer, Integer> configured = properties.tierApyBps();
        if (configured != null && configured.containsKey(days)) {
            return configured.get(days);
        }
        return FALLBACK_APY_BPS.get(days);
    }

    private LockupTier findTier(int lockupDays) {
        if (!ADMISSIBLE_LOCKUP_DAYS.contains(lockupDays)) {
            throw new StakingException(StakingError.INVALID_LOCKUP_DURATION,
                    String.format("不支援 %d 天鎖倉，可選: %s", lockupDays, ADMISSIBLE_LOCKUP_DAYS));
        }
        return tierRepo.findById(lockupDays)
                .orElseThrow(() -> new StakingException(StakingError.INVALID_LOCKUP_DURATION,
                        String.format("%d 天鎖倉級距尚未設定", lockupDays)));
    }
}
