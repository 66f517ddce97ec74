package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.entity.ActiveSkill;
import com.aiinpocket.stakepool.model.entity.StakerAccount;
import com.aiinpocket.stakepool.model.enums.Rarity;
import com.aiinpocket.stakepool.model.enums.SkillType;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import com.aiinpocket.stakepool.repository.ActiveSkillRepository;
import com.aiinpocket.stakepool.util.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * 技能啟用狀態與任務/成就獎勵。
 * 只接受受信任市集的通知，質押引擎本身不判斷 NFT 所有權。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SkillBoostService {

    private static final int MAX_EFFECT_BPS = 10_000;

    private final ActiveSkillRepository skillRepo;
    private final DepositLedgerService ledger;
    private final AccessPolicy accessPolicy;
    private final GuardedOperationExecutor executor;
    private final StakingEventRecorder eventRecorder;
    private final StakingProperties properties;
    private final Clock clock;

    public ActiveSkill notifySkillActivation(String caller, String user, long sourceId,
                                             SkillType skillType, int effectBps, Rarity rarity) {
        accessPolicy.requireSkillNotifier(caller);
        String staker = accessPolicy.requireAddress(user);
        if (skillType == null || effectBps < 0 || effectBps > MAX_EFFECT_BPS) {
            throw new StakingException(StakingError.INVALID_SKILL_EFFECT,
                    String.format("技能效果 %d bps 不合法（0~%d）", effectBps, MAX_EFFECT_BPS));
        }
        Rarity effectiveRarity = rarity != null ? rarity : Rarity.COMMON;

        return executor.execute("notifySkillActivation", () -> {
            if (skillRepo.existsByStakerAddressAndSourceId(staker, sourceId)) {
                throw new StakingException(StakingError.SKILL_ALREADY_ACTIVE,
                        String.format("技能 #%d 已啟用", sourceId));
            }
            if (skillRepo.countByStakerAddress(staker) >= properties.maxActiveSkills()) {
                throw new StakingException(StakingError.MAX_SKILLS_REACHED,
                        String.format("最多同時啟用 %d 個技能", properties.maxActiveSkills()));
            }
            ActiveSkill skill = skillRepo.save(ActiveSkill.builder()
                    .stakerAddress(staker)
                    .sourceId(sourceId)
                    .skillType(skillType)
                    .effectBps(effectBps)
                    .rarity(effectiveRarity)
                    .activatedAt(clock.instant())
                    .build());
            eventRecorder.record(staker, StakingEventType.SKILL_ACTIVATED,
                    String.format("#%d %s %dbps %s", sourceId, skillType, effectBps, effectiveRarity));
            log.info("[技能] {} 啟用技能 #{} {}（{} bps, {}）", staker, sourceId, skillType, effectBps, effectiveRarity);
            return skill;
        });
    }

    public void notifySkillDeactivation(String caller, String user, long sourceId) {
        accessPolicy.requireSkillNotifier(caller);
        String staker = accessPolicy.requireAddress(user);
        executor.run("notifySkillDeactivation", () -> {
            ActiveSkill skill = skillRepo.findByStakerAddressAndSourceId(staker, sourceId)
                    .orElseThrow(() -> new StakingException(StakingError.SKILL_NOT_ACTIVE,
                            String.format("技能 #%d 未啟用", sourceId)));
            skillRepo.delete(skill);
            eventRecorder.record(staker, StakingEventType.SKILL_DEACTIVATED,
                    String.format("#%d %s", sourceId, skill.getSkillType()));
            log.info("[技能] {} 停用技能 #{} {}", staker, sourceId, skill.getSkillType());
        });
    }

    @Transactional(readOnly = true)
    public List<ActiveSkill> activeSkills(String staker) {
        return skillRepo.findByStakerAddressOrderByIdAsc(staker);
    }

    public StakerAccount creditQuestReward(String caller, String user, BigDecimal amount) {
        return credit(caller, user, amount, StakingEventType.QUEST_REWARD);
    }

    public StakerAccount creditAchievementReward(String caller, String user, BigDecimal amount) {
        return credit(caller, user, amount, StakingEventType.ACHIEVEMENT_REWARD);
    }

    // 任務/成就獎勵記在帳戶上，下次提領或複利時一併發放
    private StakerAccount credit(String caller, String user, BigDecimal amount, StakingEventType type) {
        accessPolicy.requireSkillNotifier(caller);
        String staker = accessPolicy.requireAddress(user);
        BigDecimal value = Amounts.normalize(amount);
        if (!Amounts.isPositive(value)) {
            throw new StakingException(StakingError.INVALID_AMOUNT);
        }
        return executor.execute("credit" + type.name(), () -> {
            StakerAccount account = ledger.accountFor(staker);
            if (type == StakingEventType.QUEST_REWARD) {
                account.setQuestRewards(account.getQuestRewards().add(value));
            } else {
                account.setAchievementRewards(account.getAchievementRewards().add(value));
            }
            eventRecorder.record(staker, type, value, null);
            log.info("[技能] {} 獲得{}獎勵 {}", staker,
                    type == StakingEventType.QUEST_REWARD ? "任務" : "成就", value);
            return account;
        });
    }
}
