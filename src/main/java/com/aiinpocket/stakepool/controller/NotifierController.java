package com.aiinpocket.stakepool.controller;

import com.aiinpocket.stakepool.model.entity.ActiveSkill;
import com.aiinpocket.stakepool.model.entity.StakerAccount;
import com.aiinpocket.stakepool.model.enums.Rarity;
import com.aiinpocket.stakepool.model.enums.SkillType;
import com.aiinpocket.stakepool.service.SkillBoostService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 市集通知 API：技能啟用/停用、任務與成就獎勵。
 * 只有受信任的市集地址可以呼叫。
 */
@RestController
@RequestMapping("/api/notifier")
@RequiredArgsConstructor
public class NotifierController {

    private final SkillBoostService skillBoostService;

    @PostMapping("/skills/activate")
    public ResponseEntity<SkillDto> activate(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @Valid @RequestBody ActivateRequest request) {
        ActiveSkill skill = skillBoostService.notifySkillActivation(caller, request.user(), request.sourceId(),
                request.skillType(), request.effectBps(), request.rarity());
        return ResponseEntity.ok(new SkillDto(skill.getStakerAddress(), skill.getSourceId(),
                skill.getSkillType(), skill.getEffectBps(), skill.getRarity()));
    }

    @PostMapping("/skills/deactivate")
    public ResponseEntity<Map<String, Boolean>> deactivate(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @Valid @RequestBody DeactivateRequest request) {
        skillBoostService.notifySkillDeactivation(caller, request.user(), request.sourceId());
        return ResponseEntity.ok(Map.of("deactivated", true));
    }

    @PostMapping("/rewards/quest")
    public ResponseEntity<Map<String, BigDecimal>> questReward(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @Valid @RequestBody RewardRequest request) {
        StakerAccount account = skillBoostService.creditQuestReward(caller, request.user(), request.amount());
        return ResponseEntity.ok(Map.of("questRewards", account.getQuestRewards()));
    }

    @PostMapping("/rewards/achievement")
    public ResponseEntity<Map<String, BigDecimal>> achievementReward(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @Valid @RequestBody RewardRequest request) {
        StakerAccount account = skillBoostService.creditAchievementReward(caller, request.user(), request.amount());
        return ResponseEntity.ok(Map.of("achievementRewards", account.getAchievementRewards()));
    }

    record ActivateRequest(@NotBlank String user, @NotNull Long sourceId, @NotNull SkillType skillType,
                           @NotNull Integer effectBps, Rarity rarity) {}

    record DeactivateRequest(@NotBlank String user, @NotNull Long sourceId) {}

    record RewardRequest(@NotBlank String user, @NotNull @Positive BigDecimal amount) {}

    record SkillDto(String user, Long sourceId, SkillType skillType, int effectBps, Rarity rarity) {}
}
