package com.aiinpocket.stakepool.controller;

import com.aiinpocket.stakepool.model.dto.BatchCompoundReport;
import com.aiinpocket.stakepool.model.dto.CompoundOutcome;
import com.aiinpocket.stakepool.model.dto.CompoundReceipt;
import com.aiinpocket.stakepool.model.dto.DepositReceipt;
import com.aiinpocket.stakepool.model.dto.PoolSnapshot;
import com.aiinpocket.stakepool.model.dto.RewardBreakdown;
import com.aiinpocket.stakepool.model.dto.UserStakingInfo;
import com.aiinpocket.stakepool.model.dto.WithdrawalReceipt;
import com.aiinpocket.stakepool.model.entity.LockupTier;
import com.aiinpocket.stakepool.service.AutoCompoundService;
import com.aiinpocket.stakepool.service.PoolAdminService;
import com.aiinpocket.stakepool.service.StakingQueryService;
import com.aiinpocket.stakepool.service.StakingService;
import com.aiinpocket.stakepool.service.TierRegistryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 質押 REST API。
 * 呼叫者身分由 X-Caller-Address 標頭帶入（簽章驗證由前置閘道負責）。
 */
@RestController
@RequestMapping("/api/staking")
@RequiredArgsConstructor
public class StakingController {

    static final String CALLER_HEADER = "X-Caller-Address";

    private final StakingService stakingService;
    private final StakingQueryService queryService;
    private final AutoCompoundService autoCompoundService;
    private final TierRegistryService tierRegistry;
    private final PoolAdminService poolAdminService;

    @PostMapping("/deposit")
    public ResponseEntity<DepositReceipt> deposit(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody DepositRequest request) {
        return ResponseEntity.ok(stakingService.deposit(caller, request.amount(), request.lockupDays()));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<WithdrawalReceipt> withdraw(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(stakingService.withdraw(caller));
    }

    @PostMapping("/withdraw-all")
    public ResponseEntity<WithdrawalReceipt> withdrawAll(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(stakingService.withdrawAll(caller));
    }

    @PostMapping("/compound")
    public ResponseEntity<CompoundReceipt> compound(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(stakingService.compound(caller));
    }

    /** 暫停期間取回本金 */
    @PostMapping("/emergency-withdraw")
    public ResponseEntity<WithdrawalReceipt> emergencyWithdraw(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(stakingService.emergencyWithdraw(caller));
    }

    @PutMapping("/auto-compound")
    public ResponseEntity<Map<String, Boolean>> setAutoCompound(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AutoCompoundRequest request) {
        boolean enabled = stakingService.setAutoCompound(caller, request.enabled());
        return ResponseEntity.ok(Map.of("enabled", enabled));
    }

    /** 任何人都可以替已開啟自動複利的用戶觸發 */
    @PostMapping("/auto-compound/{address}")
    public ResponseEntity<CompoundOutcome> performAutoCompound(@PathVariable String address) {
        return ResponseEntity.ok(autoCompoundService.performAutoCompound(address));
    }

    @PostMapping("/auto-compound/batch")
    public ResponseEntity<BatchCompoundReport> batchAutoCompound(@Valid @RequestBody BatchRequest request) {
        return ResponseEntity.ok(autoCompoundService.batchAutoCompound(request.users()));
    }

    @GetMapping("/users/{address}/auto-compound")
    public ResponseEntity<Map<String, Boolean>> checkAutoCompound(@PathVariable String address) {
        return ResponseEntity.ok(Map.of("due", autoCompoundService.checkAutoCompound(address)));
    }

    @GetMapping("/users/{address}")
    public ResponseEntity<UserStakingInfo> getUserInfo(@PathVariable String address) {
        return ResponseEntity.ok(queryService.getUserInfo(address));
    }

    @GetMapping("/users/{address}/rewards")
    public ResponseEntity<RewardBreakdown> getRewards(@PathVariable String address) {
        return ResponseEntity.ok(queryService.rewardBreakdown(address));
    }

    @GetMapping("/pool")
    public ResponseEntity<PoolSnapshot> getPool() {
        return ResponseEntity.ok(queryService.getPoolSnapshot());
    }

    @GetMapping("/tiers")
    public ResponseEntity<List<TierDto>> getTiers() {
        List<TierDto> tiers = tierRegistry.lockupConfig().stream().map(this::toDto).toList();
        return ResponseEntity.ok(tiers);
    }

    /** 注資獎勵準備金（不計入本金） */
    @PostMapping("/reserve")
    public ResponseEntity<Map<String, BigDecimal>> fundReserve(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AmountRequest request) {
        BigDecimal reserve = poolAdminService.fundRewardReserve(caller, request.amount());
        return ResponseEntity.ok(Map.of("rewardReserve", reserve));
    }

    // ===== DTO =====

    private TierDto toDto(LockupTier tier) {
        return new TierDto(tier.getLockupDays(), tier.getBaseApyBps(),
                tier.getMinStake(), tier.getMaxStake(), tier.isActive());
    }

    record DepositRequest(@NotNull @Positive BigDecimal amount, @NotNull Integer lockupDays) {}

    record AutoCompoundRequest(@NotNull Boolean enabled) {}

    record BatchRequest(@NotEmpty List<String> users) {}

    record AmountRequest(@NotNull @Positive BigDecimal amount) {}

    record TierDto(int lockupDays, int baseApyBps, BigDecimal minStake, BigDecimal maxStake, boolean active) {}
}
