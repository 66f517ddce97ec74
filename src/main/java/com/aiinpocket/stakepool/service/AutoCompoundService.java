package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.dto.BatchCompoundReport;
import com.aiinpocket.stakepool.model.dto.CompoundOutcome;
import com.aiinpocket.stakepool.model.dto.CompoundReceipt;
import com.aiinpocket.stakepool.model.entity.StakerAccount;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import com.aiinpocket.stakepool.repository.StakerAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 自動複利。
 *
 * <p>由外部 keeper（{@code AutoCompoundJob}）或任何人觸發，只替已開啟自動複利的用戶執行。
 * 距上次複利未滿間隔或獎勵未達門檻時回傳 SKIPPED，不視為錯誤。
 * keeper 代為執行的複利不計入用戶的防詐操作次數。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoCompoundService {

    private final StakingService stakingService;
    private final DepositLedgerService ledger;
    private final SkillBoostService skillBoostService;
    private final RewardCalculator calculator;
    private final EmergencyControlService emergencyControl;
    private final AntiFraudService antiFraud;
    private final AccessPolicy accessPolicy;
    private final GuardedOperationExecutor executor;
    private final StakerAccountRepository accountRepo;
    private final StakingProperties properties;
    private final Clock clock;

    /**
     * 用戶目前是否該執行自動複利。
     */
    @Transactional(readOnly = true)
    public boolean checkAutoCompound(String user) {
        return ledger.findAccount(accessPolicy.requireAddress(user))
                .map(account -> isDue(account, clock.instant()))
                .orElse(false);
    }

    public CompoundOutcome performAutoCompound(String user) {
        String staker = accessPolicy.requireAddress(user);
        emergencyControl.requireNotPaused();
        return compoundOnBehalf(staker);
    }

    /**
     * 批次自動複利。每位用戶各自取鎖、各自交易，單一用戶失敗只記在該用戶的結果。
     */
    public BatchCompoundReport batchAutoCompound(List<String> users) {
        emergencyControl.requireNotPaused();
        List<CompoundOutcome> outcomes = new ArrayList<>();
        for (String user : users) {
            try {
                outcomes.add(compoundOnBehalf(accessPolicy.requireAddress(user)));
            } catch (StakingException e) {
                log.warn("[自動複利] {} 處理失敗: {} {}", user, e.getError(), e.getMessage());
                outcomes.add(CompoundOutcome.failed(user, e.getError(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("[自動複利] {} 發生非預期錯誤", user, e);
                outcomes.add(CompoundOutcome.failed(user, null, e.getMessage()));
            }
        }
        BatchCompoundReport report = new BatchCompoundReport(outcomes);
        log.info("[自動複利] 批次完成: {} 位用戶，複利 {}，略過 {}，失敗 {}",
                outcomes.size(), report.compoundedCount(), report.skippedCount(), report.failedCount());
        return report;
    }

    @Transactional(readOnly = true)
    public List<String> findOptedInUsers() {
        return accountRepo.findByAutoCompoundEnabledTrueOrderByAddressAsc().stream()
                .map(StakerAccount::getAddress)
                .toList();
    }

    private CompoundOutcome compoundOnBehalf(String staker) {
        return executor.execute("autoCompound", () -> {
            emergencyControl.requireNotPaused();
            antiFraud.requireNotBanned(staker);
        }, () -> {
            Instant now = clock.instant();
            Optional<StakerAccount> account = ledger.findAccount(staker);
            if (account.isEmpty() || !account.get().isAutoCompoundEnabled()) {
                return CompoundOutcome.skipped(staker, StakingError.AUTO_COMPOUND_NOT_ENABLED);
            }
            if (!isDue(account.get(), now)) {
                return CompoundOutcome.skipped(staker, StakingError.NO_REWARDS_AVAILABLE);
            }
            CompoundReceipt receipt = stakingService.applyCompound(staker, now, StakingEventType.AUTO_COMPOUND);
            return CompoundOutcome.compounded(staker, receipt.reinvested());
        });
    }

    // 已開啟、距上次複利（或首次存款）滿間隔、且獎勵超過門檻
    private boolean isDue(StakerAccount account, Instant now) {
        if (!account.isAutoCompoundEnabled()) {
            return false;
        }
        Instant anchor = account.getLastCompoundAt() != null ? account.getLastCompoundAt() : account.getFirstDepositAt();
        if (anchor == null || now.isBefore(anchor.plus(properties.autoCompound().interval()))) {
            return false;
        }
        String staker = account.getAddress();
        BigDecimal pending = calculator.calculateBoostedRewardsWithRarityMultiplier(
                ledger.listDeposits(staker), skillBoostService.activeSkills(staker), account.getLastClaimAt(), now)
                .add(account.getPendingBonusRewards());
        return pending.compareTo(properties.autoCompound().minReward()) > 0;
    }
}
