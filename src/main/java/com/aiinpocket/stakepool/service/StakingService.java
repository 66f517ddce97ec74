package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.dto.CompoundReceipt;
import com.aiinpocket.stakepool.model.dto.DepositReceipt;
import com.aiinpocket.stakepool.model.dto.WithdrawalReceipt;
import com.aiinpocket.stakepool.model.entity.ActiveSkill;
import com.aiinpocket.stakepool.model.entity.LockupTier;
import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.model.entity.StakeDeposit;
import com.aiinpocket.stakepool.model.entity.StakerAccount;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import com.aiinpocket.stakepool.service.CommissionProcessor.CommissionSplit;
import com.aiinpocket.stakepool.settlement.InsufficientFundsException;
import com.aiinpocket.stakepool.settlement.SettlementPort;
import com.aiinpocket.stakepool.util.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 質押核心流程：存款、提領、全額提領、複利、緊急提領。
 *
 * <p>每個入口的檢查順序固定：
 * 取得互斥鎖 → 暫停 → 封鎖 → 參數 → 記錄防詐操作 → 交易主體 → 釋放鎖。
 * 暫停、封鎖與級距都在鎖內讀取，排隊中的操作不會用到鎖外讀到的舊狀態。
 * 交易主體先改帳本再對外轉帳（先付用戶、再付金庫），任何轉帳失敗整筆回滾。
 *
 * <p>本類別不加 {@code @Transactional}：交易邊界由 {@link GuardedOperationExecutor} 控制，鎖必須包住整個交易。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StakingService {

    private final DepositLedgerService ledger;
    private final RewardCalculator calculator;
    private final CommissionProcessor commissionProcessor;
    private final SkillBoostService skillBoostService;
    private final TierRegistryService tierRegistry;
    private final EmergencyControlService emergencyControl;
    private final AntiFraudService antiFraud;
    private final PoolStateService poolStateService;
    private final GuardedOperationExecutor executor;
    private final ReentrancyGuard guard;
    private final AccessPolicy accessPolicy;
    private final SettlementPort settlementPort;
    private final StakingEventRecorder eventRecorder;
    private final StakingProperties properties;
    private final Clock clock;

    public DepositReceipt deposit(String user, BigDecimal amount, int lockupDays) {
        String staker = accessPolicy.requireAddress(user);
        BigDecimal gross = Amounts.normalize(amount);

        return executor.executeForUser("deposit", staker, () -> {
            requireActive(staker);
            ledger.validateDeposit(gross, lockupDays);
        }, () -> {
            LockupTier tier = tierRegistry.requireTier(lockupDays);
            PoolState pool = poolStateService.current();
            requireNotMigrated(pool);
            CommissionSplit split = commissionProcessor.applyDepositCommission(gross);
            StakeDeposit deposit = ledger.addDeposit(staker, split.net(), tier.getLockupDays(), tier.getBaseApyBps());
            pool.setTotalCommission(pool.getTotalCommission().add(split.fee()));
            eventRecorder.record(staker, StakingEventType.DEPOSIT, split.net(),
                    String.format("lockup=%dd rate=%dbps fee=%s", tier.getLockupDays(), tier.getBaseApyBps(), split.fee()));

            collectFrom(staker, gross);
            commissionProcessor.routeFee(pool.getTreasury(), split.fee());

            int count = ledger.depositCount(staker);
            log.info("[質押] {} 存入 {}（手續費 {}），鎖倉 {} 天，利率 {} bps，共 {} 筆",
                    staker, split.net(), split.fee(), tier.getLockupDays(), tier.getBaseApyBps(), count);
            return new DepositReceipt(staker, deposit.getId(), gross, split.fee(), split.net(),
                    tier.getLockupDays(), tier.getBaseApyBps(), count, deposit.getDepositedAt());
        });
    }

    /**
     * 只領取獎勵（含任務/成就獎勵），本金不動。受每日提領上限限制。
     */
    public WithdrawalReceipt withdraw(String user) {
        String staker = accessPolicy.requireAddress(user);

        return executor.executeForUser("withdraw", staker, () -> requireActive(staker), () -> {
            Instant now = clock.instant();
            PoolState pool = poolStateService.current();
            StakerAccount account = ledger.findAccount(staker)
                    .orElseThrow(() -> new StakingException(StakingError.NO_REWARDS_AVAILABLE));
            List<ActiveSkill> skills = skillBoostService.activeSkills(staker);
            PendingReward reward = pendingReward(account, ledger.listDeposits(staker), skills, now);
            if (!Amounts.isPositive(reward.gross())) {
                throw new StakingException(StakingError.NO_REWARDS_AVAILABLE);
            }

            CommissionSplit split = commissionProcessor.applyWithdrawalCommission(
                    reward.gross(), calculator.calculateFeeDiscount(skills));
            enforceDailyLimit(account, split.net(), now);
            requireRewardReserve(pool, reward.gross());

            settle(account, pool, split, now);
            eventRecorder.record(staker, StakingEventType.WITHDRAW, split.net(), "fee=" + split.fee());

            payOut(staker, split.net());
            commissionProcessor.routeFee(pool.getTreasury(), split.fee());
            log.info("[提領] {} 領取獎勵 {}（手續費 {}），窗口內已領 {}",
                    staker, split.net(), split.fee(), account.getTotalWithdrawnToday());
            return new WithdrawalReceipt(staker, reward.gross(), split.fee(), split.net(),
                    Amounts.ZERO, split.net(), now);
        });
    }

    /**
     * 全額提領：本金 + 獎勵一次領回並清空存款。任一筆仍在鎖倉期內即拒絕。
     * 本金不計入每日提領上限，獎勵部分照常受限。
     */
    public WithdrawalReceipt withdrawAll(String user) {
        String staker = accessPolicy.requireAddress(user);

        return executor.executeForUser("withdrawAll", staker, () -> requireActive(staker), () -> {
            Instant now = clock.instant();
            List<StakeDeposit> deposits = ledger.listDeposits(staker);
            if (deposits.isEmpty()) {
                throw new StakingException(StakingError.NO_DEPOSITS_FOUND);
            }
            List<ActiveSkill> skills = skillBoostService.activeSkills(staker);
            requireUnlocked(deposits, skills, now);

            PoolState pool = poolStateService.current();
            StakerAccount account = ledger.accountFor(staker);
            PendingReward reward = pendingReward(account, deposits, skills, now);
            CommissionSplit split = commissionProcessor.applyWithdrawalCommission(
                    reward.gross(), calculator.calculateFeeDiscount(skills));
            if (Amounts.isPositive(split.net())) {
                enforceDailyLimit(account, split.net(), now);
            }
            requireRewardReserve(pool, reward.gross());

            BigDecimal principal = ledger.removeAll(staker);
            settle(account, pool, split, now);
            BigDecimal payout = principal.add(split.net());
            eventRecorder.record(staker, StakingEventType.WITHDRAW_ALL, payout,
                    String.format("principal=%s reward=%s fee=%s", principal, split.net(), split.fee()));

            payOut(staker, payout);
            commissionProcessor.routeFee(pool.getTreasury(), split.fee());
            log.info("[提領] {} 全額提領 {}（本金 {}，獎勵 {}，手續費 {}）",
                    staker, payout, principal, split.net(), split.fee());
            return new WithdrawalReceipt(staker, reward.gross(), split.fee(), split.net(), principal, payout, now);
        });
    }

    public CompoundReceipt compound(String user) {
        String staker = accessPolicy.requireAddress(user);

        return executor.executeForUser("compound", staker, () -> requireActive(staker),
                () -> applyCompound(staker, clock.instant(), StakingEventType.COMPOUND));
    }

    /**
     * 將目前獎勵扣除手續費後轉為一筆無鎖倉的新存款。
     * 只能在互斥鎖與交易內呼叫（手動複利與自動複利共用）。
     */
    public CompoundReceipt applyCompound(String staker, Instant now, StakingEventType eventType) {
        guard.requireHeld("applyCompound");
        PoolState pool = poolStateService.current();
        requireNotMigrated(pool);
        StakerAccount account = ledger.findAccount(staker)
                .orElseThrow(() -> new StakingException(StakingError.NO_REWARDS_AVAILABLE));
        List<ActiveSkill> skills = skillBoostService.activeSkills(staker);
        PendingReward reward = pendingReward(account, ledger.listDeposits(staker), skills, now);
        if (!Amounts.isPositive(reward.gross())) {
            throw new StakingException(StakingError.NO_REWARDS_AVAILABLE);
        }

        CommissionSplit split = commissionProcessor.applyWithdrawalCommission(
                reward.gross(), calculator.calculateFeeDiscount(skills));
        requireRewardReserve(pool, reward.gross());

        StakeDeposit deposit = ledger.addDeposit(staker, split.net(), 0, tierRegistry.rateFor(0));
        account.setLastClaimAt(now);
        account.setLastCompoundAt(now);
        clearBonusRewards(account);
        pool.setTotalCommission(pool.getTotalCommission().add(split.fee()));
        eventRecorder.record(staker, eventType, split.net(), "fee=" + split.fee());

        commissionProcessor.routeFee(pool.getTreasury(), split.fee());
        int count = ledger.depositCount(staker);
        log.info("[複利] {} 將獎勵 {} 轉為新存款（手續費 {}），共 {} 筆", staker, split.net(), split.fee(), count);
        return new CompoundReceipt(staker, deposit.getId(), reward.gross(), split.fee(), split.net(), count, now);
    }

    /**
     * 緊急提領：只在暫停期間可用，只退本金，不計獎勵、手續費與每日上限。
     */
    public WithdrawalReceipt emergencyWithdraw(String user) {
        String staker = accessPolicy.requireAddress(user);

        return executor.execute("emergencyWithdraw", () -> {
            emergencyControl.requirePaused();
            antiFraud.requireNotBanned(staker);
        }, () -> {
            if (ledger.listDeposits(staker).isEmpty()) {
                throw new StakingException(StakingError.NO_DEPOSITS_FOUND);
            }
            Instant now = clock.instant();
            BigDecimal principal = ledger.removeAll(staker);
            eventRecorder.record(staker, StakingEventType.EMERGENCY_WITHDRAW, principal, null);
            payOut(staker, principal);
            log.warn("[緊急提領] {} 取回本金 {}", staker, principal);
            return new WithdrawalReceipt(staker, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, principal, principal, now);
        });
    }

    public boolean setAutoCompound(String user, boolean enabled) {
        String staker = accessPolicy.requireAddress(user);

        return executor.executeForUser("setAutoCompound", staker, () -> requireActive(staker), () -> {
            StakerAccount account = ledger.accountFor(staker);
            account.setAutoCompoundEnabled(enabled);
            eventRecorder.record(staker, StakingEventType.AUTO_COMPOUND_TOGGLED, "enabled=" + enabled);
            log.info("[複利] {} {}自動複利", staker, enabled ? "開啟" : "關閉");
            return enabled;
        });
    }

    // 鎖內呼叫
    private void requireActive(String staker) {
        emergencyControl.requireNotPaused();
        antiFraud.requireNotBanned(staker);
    }

    private PendingReward pendingReward(StakerAccount account, List<StakeDeposit> deposits,
                                        List<ActiveSkill> skills, Instant now) {
        BigDecimal accrued = calculator.calculateBoostedRewardsWithRarityMultiplier(
                deposits, skills, account.getLastClaimAt(), now);
        BigDecimal bonus = account.getPendingBonusRewards();
        return new PendingReward(accrued, bonus, accrued.add(bonus));
    }

    // 獎勵已發放：重設結算點、清空任務/成就獎勵、累計發放與手續費
    private void settle(StakerAccount account, PoolState pool, CommissionSplit split, Instant now) {
        account.setLastClaimAt(now);
        clearBonusRewards(account);
        pool.setTotalRewardsPaid(pool.getTotalRewardsPaid().add(split.net()));
        pool.setTotalCommission(pool.getTotalCommission().add(split.fee()));
        pool.setUpdatedAt(now);
    }

    private void clearBonusRewards(StakerAccount account) {
        account.setQuestRewards(Amounts.ZERO);
        account.setAchievementRewards(Amounts.ZERO);
    }

    private void enforceDailyLimit(StakerAccount account, BigDecimal net, Instant now) {
        Instant windowStart = account.getWithdrawWindowStart();
        if (windowStart == null || !now.isBefore(windowStart.plus(properties.withdrawalWindow()))) {
            account.setWithdrawWindowStart(now);
            account.setTotalWithdrawnToday(Amounts.ZERO);
        }
        BigDecimal after = account.getTotalWithdrawnToday().add(net);
        if (after.compareTo(properties.dailyWithdrawalLimit()) > 0) {
            throw new StakingException(StakingError.DAILY_LIMIT_EXCEEDED,
                    String.format("超過每日提領上限 %s（窗口內已領 %s，本次 %s）",
                            properties.dailyWithdrawalLimit(), account.getTotalWithdrawnToday(), net));
        }
        account.setTotalWithdrawnToday(after);
    }

    private void requireUnlocked(List<StakeDeposit> deposits, List<ActiveSkill> skills, Instant now) {
        for (StakeDeposit deposit : deposits) {
            Duration lock = calculator.calculateReducedLockTime(deposit.getLockupDuration(), skills);
            Instant unlockAt = deposit.getDepositedAt().plus(lock);
            if (now.isBefore(unlockAt)) {
                throw new StakingException(StakingError.FUNDS_ARE_LOCKED,
                        String.format("存款 #%d 鎖倉至 %s", deposit.getId(), unlockAt));
            }
        }
    }

    // 獎勵只能從準備金支付（託管餘額扣除所有本金）
    private void requireRewardReserve(PoolState pool, BigDecimal required) {
        if (!Amounts.isPositive(required)) {
            return;
        }
        BigDecimal reserve = settlementPort.custodyBalance().subtract(pool.getTotalPoolBalance());
        if (reserve.compareTo(required) < 0) {
            throw new StakingException(StakingError.INSUFFICIENT_POOL_BALANCE,
                    String.format("獎勵準備金不足：需要 %s，目前 %s", required, reserve.max(Amounts.ZERO)));
        }
    }

    private void requireNotMigrated(PoolState pool) {
        if (pool.isMigrated()) {
            throw new StakingException(StakingError.POOL_MIGRATED);
        }
    }

    private void collectFrom(String staker, BigDecimal amount) {
        try {
            settlementPort.collect(staker, amount);
        } catch (InsufficientFundsException e) {
            throw new StakingException(StakingError.INSUFFICIENT_FUNDS, "收款失敗: " + e.getMessage(), e);
        }
    }

    private void payOut(String staker, BigDecimal amount) {
        try {
            settlementPort.transfer(staker, amount);
        } catch (InsufficientFundsException e) {
            throw new StakingException(StakingError.INSUFFICIENT_FUNDS, "轉帳給用戶失敗: " + e.getMessage(), e);
        }
    }

    private record PendingReward(BigDecimal accrued, BigDecimal bonus, BigDecimal gross) {}
}
