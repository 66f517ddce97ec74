package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.model.dto.PoolSnapshot;
import com.aiinpocket.stakepool.model.dto.RewardBreakdown;
import com.aiinpocket.stakepool.model.dto.UserStakingInfo;
import com.aiinpocket.stakepool.model.entity.ActiveSkill;
import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.model.entity.StakeDeposit;
import com.aiinpocket.stakepool.model.entity.StakerAccount;
import com.aiinpocket.stakepool.model.entity.UserActivity;
import com.aiinpocket.stakepool.settlement.SettlementPort;
import com.aiinpocket.stakepool.util.Amounts;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 唯讀查詢：目前獎勵、用戶資訊、資金池快照。
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class StakingQueryService {

    private final DepositLedgerService ledger;
    private final AccessPolicy accessPolicy;
    private final SkillBoostService skillBoostService;
    private final RewardCalculator calculator;
    private final AntiFraudService antiFraud;
    private final PoolStateService poolStateService;
    private final SettlementPort settlementPort;
    private final Clock clock;

    public BigDecimal calculateRewards(String user) {
        String staker = accessPolicy.requireAddress(user);
        return calculator.calculateRewards(ledger.listDeposits(staker), checkpoint(staker), clock.instant());
    }

    public BigDecimal calculateBoostedRewards(String user) {
        String staker = accessPolicy.requireAddress(user);
        return calculator.calculateBoostedRewards(ledger.listDeposits(staker),
                skillBoostService.activeSkills(staker), checkpoint(staker), clock.instant());
    }

    public BigDecimal calculateBoostedRewardsWithRarityMultiplier(String user) {
        String staker = accessPolicy.requireAddress(user);
        return calculator.calculateBoostedRewardsWithRarityMultiplier(ledger.listDeposits(staker),
                skillBoostService.activeSkills(staker), checkpoint(staker), clock.instant());
    }

    public RewardBreakdown rewardBreakdown(String user) {
        String staker = accessPolicy.requireAddress(user);
        Instant now = clock.instant();
        Instant checkpoint = checkpoint(staker);
        List<StakeDeposit> deposits = ledger.listDeposits(staker);
        List<ActiveSkill> skills = skillBoostService.activeSkills(staker);
        BigDecimal bonus = ledger.findAccount(staker)
                .map(StakerAccount::getPendingBonusRewards)
                .orElse(Amounts.ZERO);
        return new RewardBreakdown(
                staker,
                calculator.calculateRewards(deposits, checkpoint, now),
                calculator.calculateBoostedRewards(deposits, skills, checkpoint, now),
                calculator.calculateBoostedRewardsWithRarityMultiplier(deposits, skills, checkpoint, now),
                bonus,
                calculator.totalBoostBps(skills),
                calculator.calculateFeeDiscount(skills));
    }

    public UserStakingInfo getUserInfo(String user) {
        String staker = accessPolicy.requireAddress(user);
        Instant now = clock.instant();
        Optional<StakerAccount> account = ledger.findAccount(staker);
        Optional<UserActivity> activity = antiFraud.getActivity(staker);
        List<StakeDeposit> deposits = ledger.listDeposits(staker);
        List<ActiveSkill> skills = skillBoostService.activeSkills(staker);
        Instant checkpoint = account.map(StakerAccount::getLastClaimAt).orElse(null);

        BigDecimal pending = calculator.calculateBoostedRewardsWithRarityMultiplier(deposits, skills, checkpoint, now)
                .add(account.map(StakerAccount::getPendingBonusRewards).orElse(Amounts.ZERO));
        List<UserStakingInfo.DepositView> views = deposits.stream()
                .map(d -> new UserStakingInfo.DepositView(d.getId(), d.getAmount(), d.getDepositedAt(),
                        d.getLockupDays(), d.getRateBps(),
                        d.getDepositedAt().plus(calculator.calculateReducedLockTime(d.getLockupDuration(), skills))))
                .toList();

        return new UserStakingInfo(
                staker,
                deposits.stream().map(StakeDeposit::getAmount).reduce(Amounts.ZERO, BigDecimal::add),
                deposits.size(),
                pending,
                account.map(StakerAccount::getTotalWithdrawnToday).orElse(Amounts.ZERO),
                account.map(StakerAccount::isAutoCompoundEnabled).orElse(false),
                checkpoint,
                skills.size(),
                activity.map(UserActivity::isBanned).orElse(false),
                activity.map(UserActivity::isFlagged).orElse(false),
                views);
    }

    public PoolSnapshot getPoolSnapshot() {
        Optional<PoolState> state = poolStateService.find();
        BigDecimal principal = state.map(PoolState::getTotalPoolBalance).orElse(Amounts.ZERO);
        BigDecimal custody = settlementPort.custodyBalance();
        return new PoolSnapshot(
                principal,
                custody,
                custody.subtract(principal),
                state.map(PoolState::getUniqueUsersCount).orElse(0L),
                state.map(PoolState::isPaused).orElse(false),
                state.map(PoolState::isMigrated).orElse(false),
                state.map(PoolState::getTreasury).orElse(null),
                state.map(PoolState::getTotalRewardsPaid).orElse(Amounts.ZERO),
                state.map(PoolState::getTotalCommission).orElse(Amounts.ZERO));
    }

    public List<StakeDeposit> listDeposits(String user) {
        String staker = accessPolicy.requireAddress(user);
        return ledger.listDeposits(staker);
    }

    private Instant checkpoint(String staker) {
        return ledger.findAccount(staker).map(StakerAccount::getLastClaimAt).orElse(null);
    }
}
