package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.AbstractStakingIntegrationTest;
import com.aiinpocket.stakepool.config.CacheConfig;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.dto.CompoundReceipt;
import com.aiinpocket.stakepool.model.dto.DepositReceipt;
import com.aiinpocket.stakepool.model.dto.UserStakingInfo;
import com.aiinpocket.stakepool.model.dto.WithdrawalReceipt;
import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.model.entity.StakeDeposit;
import com.aiinpocket.stakepool.model.entity.UserActivity;
import com.aiinpocket.stakepool.model.enums.Rarity;
import com.aiinpocket.stakepool.model.enums.SkillType;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import com.aiinpocket.stakepool.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayName("StakingService 整合測試")
class StakingServiceIntegrationTest extends AbstractStakingIntegrationTest {

    @Autowired
    private ReentrancyGuard guard;

    private static void assertError(Throwable thrown, StakingError expected) {
        assertThat(thrown).isInstanceOf(StakingException.class);
        assertThat(((StakingException) thrown).getError()).isEqualTo(expected);
    }

    @Nested
    @DisplayName("存款")
    class DepositTests {

        @Test
        @DisplayName("存入 100 扣 6% 手續費，本金 94 入帳，手續費轉入金庫")
        void depositChargesCommission() {
            // When
            DepositReceipt receipt = stakingService.deposit(ALICE, amount("100"), 0);

            // Then
            assertThat(receipt.principal()).isEqualByComparingTo("94");
            assertThat(receipt.commission()).isEqualByComparingTo("6");
            assertThat(receipt.rateBps()).isEqualTo(1000);
            assertThat(receipt.depositCount()).isEqualTo(1);
            assertThat(poolBalance()).isEqualByComparingTo("94");
            assertThat(settlement.receivedBy(TREASURY)).isEqualByComparingTo("6");
            assertThat(settlement.custodyBalance()).isEqualByComparingTo("94");
            assertThat(eventRepo.countByStakerAddressAndEventType(ALICE, StakingEventType.DEPOSIT)).isEqualTo(1);
        }

        @Test
        @DisplayName("金額上下限以扣費前金額判斷，失敗不留下任何狀態")
        void rejectsOutOfRangeAmounts() {
            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("4.99"), 0)),
                    StakingError.DEPOSIT_TOO_LOW);
            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("10000.01"), 0)),
                    StakingError.DEPOSIT_TOO_HIGH);
            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("0"), 0)),
                    StakingError.INVALID_AMOUNT);

            assertThat(depositRepo.count()).isZero();
            assertThat(poolBalance()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("最低金額 5 可以存入（扣費後本金 4.7）")
        void acceptsMinimumDeposit() {
            DepositReceipt receipt = stakingService.deposit(ALICE, amount("5"), 0);

            assertThat(receipt.principal()).isEqualByComparingTo("4.7");
        }

        @Test
        @DisplayName("不支援的鎖倉天數被拒絕")
        void rejectsInvalidLockup() {
            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("100"), 45)),
                    StakingError.INVALID_LOCKUP_DURATION);
        }

        @Test
        @DisplayName("停用的級距不接受新存款，既有存款不受影響")
        void rejectsInactiveTier() {
            stakingService.deposit(ALICE, amount("100"), 90);
            tierRegistry.toggleTierStatus(OWNER, 90);

            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("100"), 90)),
                    StakingError.TIER_INACTIVE);
            assertThat(ledger.depositCount(ALICE)).isEqualTo(1);
        }

        @Test
        @DisplayName("第 301 筆存款被拒絕")
        void rejectsDepositBeyondMaximum() {
            // Given: 直接寫入 300 筆存款
            List<StakeDeposit> deposits = new ArrayList<>();
            for (int i = 0; i < 300; i++) {
                deposits.add(StakeDeposit.builder()
                        .stakerAddress(ALICE)
                        .amount(amount("1"))
                        .depositedAt(MutableClock.START)
                        .lockupDays(0)
                        .rateBps(1000)
                        .build());
            }
            depositRepo.saveAll(deposits);

            // When / Then
            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("100"), 0)),
                    StakingError.MAX_DEPOSITS_REACHED);
            assertThat(depositRepo.countByStakerAddress(ALICE)).isEqualTo(300);
        }

        @Test
        @DisplayName("不重複用戶數只在地址第一次存款時增加，提領後也不減少")
        void uniqueUsersCountedOnce() {
            stakingService.deposit(ALICE, amount("100"), 0);
            stakingService.deposit(ALICE, amount("100"), 0);
            stakingService.deposit(BOB, amount("100"), 0);
            fundReserve("10");
            stakingService.withdrawAll(ALICE);
            stakingService.deposit(ALICE, amount("100"), 0);

            assertThat(poolRepo.findAll().get(0).getUniqueUsersCount()).isEqualTo(2L);
        }

        @Test
        @DisplayName("大小寫與空白不同的同一地址共用一份帳本")
        void addressesAreCaseInsensitive() {
            stakingService.deposit("0xAlice", amount("100"), 0);
            stakingService.deposit(" 0xALICE ", amount("100"), 0);

            assertThat(ledger.depositCount(ALICE)).isEqualTo(2);
            assertThat(accountRepo.count()).isEqualTo(1);
            assertThat(poolRepo.findAll().get(0).getUniqueUsersCount()).isEqualTo(1L);
            assertThat(queryService.getUserInfo("0XALICE").totalDeposited()).isEqualByComparingTo("188");
        }

        @Test
        @DisplayName("資金池遷移後拒絕新存款，提領仍可進行")
        void migratedPoolRejectsDeposits() {
            stakingService.deposit(ALICE, amount("100"), 0);
            poolAdminService.markMigrated(OWNER);

            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("100"), 0)),
                    StakingError.POOL_MIGRATED);
            fundReserve("10");
            clock.advance(Duration.ofDays(1));
            assertThat(stakingService.withdrawAll(ALICE).principal()).isEqualByComparingTo("94");
        }
    }

    @Nested
    @DisplayName("獎勵計算")
    class RewardTests {

        @Test
        @DisplayName("365 天鎖倉一年後獎勵為本金 25%")
        void fullYearReward() {
            stakingService.deposit(ALICE, amount("1000"), 365);
            clock.advance(Duration.ofDays(365));

            assertThat(queryService.calculateRewards(ALICE)).isEqualByComparingTo("235");
        }

        @Test
        @DisplayName("1500 bps 加成技能讓獎勵變為 1.15 倍，EPIC 稀有度再乘 3")
        void boostedRewards() {
            stakingService.deposit(ALICE, amount("1000"), 365);
            skillBoostService.notifySkillActivation(NOTIFIER, ALICE, 1L, SkillType.STAKE_BOOST_I, 1500, Rarity.EPIC);
            clock.advance(Duration.ofDays(365));

            assertThat(queryService.calculateBoostedRewards(ALICE)).isEqualByComparingTo("270.25");
            assertThat(queryService.calculateBoostedRewardsWithRarityMultiplier(ALICE)).isEqualByComparingTo("340.75");
        }

        @Test
        @DisplayName("調整級距利率不影響已存在的存款")
        void tierChangeIsNotRetroactive() {
            stakingService.deposit(ALICE, amount("1000"), 365);
            tierRegistry.setTierApy(OWNER, 365, 5000);
            stakingService.deposit(BOB, amount("1000"), 365);
            clock.advance(Duration.ofDays(365));

            assertThat(queryService.calculateRewards(ALICE)).isEqualByComparingTo("235");
            assertThat(queryService.calculateRewards(BOB)).isEqualByComparingTo("470");
        }

        @Test
        @DisplayName("非管理員不能調整利率，超過 10000 bps 被拒絕")
        void tierAdminGuards() {
            assertError(catchThrowable(() -> tierRegistry.setTierApy(ALICE, 365, 3000)),
                    StakingError.UNAUTHORIZED);
            assertError(catchThrowable(() -> tierRegistry.setTierApy(OWNER, 365, 10_001)),
                    StakingError.INVALID_APY);
            assertThat(tierRegistry.rateFor(365)).isEqualTo(2500);
        }
    }

    @Nested
    @DisplayName("提領")
    class WithdrawTests {

        @Test
        @DisplayName("一年後提領獎勵：扣手續費後轉給用戶，再次提領沒有獎勵")
        void withdrawRewards() {
            // Given
            stakingService.deposit(ALICE, amount("1000"), 365);
            fundReserve("500");
            clock.advance(Duration.ofDays(365));

            // When
            WithdrawalReceipt receipt = stakingService.withdraw(ALICE);

            // Then
            assertThat(receipt.grossReward()).isEqualByComparingTo("235");
            assertThat(receipt.commission()).isEqualByComparingTo("14.1");
            assertThat(receipt.netReward()).isEqualByComparingTo("220.9");
            assertThat(settlement.receivedBy(ALICE)).isEqualByComparingTo("220.9");
            assertThat(settlement.receivedBy(TREASURY)).isEqualByComparingTo("74.1");
            assertThat(poolBalance()).isEqualByComparingTo("940");
            assertThat(poolRepo.findAll().get(0).getTotalRewardsPaid()).isEqualByComparingTo("220.9");

            assertError(catchThrowable(() -> stakingService.withdraw(ALICE)), StakingError.NO_REWARDS_AVAILABLE);
        }

        @Test
        @DisplayName("沒有存款也沒有獎勵時提領失敗")
        void withdrawWithoutRewards() {
            assertError(catchThrowable(() -> stakingService.withdraw(ALICE)), StakingError.NO_REWARDS_AVAILABLE);
        }

        @Test
        @DisplayName("滾動 24 小時內淨提領超過 1000 被拒絕，窗口過後恢復")
        void dailyLimit() {
            // Given
            stakingService.deposit(ALICE, amount("1000"), 0);
            fundReserve("5000");
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("700"));
            WithdrawalReceipt first = stakingService.withdraw(ALICE);
            assertThat(first.netReward()).isEqualByComparingTo("658");

            // When
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("700"));
            Throwable thrown = catchThrowable(() -> stakingService.withdraw(ALICE));

            // Then
            assertError(thrown, StakingError.DAILY_LIMIT_EXCEEDED);
            assertThat(settlement.receivedBy(ALICE)).isEqualByComparingTo("658");
            assertThat(accountRepo.findById(ALICE).orElseThrow().getQuestRewards()).isEqualByComparingTo("700");

            clock.advance(Duration.ofHours(24));
            WithdrawalReceipt later = stakingService.withdraw(ALICE);
            assertThat(accountRepo.findById(ALICE).orElseThrow().getTotalWithdrawnToday())
                    .isEqualByComparingTo(later.netReward());
        }

        @Test
        @DisplayName("獎勵準備金不足時拒絕，不影響帳本")
        void insufficientRewardReserve() {
            stakingService.deposit(ALICE, amount("100"), 0);
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("10"));

            assertError(catchThrowable(() -> stakingService.withdraw(ALICE)), StakingError.INSUFFICIENT_POOL_BALANCE);
            assertThat(accountRepo.findById(ALICE).orElseThrow().getQuestRewards()).isEqualByComparingTo("10");
            assertThat(settlement.custodyBalance()).isEqualByComparingTo("94");
        }

        @Test
        @DisplayName("轉帳給用戶失敗時整筆回滾，金庫也不會收到手續費")
        void failedTransferRollsBack() {
            // Given
            stakingService.deposit(ALICE, amount("100"), 0);
            fundReserve("100");
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("10"));
            settlement.rejectTransfersTo(ALICE);

            // When
            Throwable thrown = catchThrowable(() -> stakingService.withdraw(ALICE));

            // Then
            assertError(thrown, StakingError.INSUFFICIENT_FUNDS);
            PoolState pool = poolRepo.findAll().get(0);
            assertThat(pool.getTotalRewardsPaid()).isEqualByComparingTo("0");
            assertThat(pool.getTotalPoolBalance()).isEqualByComparingTo("94");
            assertThat(settlement.receivedBy(TREASURY)).isEqualByComparingTo("6");
            assertThat(accountRepo.findById(ALICE).orElseThrow().getQuestRewards()).isEqualByComparingTo("10");
            assertThat(ledger.depositCount(ALICE)).isEqualTo(1);
        }

        @Test
        @DisplayName("轉帳期間重入呼叫被拒絕，外層操作照常完成")
        void reentrantCallIsRejected() {
            // Given
            stakingService.deposit(ALICE, amount("100"), 0);
            fundReserve("100");
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("10"));
            AtomicReference<Throwable> nested = new AtomicReference<>();
            settlement.onTransfer(to -> {
                if (ALICE.equals(to) && nested.get() == null) {
                    nested.set(catchThrowable(() -> stakingService.withdraw(ALICE)));
                }
            });

            // When
            WithdrawalReceipt receipt = stakingService.withdraw(ALICE);

            // Then
            assertError(nested.get(), StakingError.REENTRANCY_DETECTED);
            assertThat(receipt.netReward()).isEqualByComparingTo("9.4");
            assertThat(settlement.receivedBy(ALICE)).isEqualByComparingTo("9.4");
        }
    }

    @Nested
    @DisplayName("全額提領")
    class WithdrawAllTests {

        @Test
        @DisplayName("鎖倉期內拒絕，到期後領回本金加獎勵並清空存款")
        void withdrawAllAfterLockup() {
            // Given
            stakingService.deposit(ALICE, amount("100"), 30);
            fundReserve("10");
            assertError(catchThrowable(() -> stakingService.withdrawAll(ALICE)), StakingError.FUNDS_ARE_LOCKED);

            // When
            clock.advance(Duration.ofDays(30));
            WithdrawalReceipt receipt = stakingService.withdrawAll(ALICE);

            // Then
            assertThat(receipt.principal()).isEqualByComparingTo("94");
            assertThat(receipt.grossReward()).isPositive();
            assertThat(receipt.netReward().add(receipt.commission())).isEqualByComparingTo(receipt.grossReward());
            assertThat(receipt.payout()).isEqualByComparingTo(receipt.principal().add(receipt.netReward()));
            assertThat(settlement.receivedBy(ALICE)).isEqualByComparingTo(receipt.payout());
            assertThat(depositRepo.countByStakerAddress(ALICE)).isZero();
            assertThat(poolBalance()).isEqualByComparingTo("0");

            assertError(catchThrowable(() -> stakingService.withdraw(ALICE)), StakingError.NO_REWARDS_AVAILABLE);
            assertError(catchThrowable(() -> stakingService.withdrawAll(ALICE)), StakingError.NO_DEPOSITS_FOUND);
        }

        @Test
        @DisplayName("鎖倉縮短技能讓 30 天鎖倉 15 天後即可提領")
        void lockReductionSkill() {
            stakingService.deposit(ALICE, amount("100"), 30);
            skillBoostService.notifySkillActivation(NOTIFIER, ALICE, 7L, SkillType.LOCK_REDUCER, 5000, Rarity.COMMON);
            fundReserve("10");

            clock.advance(Duration.ofDays(15).minusSeconds(1));
            assertError(catchThrowable(() -> stakingService.withdrawAll(ALICE)), StakingError.FUNDS_ARE_LOCKED);

            clock.advance(Duration.ofSeconds(1));
            assertThat(stakingService.withdrawAll(ALICE).principal()).isEqualByComparingTo("94");
        }

        @Test
        @DisplayName("全額提領的本金不計入每日上限")
        void withdrawAllPrincipalIsExemptFromDailyLimit() {
            stakingService.deposit(ALICE, amount("10000"), 0);
            stakingService.deposit(ALICE, amount("5000"), 0);
            fundReserve("10");
            clock.advance(Duration.ofDays(1));

            WithdrawalReceipt receipt = stakingService.withdrawAll(ALICE);

            assertThat(receipt.principal()).isEqualByComparingTo("14100");
            assertThat(receipt.netReward()).isPositive().isLessThan(amount("1000"));
            assertThat(accountRepo.findById(ALICE).orElseThrow().getTotalWithdrawnToday())
                    .isEqualByComparingTo(receipt.netReward());
        }

        @Test
        @DisplayName("全額提領的獎勵超過每日上限被拒絕，存款保持原狀")
        void withdrawAllRewardIsCapped() {
            // Given: 本金 18800，一年獎勵 1880，扣費後 1767.2
            stakingService.deposit(ALICE, amount("10000"), 0);
            stakingService.deposit(ALICE, amount("10000"), 0);
            fundReserve("5000");
            clock.advance(Duration.ofDays(365));
            assertError(catchThrowable(() -> stakingService.withdraw(ALICE)), StakingError.DAILY_LIMIT_EXCEEDED);

            // When
            Throwable thrown = catchThrowable(() -> stakingService.withdrawAll(ALICE));

            // Then
            assertError(thrown, StakingError.DAILY_LIMIT_EXCEEDED);
            assertThat(ledger.depositCount(ALICE)).isEqualTo(2);
            assertThat(poolBalance()).isEqualByComparingTo("18800");
            assertThat(settlement.receivedBy(ALICE)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("窗口內已領過的獎勵會併入全額提領的上限計算")
        void withdrawAllCountsEarlierWithdrawals() {
            stakingService.deposit(ALICE, amount("1000"), 0);
            fundReserve("5000");
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("700"));
            stakingService.withdraw(ALICE);
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("700"));

            assertError(catchThrowable(() -> stakingService.withdrawAll(ALICE)), StakingError.DAILY_LIMIT_EXCEEDED);

            clock.advance(Duration.ofHours(24));
            assertThat(stakingService.withdrawAll(ALICE).principal()).isEqualByComparingTo("940");
        }
    }

    @Nested
    @DisplayName("複利")
    class CompoundTests {

        @Test
        @DisplayName("獎勵扣手續費後轉為無鎖倉新存款，本金總額與存款加總一致")
        void compoundAppendsDeposit() {
            // Given
            stakingService.deposit(ALICE, amount("1000"), 365);
            fundReserve("1000");
            clock.advance(Duration.ofDays(365));

            // When
            CompoundReceipt receipt = stakingService.compound(ALICE);

            // Then
            assertThat(receipt.grossReward()).isEqualByComparingTo("235");
            assertThat(receipt.reinvested()).isEqualByComparingTo("220.9");
            assertThat(receipt.depositCount()).isEqualTo(2);
            List<StakeDeposit> deposits = ledger.listDeposits(ALICE);
            assertThat(deposits.get(1).getLockupDays()).isZero();
            assertThat(deposits.get(1).getRateBps()).isEqualTo(1000);
            assertThat(poolBalance()).isEqualByComparingTo("1160.9");
            assertThat(poolBalance()).isEqualByComparingTo(sumOfDeposits());

            assertError(catchThrowable(() -> stakingService.compound(ALICE)), StakingError.NO_REWARDS_AVAILABLE);
        }

        @Test
        @DisplayName("已有 300 筆存款時複利被拒絕，獎勵保留")
        void compoundRespectsDepositCap() {
            // Given
            List<StakeDeposit> deposits = new ArrayList<>();
            for (int i = 0; i < 300; i++) {
                deposits.add(StakeDeposit.builder()
                        .stakerAddress(ALICE)
                        .amount(amount("1"))
                        .depositedAt(MutableClock.START)
                        .lockupDays(0)
                        .rateBps(1000)
                        .build());
            }
            depositRepo.saveAll(deposits);
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("10"));
            fundReserve("100");

            // When
            Throwable thrown = catchThrowable(() -> stakingService.compound(ALICE));

            // Then
            assertError(thrown, StakingError.MAX_DEPOSITS_REACHED);
            assertThat(depositRepo.countByStakerAddress(ALICE)).isEqualTo(300);
            assertThat(accountRepo.findById(ALICE).orElseThrow().getQuestRewards()).isEqualByComparingTo("10");
            assertThat(settlement.receivedBy(TREASURY)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("獎勵準備金不足時複利失敗")
        void compoundNeedsReserve() {
            stakingService.deposit(ALICE, amount("1000"), 365);
            clock.advance(Duration.ofDays(365));

            assertError(catchThrowable(() -> stakingService.compound(ALICE)), StakingError.INSUFFICIENT_POOL_BALANCE);
            assertThat(ledger.depositCount(ALICE)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("封鎖與緊急控制")
    class ControlTests {

        @Test
        @DisplayName("被封鎖的用戶所有操作都被拒絕，解除後恢復")
        void bannedUserIsRejected() {
            stakingService.deposit(ALICE, amount("100"), 0);
            antiFraud.banUser(OWNER, ALICE, "bot");

            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("100"), 0)), StakingError.USER_IS_BANNED);
            assertError(catchThrowable(() -> stakingService.withdraw(ALICE)), StakingError.USER_IS_BANNED);
            assertError(catchThrowable(() -> stakingService.compound(ALICE)), StakingError.USER_IS_BANNED);
            assertThat(stakingService.deposit(BOB, amount("100"), 0).principal()).isEqualByComparingTo("94");

            // 查詢不受封鎖影響
            clock.advance(Duration.ofDays(365));
            assertThat(queryService.calculateRewards(ALICE)).isEqualByComparingTo("9.4");
            UserStakingInfo info = queryService.getUserInfo(ALICE);
            assertThat(info.banned()).isTrue();
            assertThat(info.depositCount()).isEqualTo(1);
            assertThat(info.totalDeposited()).isEqualByComparingTo("94");

            antiFraud.unbanUser(OWNER, ALICE);
            assertThat(stakingService.deposit(ALICE, amount("100"), 0).depositCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("只有管理員可以封鎖與暫停")
        void onlyOwnerCanBanOrPause() {
            assertError(catchThrowable(() -> antiFraud.banUser(BOB, ALICE, "x")), StakingError.UNAUTHORIZED);
            assertError(catchThrowable(() -> emergencyControl.pause(BOB)), StakingError.UNAUTHORIZED);
            assertThat(emergencyControl.isPaused()).isFalse();
        }

        @Test
        @DisplayName("暫停期間一般操作被拒絕，緊急提領只退本金")
        void pauseAndEmergencyWithdraw() {
            // Given
            stakingService.deposit(ALICE, amount("100"), 365);
            fundReserve("100");
            assertError(catchThrowable(() -> stakingService.emergencyWithdraw(ALICE)), StakingError.NOT_PAUSED);
            emergencyControl.pause(OWNER);
            clock.advance(Duration.ofDays(30));

            // Then
            assertError(catchThrowable(() -> stakingService.deposit(ALICE, amount("100"), 0)), StakingError.CONTRACT_PAUSED);
            assertError(catchThrowable(() -> stakingService.withdraw(ALICE)), StakingError.CONTRACT_PAUSED);
            assertError(catchThrowable(() -> stakingService.withdrawAll(ALICE)), StakingError.CONTRACT_PAUSED);

            WithdrawalReceipt receipt = stakingService.emergencyWithdraw(ALICE);
            assertThat(receipt.payout()).isEqualByComparingTo("94");
            assertThat(receipt.netReward()).isEqualByComparingTo("0");
            assertThat(settlement.receivedBy(ALICE)).isEqualByComparingTo("94");
            assertThat(poolBalance()).isEqualByComparingTo("0");
            assertError(catchThrowable(() -> stakingService.emergencyWithdraw(ALICE)), StakingError.NO_DEPOSITS_FOUND);

            emergencyControl.unpause(OWNER);
            assertThat(stakingService.deposit(ALICE, amount("100"), 0).depositCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("暫停期間被封鎖的用戶也不能緊急提領")
        void bannedUserCannotEmergencyWithdraw() {
            stakingService.deposit(ALICE, amount("100"), 0);
            antiFraud.banUser(OWNER, ALICE, "fraud");
            emergencyControl.pause(OWNER);

            assertError(catchThrowable(() -> stakingService.emergencyWithdraw(ALICE)), StakingError.USER_IS_BANNED);
            assertThat(poolBalance()).isEqualByComparingTo("94");
        }
    }

    @Nested
    @DisplayName("排隊等鎖的操作")
    class QueuedOperationTests {

        @Test
        @DisplayName("等鎖期間資金池被暫停，存款取得鎖後被拒絕")
        void depositQueuedBehindPauseIsRejected() throws Exception {
            Throwable thrown = runWhileQueued(
                    () -> stakingService.deposit(ALICE, amount("100"), 0),
                    () -> {
                        PoolState pool = poolRepo.findAll().get(0);
                        pool.setPaused(true);
                        poolRepo.save(pool);
                    });

            assertError(thrown, StakingError.CONTRACT_PAUSED);
            assertThat(depositRepo.count()).isZero();
            assertThat(poolBalance()).isEqualByComparingTo("0");
            assertThat(settlement.custodyBalance()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("等鎖期間用戶被封鎖，提領取得鎖後被拒絕")
        void withdrawQueuedBehindBanIsRejected() throws Exception {
            stakingService.deposit(ALICE, amount("100"), 0);
            fundReserve("100");
            skillBoostService.creditQuestReward(NOTIFIER, ALICE, amount("10"));

            Throwable thrown = runWhileQueued(
                    () -> stakingService.withdraw(ALICE),
                    () -> {
                        UserActivity activity = activityRepo.findById(ALICE).orElseThrow();
                        activity.setBanned(true);
                        activityRepo.save(activity);
                    });

            assertError(thrown, StakingError.USER_IS_BANNED);
            assertThat(settlement.receivedBy(ALICE)).isEqualByComparingTo("0");
            assertThat(accountRepo.findById(ALICE).orElseThrow().getQuestRewards()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("等鎖期間級距利率被調整，存款使用新利率")
        void depositQueuedBehindRateChangeUsesNewRate() throws Exception {
            ExecutorService worker = Executors.newSingleThreadExecutor();
            try {
                Future<DepositReceipt> pending = guard.execute("hold", () -> {
                    Future<DepositReceipt> submitted = worker.submit(() -> stakingService.deposit(ALICE, amount("100"), 365));
                    awaitQueued();
                    tierRepo.findById(365).ifPresent(tier -> {
                        tier.setBaseApyBps(4000);
                        tierRepo.save(tier);
                    });
                    cacheManager.getCache(CacheConfig.LOCKUP_TIERS).clear();
                    return submitted;
                });

                assertThat(pending.get(10, TimeUnit.SECONDS).rateBps()).isEqualTo(4000);
            } finally {
                worker.shutdownNow();
            }
        }

        // 測試執行緒持有鎖，另一個執行緒排隊後才改狀態，再放開鎖
        private Throwable runWhileQueued(Supplier<?> operation, Runnable changeWhileQueued) throws Exception {
            ExecutorService worker = Executors.newSingleThreadExecutor();
            try {
                Future<Throwable> pending = guard.execute("hold", () -> {
                    Future<Throwable> submitted = worker.submit(() -> catchThrowable(operation::get));
                    awaitQueued();
                    changeWhileQueued.run();
                    return submitted;
                });
                return pending.get(10, TimeUnit.SECONDS);
            } finally {
                worker.shutdownNow();
            }
        }

        private void awaitQueued() {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (guard.queueLength() == 0) {
                if (System.nanoTime() > deadline) {
                    throw new IllegalStateException("operation never queued on the guard");
                }
                Thread.onSpinWait();
            }
        }
    }

    @Test
    @DisplayName("混合操作後資金池本金永遠等於所有存款加總")
    void poolBalanceMatchesDeposits() {
        fundReserve("1000");
        stakingService.deposit(ALICE, amount("250"), 30);
        stakingService.deposit(BOB, amount("1000"), 0);
        stakingService.deposit(CAROL, amount("77.77"), 90);
        clock.advance(Duration.ofDays(31));
        stakingService.compound(BOB);
        stakingService.withdrawAll(ALICE);
        stakingService.withdraw(CAROL);

        assertThat(poolBalance()).isEqualByComparingTo(sumOfDeposits());
        assertThat(settlement.custodyBalance()).isGreaterThanOrEqualTo(poolBalance());
    }
}
