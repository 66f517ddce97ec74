package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.entity.LockupTier;
import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.model.entity.StakeDeposit;
import com.aiinpocket.stakepool.model.entity.StakerAccount;
import com.aiinpocket.stakepool.repository.StakeDepositRepository;
import com.aiinpocket.stakepool.repository.StakerAccountRepository;
import com.aiinpocket.stakepool.util.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 存款帳本。
 *
 * <p>維護用戶存款清單與資金池本金總額，
 * 所有異動都在呼叫端交易內進行，確保 totalPoolBalance 永遠等於所有存款本金加總。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositLedgerService {

    private final StakeDepositRepository depositRepo;
    private final StakerAccountRepository accountRepo;
    private final PoolStateService poolStateService;
    private final TierRegistryService tierRegistry;
    private final StakingProperties properties;
    private final Clock clock;

    /**
     * 檢查存款參數，不修改任何狀態。上下限以扣手續費前的金額比較。
     */
    public LockupTier validateDeposit(BigDecimal gross, int lockupDays) {
        if (!Amounts.isPositive(gross)) {
            throw new StakingException(StakingError.INVALID_AMOUNT);
        }
        LockupTier tier = tierRegistry.requireTier(lockupDays);
        if (gross.compareTo(tier.getMinStake()) < 0) {
            throw new StakingException(StakingError.DEPOSIT_TOO_LOW,
                    String.format("存款 %s 低於最低金額 %s", gross, tier.getMinStake()));
        }
        if (gross.compareTo(tier.getMaxStake()) > 0) {
            throw new StakingException(StakingError.DEPOSIT_TOO_HIGH,
                    String.format("存款 %s 超過最高金額 %s", gross, tier.getMaxStake()));
        }
        return tier;
    }

    /**
     * 新增一筆存款並累加資金池本金。首次存款的地址計入不重複用戶數。
     */
    @Transactional
    public StakeDeposit addDeposit(String staker, BigDecimal principal, int lockupDays, int rateBps) {
        long count = depositRepo.countByStakerAddress(staker);
        if (count >= properties.maxDepositsPerUser()) {
            throw new StakingException(StakingError.MAX_DEPOSITS_REACHED,
                    String.format("每位用戶最多 %d 筆存款", properties.maxDepositsPerUser()));
        }
        Instant now = clock.instant();
        StakerAccount account = accountFor(staker);
        PoolState pool = poolStateService.current();
        if (account.getFirstDepositAt() == null) {
            account.setFirstDepositAt(now);
            pool.setUniqueUsersCount(pool.getUniqueUsersCount() + 1);
            log.info("[帳本] 新用戶 {}，目前不重複用戶數 {}", staker, pool.getUniqueUsersCount());
        }

        StakeDeposit deposit = depositRepo.save(StakeDeposit.builder()
                .stakerAddress(staker)
                .amount(principal)
                .depositedAt(now)
                .lockupDays(lockupDays)
                .rateBps(rateBps)
                .build());
        pool.setTotalPoolBalance(pool.getTotalPoolBalance().add(principal));
        pool.setUpdatedAt(now);
        accountRepo.save(account);
        return deposit;
    }

    /**
     * 依存入順序的索引移除單筆存款。
     */
    @Transactional
    public StakeDeposit removeDeposit(String staker, int index) {
        List<StakeDeposit> deposits = listDeposits(staker);
        if (index < 0 || index >= deposits.size()) {
            throw new StakingException(StakingError.NO_DEPOSITS_FOUND,
                    String.format("找不到第 %d 筆存款（共 %d 筆）", index, deposits.size()));
        }
        StakeDeposit removed = deposits.get(index);
        depositRepo.delete(removed);
        subtractFromPool(removed.getAmount());
        return removed;
    }

    /**
     * 移除用戶所有存款。
     *
     * @return 移除的本金總額（無存款時為 0）
     */
    @Transactional
    public BigDecimal removeAll(String staker) {
        List<StakeDeposit> deposits = listDeposits(staker);
        if (deposits.isEmpty()) {
            return Amounts.ZERO;
        }
        BigDecimal principal = sum(deposits);
        depositRepo.deleteAll(deposits);
        subtractFromPool(principal);
        log.debug("[帳本] 移除 {} 的 {} 筆存款，本金 {}", staker, deposits.size(), principal);
        return principal;
    }

    @Transactional(readOnly = true)
    public List<StakeDeposit> listDeposits(String staker) {
        return depositRepo.findByStakerAddressOrderByIdAsc(staker);
    }

    @Transactional(readOnly = true)
    public BigDecimal totalDeposited(String staker) {
        return sum(listDeposits(staker));
    }

    @Transactional(readOnly = true)
    public int depositCount(String staker) {
        return (int) depositRepo.countByStakerAddress(staker);
    }

    /**
     * 取得（必要時建立）用戶帳戶。
     */
    @Transactional
    public StakerAccount accountFor(String staker) {
        return accountRepo.findById(staker).orElseGet(() -> accountRepo.save(StakerAccount.builder()
                .address(staker)
                .createdAt(clock.instant())
                .build()));
    }

    @Transactional(readOnly = true)
    public Optional<StakerAccount> findAccount(String staker) {
        return accountRepo.findById(staker);
    }

    private void subtractFromPool(BigDecimal principal) {
        PoolState pool = poolStateService.current();
        pool.setTotalPoolBalance(pool.getTotalPoolBalance().subtract(principal));
        pool.setUpdatedAt(clock.instant());
    }

    private static BigDecimal sum(List<StakeDeposit> deposits) {
        return deposits.stream()
                .map(StakeDeposit::getAmount)
                .reduce(Amounts.ZERO, BigDecimal::add);
    }
}
