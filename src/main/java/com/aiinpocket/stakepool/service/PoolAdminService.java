package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import com.aiinpocket.stakepool.settlement.SettlementPort;
import com.aiinpocket.stakepool.util.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * 資金池管理操作：更換金庫、標記遷移、注資獎勵準備金。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolAdminService {

    private final PoolStateService poolStateService;
    private final AccessPolicy accessPolicy;
    private final GuardedOperationExecutor executor;
    private final SettlementPort settlementPort;
    private final StakingEventRecorder eventRecorder;
    private final Clock clock;

    public PoolState changeTreasury(String caller, String newTreasury) {
        accessPolicy.requireOwner(caller);
        String treasury = accessPolicy.requireAddress(newTreasury);
        return executor.execute("changeTreasury", () -> {
            PoolState pool = poolStateService.current();
            String previous = pool.getTreasury();
            pool.setTreasury(treasury);
            pool.setUpdatedAt(clock.instant());
            eventRecorder.record(caller, StakingEventType.TREASURY_CHANGED, previous + " -> " + treasury);
            log.info("[資金池] 金庫地址 {} -> {}", previous, treasury);
            return pool;
        });
    }

    /**
     * 標記資金池已遷移：之後不再接受新存款與複利，既有用戶仍可提領。
     */
    public PoolState markMigrated(String caller) {
        accessPolicy.requireOwner(caller);
        return executor.execute("markMigrated", () -> {
            PoolState pool = poolStateService.current();
            pool.setMigrated(true);
            pool.setUpdatedAt(clock.instant());
            eventRecorder.record(caller, StakingEventType.POOL_MIGRATED, null);
            log.warn("[資金池] 管理員 {} 標記資金池已遷移", caller);
            return pool;
        });
    }

    /**
     * 注資獎勵準備金。資金進入託管但不計入本金，只用來支付獎勵。
     */
    public BigDecimal fundRewardReserve(String funder, BigDecimal amount) {
        String from = accessPolicy.requireAddress(funder);
        BigDecimal value = Amounts.normalize(amount);
        if (!Amounts.isPositive(value)) {
            throw new StakingException(StakingError.INVALID_AMOUNT);
        }
        return executor.execute("fundRewardReserve", () -> {
            PoolState pool = poolStateService.current();
            eventRecorder.record(from, StakingEventType.RESERVE_FUNDED, value, null);
            settlementPort.collect(from, value);
            BigDecimal reserve = settlementPort.custodyBalance().subtract(pool.getTotalPoolBalance());
            log.info("[資金池] {} 注資獎勵準備金 {}，目前準備金 {}", from, value, reserve);
            return reserve;
        });
    }
}
