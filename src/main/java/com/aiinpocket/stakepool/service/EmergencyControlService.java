package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 緊急暫停開關。
 * 暫停期間所有一般操作都被拒絕，只剩緊急提領（只退本金）可用。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmergencyControlService {

    private final PoolStateService poolStateService;
    private final AccessPolicy accessPolicy;
    private final GuardedOperationExecutor executor;
    private final StakingEventRecorder eventRecorder;
    private final Clock clock;

    public void pause(String caller) {
        accessPolicy.requireOwner(caller);
        executor.run("pause", () -> setPaused(caller, true));
    }

    public void unpause(String caller) {
        accessPolicy.requireOwner(caller);
        executor.run("unpause", () -> setPaused(caller, false));
    }

    public boolean isPaused() {
        return poolStateService.isPaused();
    }

    public void requireNotPaused() {
        if (isPaused()) {
            throw new StakingException(StakingError.CONTRACT_PAUSED);
        }
    }

    public void requirePaused() {
        if (!isPaused()) {
            throw new StakingException(StakingError.NOT_PAUSED);
        }
    }

    private void setPaused(String caller, boolean paused) {
        PoolState pool = poolStateService.current();
        if (pool.isPaused() == paused) {
            log.info("[緊急控制] 資金池已是{}狀態，略過", paused ? "暫停" : "運作");
            return;
        }
        pool.setPaused(paused);
        pool.setUpdatedAt(clock.instant());
        eventRecorder.record(caller, paused ? StakingEventType.POOL_PAUSED : StakingEventType.POOL_UNPAUSED, null);
        if (paused) {
            log.warn("[緊急控制] 管理員 {} 暫停資金池", caller);
        } else {
            log.info("[緊急控制] 管理員 {} 恢復資金池運作", caller);
        }
    }
}
