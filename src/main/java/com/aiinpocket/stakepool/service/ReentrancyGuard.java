package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 全域互斥鎖。
 * 所有會修改帳本的操作都在此鎖內執行，保證同一時間只有一個操作在改狀態。
 *
 * <p>同一執行緒在持有鎖期間再次進入（例如結算層轉帳時收款方回呼）會直接被拒絕，
 * 其他執行緒則排隊等待，形成全域單一順序。
 */
@Component
@Slf4j
public class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T execute(String operation, Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("[重入防護] 拒絕巢狀呼叫: {}", operation);
            throw new StakingException(StakingError.REENTRANCY_DETECTED,
                    "偵測到重入呼叫，操作 " + operation + " 已被拒絕");
        }
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 斷言目前執行緒持有鎖，用於只能在鎖內呼叫的內部步驟。
     */
    public void requireHeld(String operation) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException(operation + " 必須在互斥鎖內執行");
        }
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    /**
     * 目前排隊等待鎖的執行緒數（估計值）。
     */
    public int queueLength() {
        return lock.getQueueLength();
    }
}
