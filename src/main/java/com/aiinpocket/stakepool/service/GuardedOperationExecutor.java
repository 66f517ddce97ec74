package com.aiinpocket.stakepool.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * 取得互斥鎖後再開交易執行操作。
 * 鎖必須包住整個交易（含 commit），下一個操作才讀得到前一個操作寫入的狀態。
 * 主體丟出任何例外（包含結算層轉帳失敗）都會讓整筆交易回滾。
 *
 * <p>暫停、封鎖等前置檢查必須在取得鎖之後才讀取，否則排隊中的操作會用到過期的狀態。
 */
@Component
@RequiredArgsConstructor
public class GuardedOperationExecutor {

    private final ReentrancyGuard guard;
    private final TransactionTemplate transactionTemplate;
    private final AntiFraudService antiFraudService;

    public <T> T execute(String operation, Supplier<T> body) {
        return execute(operation, () -> { }, body);
    }

    /**
     * 取得鎖後先執行前置檢查，通過才開交易。
     */
    public <T> T execute(String operation, Runnable preconditions, Supplier<T> body) {
        return guard.execute(operation, () -> {
            preconditions.run();
            return transactionTemplate.execute(status -> body.get());
        });
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * 用戶自己發起的操作。
     * 取得鎖後依序：前置檢查 → 在獨立交易記錄防詐操作次數（操作被拒也會留下紀錄）→ 主體交易。
     * 前置檢查失敗的呼叫不計入操作次數。
     */
    public <T> T executeForUser(String operation, String user, Runnable preconditions, Supplier<T> body) {
        return guard.execute(operation, () -> {
            preconditions.run();
            antiFraudService.recordAction(user);
            return transactionTemplate.execute(status -> body.get());
        });
    }
}
