package com.aiinpocket.stakepool.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * keeper 排程的跨實例互斥。
 * 多個實例同時被 Quartz 觸發時，只有搶到 PostgreSQL Advisory Lock 的實例會執行；
 * 單一實例內的帳本互斥由 {@link ReentrancyGuard} 負責，兩者不重疊。
 *
 * <p>Advisory lock 屬於 session：取得與釋放必須在同一條連線上，
 * 所以整段任務期間都佔住同一條連線，而不是每次查詢各自向連線池借。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributedLockService {

    static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(?)";
    static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(?)";

    private final JdbcTemplate jdbcTemplate;

    /**
     * 在鎖保護下執行任務；其他實例持有鎖時直接跳過（非阻塞）。
     *
     * @return true 如果任務被執行
     */
    public boolean executeWithLock(long lockId, String taskName, Runnable task) {
        Boolean executed = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
            if (!queryFlag(connection, TRY_LOCK_SQL, lockId)) {
                log.debug("[keeper 鎖] {} 已由其他實例處理，跳過 (lockId={})", taskName, lockId);
                return false;
            }
            try {
                task.run();
                return true;
            } finally {
                release(connection, lockId, taskName);
            }
        });
        return Boolean.TRUE.equals(executed);
    }

    private void release(Connection connection, long lockId, String taskName) throws SQLException {
        if (!queryFlag(connection, UNLOCK_SQL, lockId)) {
            log.warn("[keeper 鎖] {} 釋放失敗，連線上沒有持有 lockId={}", taskName, lockId);
        }
    }

    private static boolean queryFlag(Connection connection, String sql, long lockId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, lockId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
}
