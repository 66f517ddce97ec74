package com.aiinpocket.stakepool.job;

import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.dto.BatchCompoundReport;
import com.aiinpocket.stakepool.service.AutoCompoundService;
import com.aiinpocket.stakepool.service.DistributedLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 自動複利排程任務（每小時）。
 * 扮演外部 keeper：掃描所有開啟自動複利的用戶並批次執行，未到期的用戶會被略過。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AutoCompoundJob extends QuartzJobBean {

    private final AutoCompoundService autoCompoundService;
    private final DistributedLockService lockService;

    /** Advisory lock ID: AutoCompoundJob 專用 */
    static final long AUTO_COMPOUND_LOCK_ID = 3_000_001L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.executeWithLock(AUTO_COMPOUND_LOCK_ID, "AutoCompoundJob", this::sweep);
    }

    void sweep() {
        try {
            List<String> users = autoCompoundService.findOptedInUsers();
            if (users.isEmpty()) {
                log.debug("[自動複利排程] 沒有開啟自動複利的用戶");
                return;
            }
            BatchCompoundReport report = autoCompoundService.batchAutoCompound(users);
            log.info("[自動複利排程] 掃描 {} 位用戶，複利 {} 位，失敗 {} 位",
                    users.size(), report.compoundedCount(), report.failedCount());
        } catch (StakingException e) {
            if (e.getError() == StakingError.CONTRACT_PAUSED) {
                log.info("[自動複利排程] 資金池暫停中，本次跳過");
            } else {
                log.error("[自動複利排程] 執行失敗: {}", e.getMessage(), e);
            }
        } catch (Exception e) {
            log.error("[自動複利排程] 執行失敗: {}", e.getMessage(), e);
        }
    }
}
