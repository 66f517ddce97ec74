package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.model.entity.StakingEventLog;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import com.aiinpocket.stakepool.repository.StakingEventLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * 寫入帳本稽核事件。必須在呼叫端的交易內呼叫，與帳本異動一起提交或回滾。
 */
@Component
@RequiredArgsConstructor
public class StakingEventRecorder {

    private final StakingEventLogRepository eventRepo;
    private final Clock clock;

    public void record(String address, StakingEventType type, BigDecimal amount, String detail) {
        eventRepo.save(StakingEventLog.builder()
                .stakerAddress(address)
                .eventType(type)
                .amount(amount)
                .detail(detail)
                .createdAt(clock.instant())
                .build());
    }

    public void record(String address, StakingEventType type, String detail) {
        record(address, type, null, detail);
    }
}
