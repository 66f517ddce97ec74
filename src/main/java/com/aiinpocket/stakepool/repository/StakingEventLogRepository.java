package com.aiinpocket.stakepool.repository;

import com.aiinpocket.stakepool.model.entity.StakingEventLog;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StakingEventLogRepository extends JpaRepository<StakingEventLog, Long> {

    List<StakingEventLog> findByStakerAddressOrderByIdAsc(String stakerAddress);

    long countByStakerAddressAndEventType(String stakerAddress, StakingEventType eventType);
}
