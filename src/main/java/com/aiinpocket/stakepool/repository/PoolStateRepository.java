package com.aiinpocket.stakepool.repository;

import com.aiinpocket.stakepool.model.entity.PoolState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PoolStateRepository extends JpaRepository<PoolState, Long> {
}
