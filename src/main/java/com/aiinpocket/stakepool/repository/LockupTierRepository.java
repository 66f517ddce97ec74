package com.aiinpocket.stakepool.repository;

import com.aiinpocket.stakepool.model.entity.LockupTier;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LockupTierRepository extends JpaRepository<LockupTier, Integer> {

    List<LockupTier> findAllByOrderByLockupDaysAsc();
}
