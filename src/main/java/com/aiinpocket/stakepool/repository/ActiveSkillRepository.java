package com.aiinpocket.stakepool.repository;

import com.aiinpocket.stakepool.model.entity.ActiveSkill;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ActiveSkillRepository extends JpaRepository<ActiveSkill, Long> {

    List<ActiveSkill> findByStakerAddressOrderByIdAsc(String stakerAddress);

    Optional<ActiveSkill> findByStakerAddressAndSourceId(String stakerAddress, Long sourceId);

    boolean existsByStakerAddressAndSourceId(String stakerAddress, Long sourceId);

    long countByStakerAddress(String stakerAddress);
}
