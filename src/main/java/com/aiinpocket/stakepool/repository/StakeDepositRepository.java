package com.aiinpocket.stakepool.repository;

import com.aiinpocket.stakepool.model.entity.StakeDeposit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StakeDepositRepository extends JpaRepository<StakeDeposit, Long> {

    /** 依存入順序列出用戶存款 */
    List<StakeDeposit> findByStakerAddressOrderByIdAsc(String stakerAddress);

    long countByStakerAddress(String stakerAddress);
}
