package com.aiinpocket.stakepool.repository;

import com.aiinpocket.stakepool.model.entity.StakerAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StakerAccountRepository extends JpaRepository<StakerAccount, String> {

    List<StakerAccount> findByAutoCompoundEnabledTrueOrderByAddressAsc();
}
