package com.aiinpocket.stakepool.repository;

import com.aiinpocket.stakepool.model.entity.UserActivity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserActivityRepository extends JpaRepository<UserActivity, String> {

    /** 可疑但尚未封鎖的用戶，供管理員審查 */
    List<UserActivity> findByFlaggedTrueAndBannedFalse();
}
