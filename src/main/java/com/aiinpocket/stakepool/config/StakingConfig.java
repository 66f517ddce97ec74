package com.aiinpocket.stakepool.config;

import com.aiinpocket.stakepool.service.SkillNotifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StakingConfig {

    // 全系統唯一時間來源，測試以可調整時鐘取代
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** 受信任的技能通知方（市集合約），以地址比對授權 */
    @Bean
    public SkillNotifier skillNotifier(StakingProperties properties) {
        String address = properties.trustedNotifier();
        return () -> address;
    }
}
