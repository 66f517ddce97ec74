package com.aiinpocket.stakepool.config;

import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.service.PoolStateService;
import com.aiinpocket.stakepool.service.TierRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 應用啟動時確保鎖倉級距與資金池狀態存在。
 * 已存在的級距不覆寫，保留管理員調整過的利率與啟用狀態。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StakingDataInitializer implements ApplicationRunner {

    private final TierRegistryService tierRegistry;
    private final PoolStateService poolStateService;

    @Override
    public void run(ApplicationArguments args) {
        int created = tierRegistry.ensureDefaultTiers();
        if (created > 0) {
            log.info("[初始化] 已建立 {} 個鎖倉級距", created);
        } else {
            log.debug("[初始化] 鎖倉級距皆已存在");
        }
        PoolState pool = poolStateService.current();
        log.info("[初始化] 資金池就緒，本金 {}，暫停={}，金庫 {}",
                pool.getTotalPoolBalance(), pool.isPaused(), pool.getTreasury());
    }
}
