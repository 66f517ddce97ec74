package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.repository.PoolStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * 資金池全域狀態存取。
 * 單列表，第一次存取時以設定檔的金庫地址建立。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolStateService {

    private final PoolStateRepository poolRepo;
    private final StakingProperties properties;
    private final Clock clock;

    /**
     * 取得（必要時建立）資金池狀態。在呼叫端交易內回傳的是受管理實體，直接修改即可。
     */
    @Transactional
    public PoolState current() {
        return poolRepo.findById(PoolState.SINGLETON_ID).orElseGet(() -> {
            log.info("[資金池] 初始化資金池狀態，金庫: {}", properties.treasury());
            return poolRepo.save(PoolState.builder()
                    .id(PoolState.SINGLETON_ID)
                    .treasury(properties.treasury())
                    .updatedAt(clock.instant())
                    .build());
        });
    }

    @Transactional(readOnly = true)
    public Optional<PoolState> find() {
        return poolRepo.findById(PoolState.SINGLETON_ID);
    }

    @Transactional(readOnly = true)
    public boolean isPaused() {
        return find().map(PoolState::isPaused).orElse(false);
    }
}
