package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 呼叫者身分檢查。
 * 管理員與技能通知方都以設定檔中的地址做身分比對。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessPolicy {

    private final StakingProperties properties;
    private final SkillNotifier skillNotifier;

    public void requireOwner(String caller) {
        String owner = properties.owner();
        if (caller == null || owner == null || !owner.equalsIgnoreCase(caller.trim())) {
            log.warn("[權限] {} 嘗試執行管理員操作被拒", caller);
            throw new StakingException(StakingError.UNAUTHORIZED, "只有管理員可以執行此操作");
        }
    }

    public void requireSkillNotifier(String caller) {
        if (!skillNotifier.isCaller(caller)) {
            log.warn("[權限] {} 不是受信任的技能通知方", caller);
            throw new StakingException(StakingError.UNAUTHORIZED, "只有受信任的市集可以通知技能變更");
        }
    }

    /**
     * 驗證並正規化地址（去除前後空白、轉小寫），大小寫不同的同一地址共用一份帳本。
     */
    public String requireAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new StakingException(StakingError.INVALID_ADDRESS);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
