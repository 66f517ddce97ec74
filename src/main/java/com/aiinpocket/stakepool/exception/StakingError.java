package com.aiinpocket.stakepool.exception;

import lombok.Getter;

import static com.aiinpocket.stakepool.exception.ErrorCategory.*;

@Getter
public enum StakingError {

    // 輸入驗證
    DEPOSIT_TOO_LOW(VALIDATION, "存入金額低於下限"),
    DEPOSIT_TOO_HIGH(VALIDATION, "存入金額超過上限"),
    INVALID_LOCKUP_DURATION(VALIDATION, "不支援的鎖倉天數"),
    TIER_INACTIVE(VALIDATION, "此鎖倉級距已停用"),
    INVALID_APY(VALIDATION, "年化利率超出允許範圍"),
    INVALID_ADDRESS(VALIDATION, "地址不可為空"),
    INVALID_AMOUNT(VALIDATION, "金額必須大於零"),
    INVALID_SKILL_EFFECT(VALIDATION, "技能效果超出允許範圍"),

    // 政策限制
    MAX_DEPOSITS_REACHED(POLICY, "存款筆數已達上限"),
    DAILY_LIMIT_EXCEEDED(POLICY, "超過每日提領上限"),
    TOO_MANY_ACTIONS_TODAY(POLICY, "今日操作次數過多"),
    NO_REWARDS_AVAILABLE(POLICY, "目前沒有可領取的獎勵"),
    NO_DEPOSITS_FOUND(POLICY, "查無存款"),
    FUNDS_ARE_LOCKED(POLICY, "資金仍在鎖倉期間"),
    MAX_SKILLS_REACHED(POLICY, "啟用中技能已達上限"),
    SKILL_ALREADY_ACTIVE(POLICY, "技能已啟用"),
    SKILL_NOT_ACTIVE(POLICY, "技能未啟用"),
    AUTO_COMPOUND_NOT_ENABLED(POLICY, "用戶未開啟自動複利"),

    // 權限
    UNAUTHORIZED(AUTHORIZATION, "無權執行此操作"),
    USER_IS_BANNED(AUTHORIZATION, "用戶已被封鎖"),

    // 資源
    INSUFFICIENT_POOL_BALANCE(RESOURCE, "獎勵準備金不足"),
    INSUFFICIENT_FUNDS(RESOURCE, "結算層餘額不足，轉帳失敗"),

    // 合約狀態
    CONTRACT_PAUSED(STATE, "合約已暫停"),
    NOT_PAUSED(STATE, "合約未暫停，無法緊急提領"),
    POOL_MIGRATED(STATE, "資金池已遷移"),
    REENTRANCY_DETECTED(STATE, "偵測到重入呼叫");

    private final ErrorCategory category;
    private final String defaultMessage;

    StakingError(ErrorCategory category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }
}
