package com.aiinpocket.stakepool.exception;

/**
 * 錯誤分類，決定呼叫端能否自行修正。
 */
public enum ErrorCategory {
    /** 輸入不合法：修正參數後重試 */
    VALIDATION,
    /** 政策限制：等待時間窗口重置 */
    POLICY,
    /** 權限不足：呼叫端無法自行修正 */
    AUTHORIZATION,
    /** 資源不足：池內餘額無法支付 */
    RESOURCE,
    /** 合約狀態不允許此操作 */
    STATE
}
