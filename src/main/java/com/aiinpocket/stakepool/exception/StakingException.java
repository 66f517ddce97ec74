package com.aiinpocket.stakepool.exception;

import lombok.Getter;

/**
 * 質押引擎的業務例外。
 * 每個失敗種類對應一個 {@link StakingError}，呼叫端依錯誤碼判斷處理方式。
 */
@Getter
public class StakingException extends RuntimeException {

    private final StakingError error;

    public StakingException(StakingError error) {
        super(error.getDefaultMessage());
        this.error = error;
    }

    public StakingException(StakingError error, String message) {
        super(message);
        this.error = error;
    }

    public StakingException(StakingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ErrorCategory getCategory() {
        return error.getCategory();
    }
}
