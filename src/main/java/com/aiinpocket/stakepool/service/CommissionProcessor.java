package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.settlement.InsufficientFundsException;
import com.aiinpocket.stakepool.settlement.SettlementPort;
import com.aiinpocket.stakepool.util.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * 手續費計算與轉入金庫。
 * fee = 金額 × 費率 / 10000（截斷），net = 金額 − fee，兩者相加恆等於原金額。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommissionProcessor {

    private final StakingProperties properties;
    private final SettlementPort settlementPort;

    public CommissionSplit applyDepositCommission(BigDecimal amount) {
        return split(amount, properties.commissionBps());
    }

    /**
     * 提領/複利手續費，技能折扣以 bps 比例減少費率（600 bps 打 15% 折 = 510 bps）。
     */
    public CommissionSplit applyWithdrawalCommission(BigDecimal amount, int feeDiscountBps) {
        long discount = Math.max(0, Math.min(feeDiscountBps, properties.maxModifierBps()));
        long effectiveBps = properties.commissionBps() * (Amounts.BPS_DENOMINATOR - discount) / Amounts.BPS_DENOMINATOR;
        return split(amount, effectiveBps);
    }

    /**
     * 將手續費轉入金庫。必須在交易內呼叫，轉帳失敗會讓整個操作回滾。
     */
    public void routeFee(String treasury, BigDecimal fee) {
        if (!Amounts.isPositive(fee)) {
            return;
        }
        try {
            settlementPort.transfer(treasury, fee);
        } catch (InsufficientFundsException e) {
            throw new StakingException(StakingError.INSUFFICIENT_FUNDS,
                    "手續費轉入金庫失敗: " + e.getMessage(), e);
        }
        log.debug("[手續費] {} 轉入金庫 {}", fee, treasury);
    }

    private CommissionSplit split(BigDecimal amount, long bps) {
        BigDecimal gross = Amounts.normalize(amount);
        BigDecimal fee = Amounts.bps(gross, bps);
        return new CommissionSplit(gross, gross.subtract(fee), fee);
    }

    public record CommissionSplit(BigDecimal gross, BigDecimal net, BigDecimal fee) {}
}
