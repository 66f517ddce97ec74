package com.aiinpocket.stakepool.settlement;

import java.math.BigDecimal;

/**
 * 結算層介面（外部協作者）。
 * 實際搬移資金的原子操作；質押引擎只透過此介面收付款，永不假設成功。
 *
 * <p>轉帳要嘛完整成功，要嘛丟出 {@link InsufficientFundsException}，不會部分轉帳。
 */
public interface SettlementPort {

    /**
     * 將資金從 from 收進託管帳戶（存款或獎勵準備金注資）。
     */
    void collect(String from, BigDecimal amount);

    /**
     * 從託管帳戶轉出資金給 to。
     *
     * @throws InsufficientFundsException 託管餘額不足或收款方拒收
     */
    void transfer(String to, BigDecimal amount);

    /**
     * 目前託管帳戶持有的總額（本金 + 獎勵準備金）。
     */
    BigDecimal custodyBalance();
}
