package com.aiinpocket.stakepool.settlement;

import com.aiinpocket.stakepool.util.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 單機版結算層。
 * 以記憶體模擬託管帳戶與各地址收到的款項，供本機執行與整合測試使用；
 * 正式環境應以實際鏈上/銀行結算實作取代此 bean。
 */
@Component
@Slf4j
public class InMemorySettlementPort implements SettlementPort {

    private final Map<String, BigDecimal> received = new ConcurrentHashMap<>();
    private BigDecimal custody = Amounts.ZERO;

    @Override
    public synchronized void collect(String from, BigDecimal amount) {
        custody = custody.add(amount);
        log.debug("[結算] 收到 {} 的 {}，託管餘額 {}", from, amount, custody);
    }

    @Override
    public synchronized void transfer(String to, BigDecimal amount) {
        if (custody.compareTo(amount) < 0) {
            throw new InsufficientFundsException(
                    String.format("託管餘額不足：需要 %s，目前 %s", amount, custody));
        }
        custody = custody.subtract(amount);
        received.merge(to, amount, BigDecimal::add);
        log.debug("[結算] 轉出 {} 給 {}，託管餘額 {}", amount, to, custody);
    }

    @Override
    public synchronized BigDecimal custodyBalance() {
        return custody;
    }

    /** 某地址從託管帳戶累計收到的金額 */
    public BigDecimal receivedBy(String address) {
        return received.getOrDefault(address, Amounts.ZERO);
    }

    public synchronized void reset() {
        received.clear();
        custody = Amounts.ZERO;
    }
}
