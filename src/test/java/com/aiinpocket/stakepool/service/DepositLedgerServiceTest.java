package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.AbstractStakingIntegrationTest;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.entity.StakeDeposit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DepositLedgerService 整合測試")
class DepositLedgerServiceTest extends AbstractStakingIntegrationTest {

    @Test
    @DisplayName("依索引移除單筆存款，其餘存款保持存入順序，本金總額同步扣除")
    void removeDepositByIndex() {
        // Given: 本金 94、188、282
        stakingService.deposit(ALICE, amount("100"), 0);
        stakingService.deposit(ALICE, amount("200"), 0);
        stakingService.deposit(ALICE, amount("300"), 0);

        // When
        StakeDeposit removed = ledger.removeDeposit(ALICE, 1);

        // Then
        assertThat(removed.getAmount()).isEqualByComparingTo("188");
        assertThat(ledger.listDeposits(ALICE))
                .extracting(StakeDeposit::getAmount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(amount("94"), amount("282"));
        assertThat(ledger.totalDeposited(ALICE)).isEqualByComparingTo("376");
        assertThat(poolBalance()).isEqualByComparingTo("376");
        assertThat(poolBalance()).isEqualByComparingTo(sumOfDeposits());
    }

    @Test
    @DisplayName("索引超出範圍時拒絕，帳本不變")
    void removeDepositOutOfRange() {
        stakingService.deposit(ALICE, amount("100"), 0);

        assertThatThrownBy(() -> ledger.removeDeposit(ALICE, 1))
                .isInstanceOf(StakingException.class)
                .extracting(e -> ((StakingException) e).getError())
                .isEqualTo(StakingError.NO_DEPOSITS_FOUND);
        assertThatThrownBy(() -> ledger.removeDeposit(ALICE, -1))
                .isInstanceOf(StakingException.class);
        assertThatThrownBy(() -> ledger.removeDeposit(BOB, 0))
                .isInstanceOf(StakingException.class);

        assertThat(ledger.depositCount(ALICE)).isEqualTo(1);
        assertThat(poolBalance()).isEqualByComparingTo("94");
    }

    @Test
    @DisplayName("移除全部存款回傳本金總額，沒有存款時回傳 0")
    void removeAllReturnsPrincipal() {
        stakingService.deposit(ALICE, amount("100"), 0);
        stakingService.deposit(ALICE, amount("50"), 0);
        stakingService.deposit(BOB, amount("100"), 0);

        assertThat(ledger.removeAll(ALICE)).isEqualByComparingTo("141");
        assertThat(ledger.removeAll(ALICE)).isEqualByComparingTo("0");
        assertThat(poolBalance()).isEqualByComparingTo("94");
    }
}
