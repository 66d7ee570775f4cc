package com.nosota.mpayout.tests;

import com.nosota.mpayout.TestBase;
import com.nosota.mpayout.error.InsufficientFundsException;
import com.nosota.mpayout.error.WalletNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class WalletLedgerServiceTest extends TestBase {

    @Autowired
    @Qualifier("testTaskExecutor")
    private ExecutorService testTaskExecutor;

    @Test
    public void concurrentReservationsNeverOverdraw() throws Exception {
        Long merchantId = newMerchantWithBalance("1000.00");

        List<Callable<Long>> reservations = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int n = i;
            reservations.add(() -> walletLedgerGateway.reserve(merchantId, UUID.randomUUID(),
                    new BigDecimal("300.00"), "Concurrent reservation", "CONC-" + merchantId + "-" + n));
        }

        int succeeded = 0;
        int rejected = 0;
        for (Future<Long> result : testTaskExecutor.invokeAll(reservations)) {
            try {
                result.get();
                succeeded++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(InsufficientFundsException.class);
                rejected++;
            }
        }

        assertThat(succeeded).isEqualTo(3);
        assertThat(rejected).isEqualTo(2);
        assertThat(walletLedgerGateway.balance(merchantId)).isEqualByComparingTo("100.00");
    }

    @Test
    public void refundIsBookedOncePerTransaction() throws Exception {
        Long merchantId = newMerchantWithBalance("1000.00");
        UUID transactionId = UUID.randomUUID();
        walletLedgerGateway.reserve(merchantId, transactionId, new BigDecimal("505.00"), "Payout", "PAY-1");

        Long first = walletLedgerGateway.refund(merchantId, transactionId, new BigDecimal("505.00"), "Refund", "REFUND_PAY-1");
        Long second = walletLedgerGateway.refund(merchantId, transactionId, new BigDecimal("505.00"), "Refund", "REFUND_PAY-1");

        assertThat(second).isEqualTo(first);
        assertThat(walletLedgerGateway.balance(merchantId)).isEqualByComparingTo("1000.00");
    }

    @Test
    public void pendingEntryMovesOnlyOnce() throws Exception {
        Long merchantId = newMerchantWithBalance("1000.00");
        Long entryId = walletLedgerGateway.reserve(merchantId, UUID.randomUUID(), new BigDecimal("100.00"),
                "Payout", "PAY-2");

        assertThat(walletLedgerGateway.completeEntry(entryId)).isTrue();
        assertThat(walletLedgerGateway.failEntry(entryId)).isFalse();
        assertThat(walletLedgerGateway.balance(merchantId)).isEqualByComparingTo("900.00");
    }

    @Test
    public void unknownWalletIsReported() {
        Long merchantId = newMerchant();

        assertThatThrownBy(() -> walletLedgerGateway.balance(merchantId))
                .isInstanceOf(WalletNotFoundException.class);
    }
}
