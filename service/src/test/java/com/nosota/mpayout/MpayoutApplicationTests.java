package com.nosota.mpayout;

import com.nosota.mpayout.pricing.ChargeStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MpayoutApplicationTests extends TestBase {

    @Autowired
    private List<ChargeStrategy> chargeStrategies;

    @Test
    void contextLoads() {
    }

    @Test
    void pricingChainIsOrdered() {
        assertThat(chargeStrategies).extracting(ChargeStrategy::name)
                .containsExactly("hierarchical-scheme", "direct-mapping", "default-fee");
    }

    @Test
    void walletIsCreatedOnFirstTopUp() throws Exception {
        Long merchantId = newMerchantWithBalance("250.00");

        assertThat(walletLedgerGateway.balance(merchantId)).isEqualByComparingTo("250.00");
    }
}
