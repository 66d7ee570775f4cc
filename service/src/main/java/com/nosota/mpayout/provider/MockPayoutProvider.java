package com.nosota.mpayout.provider;

import com.nosota.mpayout.service.AccountMasking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * In-process provider for local development.
 *
 * <p>Accepts every transfer with status SUCCESS, except:
 * <ul>
 *   <li>account numbers starting with 999 are rejected</li>
 *   <li>account numbers starting with 888 time out</li>
 * </ul>
 * Status checks report FAILED for ids containing "FAIL", PENDING for ids containing "PEND", SUCCESS otherwise.
 * Account verification fails for account numbers starting with 000.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "payout.provider.mock", havingValue = "true")
public class MockPayoutProvider implements PayoutProvider {

    @Override
    public TransferOutcome initiateTransfer(ProviderTransferRequest request) {
        log.info("[mock] transfer: clientRefId={}, amount={}, mode={}",
                request.clientRefId(), request.amount(), request.transferMode());

        if (request.accountNumber().startsWith("999")) {
            return TransferOutcome.rejected("Bank server temporarily unavailable");
        }
        if (request.accountNumber().startsWith("888")) {
            return TransferOutcome.timeout("Request timeout (mock)");
        }
        String providerId = "MOCK" + System.currentTimeMillis();
        return TransferOutcome.accepted(providerId, ProviderStatus.SUCCESS, "RRN" + providerId.substring(4),
                "Amount of " + request.amount() + " is credited");
    }

    @Override
    public StatusCheckResult getStatus(String providerTransactionId) {
        String id = providerTransactionId.toUpperCase(Locale.ROOT);
        if (id.contains("FAIL")) {
            return StatusCheckResult.of(ProviderStatus.FAILED, null, "FAILED");
        }
        if (id.contains("PEND")) {
            return StatusCheckResult.of(ProviderStatus.PENDING, null, "PENDING");
        }
        return StatusCheckResult.of(ProviderStatus.SUCCESS, "RRN" + Math.abs(id.hashCode()), "SUCCESS");
    }

    @Override
    public ProviderFloatBalance getFloatBalance() {
        return new ProviderFloatBalance(new BigDecimal("1000000.00"), BigDecimal.ZERO);
    }

    @Override
    public List<ProviderBank> listBanks() {
        return List.of(
                new ProviderBank(1, "State Bank of India", "SBI", "SBIN", true, true, true),
                new ProviderBank(2, "HDFC Bank", "HDFC", "HDFC", true, true, true),
                new ProviderBank(3, "ICICI Bank", "ICICI", "ICIC", true, true, true),
                new ProviderBank(4, "Kotak Mahindra Bank", "KOTAK", "KKBK", true, false, false)
        );
    }

    @Override
    public AccountVerification verifyAccount(String accountNumber, String ifscCode, String bankName) {
        log.info("[mock] account verification: account={}, ifsc={}", AccountMasking.mask(accountNumber), ifscCode);

        if (accountNumber.startsWith("000")) {
            return AccountVerification.failed("Account does not exist");
        }
        return AccountVerification.verified("TEST ACCOUNT HOLDER",
                bankName != null && !bankName.isBlank() ? bankName : "Test Bank",
                "Test Branch", "MOCK_VERIFY_" + System.currentTimeMillis());
    }
}
