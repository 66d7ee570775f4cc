package com.nosota.mpayout.service;

import com.nosota.mpayout.api.request.AccountVerificationRequest;
import com.nosota.mpayout.api.response.AccountVerificationResponse;
import com.nosota.mpayout.error.AccountVerificationFailedException;
import com.nosota.mpayout.error.PayoutValidationException;
import com.nosota.mpayout.provider.AccountVerification;
import com.nosota.mpayout.provider.PayoutProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Beneficiary account lookup ahead of a transfer. The provider bills a flat
 * {@code payout.account-verification.charge} per successful lookup, reported back to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountVerificationService {

    private final PayoutRequestValidator payoutRequestValidator;
    private final PayoutProvider payoutProvider;

    @Value("${payout.account-verification.charge:2}")
    private BigDecimal verificationCharge;

    public AccountVerificationResponse verify(AccountVerificationRequest request)
            throws PayoutValidationException, AccountVerificationFailedException {
        AccountVerificationRequest normalized = payoutRequestValidator.validate(request);

        AccountVerification result = payoutProvider.verifyAccount(normalized.accountNumber(),
                normalized.ifscCode(), normalized.bankName());
        if (!result.verified()) {
            log.warn("Account {} not verified: {}", AccountMasking.mask(normalized.accountNumber()), result.message());
            throw new AccountVerificationFailedException(result.message() != null
                    ? result.message() : "Account verification failed");
        }

        return new AccountVerificationResponse(true, result.accountHolderName(), result.bankName(),
                result.branchName(), verificationCharge, "Account verified successfully");
    }
}
