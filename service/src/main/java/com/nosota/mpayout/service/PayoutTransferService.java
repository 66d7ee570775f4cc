package com.nosota.mpayout.service;

import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.api.request.PayoutTransferRequest;
import com.nosota.mpayout.api.response.ChargePreviewResponse;
import com.nosota.mpayout.api.response.PayoutTransferResponse;
import com.nosota.mpayout.dto.DuplicateCheckResult;
import com.nosota.mpayout.error.DuplicatePayoutException;
import com.nosota.mpayout.error.InsufficientFundsException;
import com.nosota.mpayout.error.PayoutValidationException;
import com.nosota.mpayout.error.ProviderRejectedException;
import com.nosota.mpayout.error.ProviderUnavailableException;
import com.nosota.mpayout.error.ProviderUnderfundedException;
import com.nosota.mpayout.error.WalletNotFoundException;
import com.nosota.mpayout.mapper.PayoutTransactionMapper;
import com.nosota.mpayout.model.PayoutTransaction;
import com.nosota.mpayout.pricing.ChargeQuote;
import com.nosota.mpayout.pricing.PricingResolver;
import com.nosota.mpayout.provider.PayoutProvider;
import com.nosota.mpayout.provider.ProviderFloatBalance;
import com.nosota.mpayout.provider.ProviderStatus;
import com.nosota.mpayout.provider.ProviderTransferRequest;
import com.nosota.mpayout.provider.TransferOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Optional;

/**
 * Orchestrates one payout transfer.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>validate and normalize the request</li>
 *   <li>replay: a known client reference id of the same merchant returns the existing transaction</li>
 *   <li>duplicate guard on the destination account</li>
 *   <li>pricing</li>
 *   <li>wallet balance and provider float checks</li>
 *   <li>create the transaction and reserve amount + charge (one database transaction)</li>
 *   <li>call the provider and apply its outcome</li>
 * </ol>
 * Nothing is persisted when a step before the reservation fails. After the reservation, an explicit
 * provider rejection is refunded immediately while a timeout leaves the transaction PROCESSING for
 * {@link PayoutReconciliationService}. The provider call is never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutTransferService {

    private static final String REF_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int REF_SUFFIX_LENGTH = 6;

    private final PayoutRequestValidator payoutRequestValidator;
    private final DuplicateGuard duplicateGuard;
    private final PricingResolver pricingResolver;
    private final WalletLedgerGateway walletLedgerGateway;
    private final PayoutTransactionService payoutTransactionService;
    private final PayoutProvider payoutProvider;
    private final Clock clock;

    private final SecureRandom random = new SecureRandom();

    @Value("${payout.service-type:payout}")
    private String serviceType;

    /**
     * Submits a transfer on behalf of a merchant.
     *
     * @return SUCCESS when the provider confirmed the transfer, PROCESSING when the outcome is not final yet
     * @throws PayoutValidationException   invalid request, or client reference id owned by another merchant
     * @throws DuplicatePayoutException    a transfer to the same account is inside the duplicate window
     * @throws InsufficientFundsException  wallet balance below amount + charge
     * @throws ProviderUnavailableException provider float unreadable or too low
     * @throws ProviderRejectedException   provider refused the transfer; the wallet has been refunded
     */
    public PayoutTransferResponse submit(Long merchantId, PayoutTransferRequest rawRequest)
            throws PayoutValidationException, DuplicatePayoutException, InsufficientFundsException,
            WalletNotFoundException, ProviderUnavailableException, ProviderRejectedException {

        PayoutTransferRequest request = payoutRequestValidator.validate(rawRequest);

        if (request.clientRefId() != null) {
            Optional<PayoutTransferResponse> replay = replay(merchantId, request.clientRefId());
            if (replay.isPresent()) {
                return replay.get();
            }
        }

        DuplicateCheckResult duplicate = duplicateGuard.check(merchantId, request.accountNumber());
        if (duplicate.blocked()) {
            PayoutTransaction prior = duplicate.priorTransaction();
            throw new DuplicatePayoutException(
                    String.format("A transfer to this account was submitted recently. Please wait %d seconds.",
                            duplicate.remainingWaitSeconds()),
                    duplicate.remainingWaitSeconds(), prior.getId(), prior.getStatus(), prior.getAmount(),
                    prior.getCreatedAt());
        }

        ChargeQuote quote = pricingResolver.resolve(merchantId, serviceType, request.amount(), request.transferMode());
        BigDecimal totalRequired = request.amount().add(quote.charge());

        BigDecimal balance = walletLedgerGateway.balance(merchantId);
        if (balance.compareTo(totalRequired) < 0) {
            throw new InsufficientFundsException(
                    String.format("Insufficient wallet balance. Required: %s, available: %s", totalRequired, balance),
                    balance, request.amount(), quote.charge(), totalRequired);
        }

        checkProviderFloat(request.amount());

        String clientRefId = request.clientRefId() != null ? request.clientRefId() : generateClientRefId(merchantId);
        PayoutTransaction tx = payoutTransactionService.openAndReserve(merchantId, request, quote, clientRefId);

        ProviderTransferRequest providerRequest;
        try {
            providerRequest = toProviderRequest(tx);
        } catch (RuntimeException e) {
            log.error("Could not prepare provider request for payout {}, refunding", tx.getId(), e);
            payoutTransactionService.failAndRefund(tx.getId(), "Internal error before provider call");
            throw e;
        }

        TransferOutcome outcome = callProvider(providerRequest);
        return applyOutcome(tx, outcome);
    }

    /**
     * Runs the pricing chain only: what a transfer of {@code amount} would cost the merchant now.
     */
    public ChargePreviewResponse previewCharge(Long merchantId, BigDecimal amount, TransferMode transferMode)
            throws PayoutValidationException {
        if (amount == null || amount.signum() <= 0) {
            throw new PayoutValidationException("amount", "Amount must be greater than 0");
        }
        if (transferMode == null) {
            throw new PayoutValidationException("transferMode", "Transfer mode must be IMPS or NEFT");
        }

        ChargeQuote quote = pricingResolver.resolve(merchantId, serviceType, amount, transferMode);
        return new ChargePreviewResponse(amount, transferMode, quote.charge(), amount.add(quote.charge()),
                quote.schemeId(), quote.schemeName());
    }

    private Optional<PayoutTransferResponse> replay(Long merchantId, String clientRefId)
            throws PayoutValidationException {
        Optional<PayoutTransaction> existing = payoutTransactionService.findByClientRefId(clientRefId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        if (!existing.get().getMerchantId().equals(merchantId)) {
            throw new PayoutValidationException("clientRefId", "Client reference id is already in use");
        }

        log.info("Replayed payout {} for clientRefId {}", existing.get().getId(), clientRefId);
        return Optional.of(PayoutTransactionMapper.INSTANCE.toTransferResponse(existing.get(),
                "Transfer already submitted with this client reference id"));
    }

    private void checkProviderFloat(BigDecimal amount) throws ProviderUnavailableException {
        ProviderFloatBalance floatBalance;
        try {
            floatBalance = payoutProvider.getFloatBalance();
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException("Payout service temporarily unavailable", e);
        }

        if (floatBalance.available().compareTo(amount) < 0) {
            log.warn("Provider float too low: available={}, required={}", floatBalance.available(), amount);
            throw new ProviderUnderfundedException("Payout service temporarily unavailable. Please try again later.",
                    floatBalance.available(), amount);
        }
    }

    private TransferOutcome callProvider(ProviderTransferRequest request) {
        try {
            return payoutProvider.initiateTransfer(request);
        } catch (RuntimeException e) {
            // the request may have reached the provider
            log.error("Provider call for {} ended unexpectedly, treating as timeout", request.clientRefId(), e);
            return TransferOutcome.timeout(e.getMessage());
        }
    }

    private PayoutTransferResponse applyOutcome(PayoutTransaction tx, TransferOutcome outcome)
            throws WalletNotFoundException, ProviderRejectedException {
        switch (outcome.kind()) {
            case ACCEPTED -> {
                PayoutTransaction accepted;
                try {
                    accepted = payoutTransactionService.markAccepted(tx.getId(), outcome.providerTransactionId(),
                            outcome.status(), outcome.referenceNumber());
                } catch (RuntimeException e) {
                    log.error("Payout {} accepted by provider as {} but could not be recorded",
                            tx.getId(), outcome.providerTransactionId(), e);
                    throw e;
                }
                String message = outcome.status() == ProviderStatus.SUCCESS
                        ? "Transfer successful"
                        : "Transfer accepted, awaiting bank confirmation";
                return PayoutTransactionMapper.INSTANCE.toTransferResponse(accepted, message);
            }
            case TIMEOUT -> {
                PayoutTransaction processing = payoutTransactionService.markAwaitingConfirmation(tx.getId(),
                        outcome.message());
                return PayoutTransactionMapper.INSTANCE.toTransferResponse(processing,
                        "Transfer is being processed. Status will be updated shortly.");
            }
            default -> {
                String reason = outcome.message() != null && !outcome.message().isBlank()
                        ? outcome.message()
                        : "Transfer rejected by provider";
                log.warn("Provider rejected payout {} ({}): {}", tx.getId(), tx.getClientRefId(), reason);
                try {
                    payoutTransactionService.failAndRefund(tx.getId(), reason);
                } catch (RuntimeException e) {
                    log.error("Refund of rejected payout {} failed, left for reconciliation", tx.getId(), e);
                    throw e;
                }
                throw new ProviderRejectedException(reason, tx.getId(), tx.getClientRefId());
            }
        }
    }

    private ProviderTransferRequest toProviderRequest(PayoutTransaction tx) {
        return new ProviderTransferRequest(
                tx.getAccountNumber(),
                tx.getIfscCode(),
                tx.getAccountHolderName(),
                tx.getAmount(),
                tx.getTransferMode(),
                tx.getBankId(),
                tx.getBankName(),
                tx.getBeneficiaryMobile(),
                tx.getSenderName(),
                tx.getSenderMobile(),
                tx.getSenderEmail(),
                tx.getRemarks() != null ? tx.getRemarks() : "Payout",
                tx.getClientRefId());
    }

    private String generateClientRefId(Long merchantId) {
        StringBuilder suffix = new StringBuilder(REF_SUFFIX_LENGTH);
        for (int i = 0; i < REF_SUFFIX_LENGTH; i++) {
            suffix.append(REF_ALPHABET.charAt(random.nextInt(REF_ALPHABET.length())));
        }
        return "PAY-" + merchantId + "-" + clock.millis() + "-" + suffix;
    }
}
