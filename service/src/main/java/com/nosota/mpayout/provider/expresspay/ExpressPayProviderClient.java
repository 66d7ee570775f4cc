package com.nosota.mpayout.provider.expresspay;

import com.nosota.mpayout.error.ProviderUnavailableException;
import com.nosota.mpayout.provider.AccountVerification;
import com.nosota.mpayout.provider.PayoutProvider;
import com.nosota.mpayout.provider.ProviderBank;
import com.nosota.mpayout.provider.ProviderFloatBalance;
import com.nosota.mpayout.provider.ProviderStatus;
import com.nosota.mpayout.provider.ProviderTransferRequest;
import com.nosota.mpayout.provider.StatusCheckResult;
import com.nosota.mpayout.provider.TransferOutcome;
import com.nosota.mpayout.service.AccountMasking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;

/**
 * {@link PayoutProvider} backed by the ExpressPay payout API.
 *
 * <p>Endpoints (relative to {@code payout.provider.base-url}):
 * <ul>
 *   <li>POST /expressPay2 - initiate transfer</li>
 *   <li>POST /statusCheck?transaction_id= - transfer status</li>
 *   <li>GET /getBalance - float balance</li>
 *   <li>POST /bankList - supported banks</li>
 *   <li>POST /accountVerify - account holder lookup</li>
 * </ul>
 *
 * <p>Every call is bounded by {@code payout.provider.timeout-ms}. A transfer that runs into the
 * budget, gets a 5xx answer, or whose connection breaks after the request may have been sent, is
 * reported as {@link TransferOutcome.Kind#TIMEOUT} and never retried here. Only 4xx answers and
 * explicit provider failures count as rejections.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "payout.provider.mock", havingValue = "false", matchIfMissing = true)
public class ExpressPayProviderClient implements PayoutProvider {

    private static final ParameterizedTypeReference<ExpressPayResponse<ExpressPayTransferData>> TRANSFER_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ExpressPayResponse<ExpressPayStatusData>> STATUS_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ExpressPayResponse<ExpressPayBalanceData>> BALANCE_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ExpressPayResponse<List<ExpressPayBankData>>> BANK_LIST_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ExpressPayResponse<ExpressPayAccountData>> ACCOUNT_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final Duration timeout;
    private final String webhookUrl;

    public ExpressPayProviderClient(@Qualifier("payoutProviderWebClient") WebClient webClient,
                                    @Value("${payout.provider.timeout-ms:60000}") long timeoutMs,
                                    @Value("${payout.provider.webhook-url:}") String webhookUrl) {
        this.webClient = webClient;
        this.timeout = Duration.ofMillis(timeoutMs);
        this.webhookUrl = webhookUrl;
    }

    @Override
    public TransferOutcome initiateTransfer(ProviderTransferRequest request) {
        String apiRequestId = generateApiRequestId();
        ExpressPayTransferBody body = ExpressPayTransferBody.of(request, apiRequestId, webhookUrl);

        log.info("Initiating transfer: clientRefId={}, apiRequestId={}, account={}, ifsc={}, amount={}, mode={}",
                request.clientRefId(), apiRequestId, AccountMasking.mask(request.accountNumber()),
                request.ifscCode(), request.amount(), request.transferMode());

        ExpressPayResponse<ExpressPayTransferData> response;
        try {
            response = webClient.post()
                    .uri("/expressPay2")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(TRANSFER_RESPONSE)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.GATEWAY_TIMEOUT.value()) {
                log.warn("Transfer {} got gateway timeout from provider", request.clientRefId());
                return TransferOutcome.timeout("Provider gateway timeout");
            }
            // A server error says nothing about whether the transfer went through.
            if (e.getStatusCode().is5xxServerError()) {
                log.warn("Transfer {} outcome unknown after HTTP {}: {}", request.clientRefId(),
                        e.getStatusCode().value(), e.getResponseBodyAsString());
                return TransferOutcome.timeout("Provider returned HTTP " + e.getStatusCode().value());
            }
            log.warn("Transfer {} rejected with HTTP {}: {}", request.clientRefId(),
                    e.getStatusCode().value(), e.getResponseBodyAsString());
            return TransferOutcome.rejected("Provider returned HTTP " + e.getStatusCode().value());
        } catch (RuntimeException e) {
            if (isNotSent(e)) {
                log.warn("Transfer {} could not reach provider: {}", request.clientRefId(), e.getMessage());
                return TransferOutcome.rejected("Provider unreachable: " + e.getMessage());
            }
            log.warn("Transfer {} outcome unknown after {} ms: {}", request.clientRefId(),
                    timeout.toMillis(), e.getMessage());
            return TransferOutcome.timeout(isTimeout(e)
                    ? "Request timeout after " + timeout.toMillis() + "ms"
                    : "Connection interrupted: " + e.getMessage());
        }

        if (response == null || !response.succeeded()) {
            String message = response != null && response.message() != null
                    ? response.message() : "Transfer initiation failed";
            log.warn("Transfer {} rejected by provider: {}", request.clientRefId(), message);
            return TransferOutcome.rejected(message);
        }

        ExpressPayTransferData data = response.data();
        if (data == null) {
            log.warn("Transfer {} accepted without transfer data", request.clientRefId());
            return TransferOutcome.accepted(null, ProviderStatus.PENDING, null, response.message());
        }

        ProviderStatus status = ProviderStatus.fromCode(data.status());
        if (status == ProviderStatus.FAILED) {
            String reason = data.remark() != null ? data.remark() : "Transfer failed at provider";
            log.warn("Transfer {} reported failed by provider: {}", request.clientRefId(), reason);
            return TransferOutcome.rejected(reason);
        }

        log.info("Transfer {} accepted: providerTransactionId={}, status={}",
                request.clientRefId(), data.transactionId(), status);
        return TransferOutcome.accepted(data.transactionId(), status, data.referenceNo(), data.remark());
    }

    @Override
    public StatusCheckResult getStatus(String providerTransactionId) {
        log.debug("Checking status: providerTransactionId={}", providerTransactionId);

        try {
            ExpressPayResponse<ExpressPayStatusData> response = webClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/statusCheck")
                            .queryParam("transaction_id", providerTransactionId)
                            .build())
                    .retrieve()
                    .bodyToMono(STATUS_RESPONSE)
                    .timeout(timeout)
                    .block();

            if (response == null || !response.succeeded()) {
                return StatusCheckResult.error(response != null && response.message() != null
                        ? response.message() : "Failed to fetch transfer status");
            }
            ExpressPayStatusData data = response.data();
            if (data == null) {
                return StatusCheckResult.error("No status data returned");
            }
            return StatusCheckResult.of(ProviderStatus.fromCode(data.status()), data.opid(), data.msg());
        } catch (RuntimeException e) {
            log.warn("Status check failed for {}: {}", providerTransactionId, e.getMessage());
            return StatusCheckResult.error(e.getMessage());
        }
    }

    @Override
    public ProviderFloatBalance getFloatBalance() throws ProviderUnavailableException {
        ExpressPayResponse<ExpressPayBalanceData> response;
        try {
            response = webClient.get()
                    .uri("/getBalance")
                    .retrieve()
                    .bodyToMono(BALANCE_RESPONSE)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException("Unable to read provider balance: " + e.getMessage(), e);
        }

        if (response == null || !response.succeeded() || response.data() == null) {
            throw new ProviderUnavailableException("Unable to read provider balance: "
                    + (response != null ? response.message() : "empty response"));
        }
        ExpressPayBalanceData data = response.data();
        return new ProviderFloatBalance(
                data.balance() != null ? data.balance() : BigDecimal.ZERO,
                data.lien() != null ? data.lien() : BigDecimal.ZERO);
    }

    @Override
    public List<ProviderBank> listBanks() throws ProviderUnavailableException {
        ExpressPayResponse<List<ExpressPayBankData>> response;
        try {
            response = webClient.post()
                    .uri("/bankList")
                    .retrieve()
                    .bodyToMono(BANK_LIST_RESPONSE)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException("Unable to fetch bank list: " + e.getMessage(), e);
        }

        if (response == null || !response.succeeded() || response.data() == null) {
            throw new ProviderUnavailableException("Unable to fetch bank list: "
                    + (response != null ? response.message() : "empty response"));
        }
        return response.data().stream()
                .map(b -> new ProviderBank(b.id(), b.bankName(), b.code(), b.ifsc(),
                        Boolean.TRUE.equals(b.imps()),
                        Boolean.TRUE.equals(b.neft()),
                        Boolean.TRUE.equals(b.popular())))
                .toList();
    }

    @Override
    public AccountVerification verifyAccount(String accountNumber, String ifscCode, String bankName) {
        log.info("Verifying account: account={}, ifsc={}", AccountMasking.mask(accountNumber), ifscCode);

        ExpressPayResponse<ExpressPayAccountData> response;
        try {
            response = webClient.post()
                    .uri("/accountVerify")
                    .bodyValue(new ExpressPayAccountVerifyBody(accountNumber, ifscCode, bankName != null ? bankName : ""))
                    .retrieve()
                    .bodyToMono(ACCOUNT_RESPONSE)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            log.warn("Account verification of {} failed: {}", AccountMasking.mask(accountNumber), e.getMessage());
            return AccountVerification.failed(isTimeout(e)
                    ? "Account verification timed out after " + timeout.toMillis() + "ms"
                    : "Account verification failed: " + e.getMessage());
        }

        if (response == null || !response.succeeded()) {
            return AccountVerification.failed(response != null && response.message() != null
                    ? response.message() : "Account verification failed");
        }
        ExpressPayAccountData data = response.data();
        if (data == null) {
            return AccountVerification.failed("Invalid response from verification service");
        }
        if (Boolean.FALSE.equals(data.valid())) {
            return AccountVerification.failed(
                    "Account verification failed. Please check the account number and IFSC code.");
        }

        String resolvedBank = data.bankName() != null ? data.bankName() : bankName;
        log.info("Account {} verified: transactionId={}", AccountMasking.mask(accountNumber), data.transactionId());
        return AccountVerification.verified(
                orNotAvailable(data.accountHolderName()),
                orNotAvailable(resolvedBank),
                orNotAvailable(data.branchName()),
                data.transactionId());
    }

    /**
     * 16-digit numeric request id required by the provider.
     */
    static String generateApiRequestId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder id = new StringBuilder(16);
        id.append(random.nextInt(1, 10));
        for (int i = 1; i < 16; i++) {
            id.append(random.nextInt(10));
        }
        return id.toString();
    }

    private static String orNotAvailable(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    // Failed before the request left this process: the provider cannot have acted on it.
    private static boolean isNotSent(Throwable e) {
        if (!(e instanceof WebClientRequestException)) {
            return false;
        }
        for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return true;
            }
        }
        return false;
    }
}
