package com.nosota.mpayout.api;

import com.nosota.mpayout.api.dto.PayoutTransactionDTO;
import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.api.request.AccountVerificationRequest;
import com.nosota.mpayout.api.request.PayoutTransferRequest;
import com.nosota.mpayout.api.request.ProviderCallbackRequest;
import com.nosota.mpayout.api.request.ReconciliationRequest;
import com.nosota.mpayout.api.response.AccountVerificationResponse;
import com.nosota.mpayout.api.response.BalanceResponse;
import com.nosota.mpayout.api.response.BankResponse;
import com.nosota.mpayout.api.response.ChargePreviewResponse;
import com.nosota.mpayout.api.response.PayoutTransferResponse;
import com.nosota.mpayout.api.response.PendingCountResponse;
import com.nosota.mpayout.api.response.ProviderBalanceResponse;
import com.nosota.mpayout.api.response.ReconciliationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * WebClient-based implementation of PayoutApi for consuming the payout service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class MPayoutClientConfig {
 *     @Bean
 *     public WebClient mpayoutWebClient(WebClient.Builder builder,
 *                                       @Value("${services.mpayout.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public PayoutClient payoutClient(WebClient mpayoutWebClient) {
 *         return new PayoutClient(mpayoutWebClient);
 *     }
 * }
 * }
 * </pre>
 *
 * <p>Non-2xx responses surface as {@code WebClientResponseException}.
 */
@RequiredArgsConstructor
@Slf4j
public class PayoutClient implements PayoutApi {

    private static final String BASE = "/api/v1/payout";

    private final WebClient webClient;

    // ==================== Transfers ====================

    @Override
    public ResponseEntity<PayoutTransferResponse> submitTransfer(Long merchantId, PayoutTransferRequest request) {
        log.debug("Calling submitTransfer: merchantId={}, clientRefId={}", merchantId, request.clientRefId());

        return webClient.post()
                .uri(BASE + "/merchants/{merchantId}/transfers", merchantId)
                .bodyValue(request)
                .retrieve()
                .toEntity(PayoutTransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PayoutTransactionDTO> getTransfer(Long merchantId, UUID transactionId, boolean refresh) {
        log.debug("Calling getTransfer: merchantId={}, transactionId={}", merchantId, transactionId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/merchants/{merchantId}/transfers/{transactionId}")
                        .queryParam("refresh", refresh)
                        .build(merchantId, transactionId))
                .retrieve()
                .toEntity(PayoutTransactionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<PayoutTransactionDTO> getTransferByClientRef(Long merchantId, String clientRefId, boolean refresh) {
        log.debug("Calling getTransferByClientRef: merchantId={}, clientRefId={}", merchantId, clientRefId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/merchants/{merchantId}/transfers/by-reference/{clientRefId}")
                        .queryParam("refresh", refresh)
                        .build(merchantId, clientRefId))
                .retrieve()
                .toEntity(PayoutTransactionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<PayoutTransactionDTO>> listRecentTransfers(Long merchantId, int limit) {
        log.debug("Calling listRecentTransfers: merchantId={}, limit={}", merchantId, limit);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/merchants/{merchantId}/transfers")
                        .queryParam("limit", limit)
                        .build(merchantId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<PayoutTransactionDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PendingCountResponse> getPendingCount(Long merchantId) {
        log.debug("Calling getPendingCount: merchantId={}", merchantId);

        return webClient.get()
                .uri(BASE + "/merchants/{merchantId}/transfers/pending-count", merchantId)
                .retrieve()
                .toEntity(PendingCountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(Long merchantId) {
        log.debug("Calling getBalance: merchantId={}", merchantId);

        return webClient.get()
                .uri(BASE + "/merchants/{merchantId}/balance", merchantId)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ChargePreviewResponse> previewCharge(Long merchantId, BigDecimal amount, TransferMode transferMode) {
        log.debug("Calling previewCharge: merchantId={}, amount={}, mode={}", merchantId, amount, transferMode);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/merchants/{merchantId}/charges")
                        .queryParam("amount", amount)
                        .queryParam("transferMode", transferMode)
                        .build(merchantId))
                .retrieve()
                .toEntity(ChargePreviewResponse.class)
                .block();
    }

    // ==================== Reconciliation ====================

    @Override
    public ResponseEntity<ReconciliationResponse> reconcile(ReconciliationRequest request) {
        log.debug("Calling reconcile: scope={}", request);

        WebClient.RequestBodySpec bodySpec = webClient.post().uri(BASE + "/reconciliation");
        WebClient.RequestHeadersSpec<?> spec = request != null ? bodySpec.bodyValue(request) : bodySpec;
        return spec.retrieve()
                .toEntity(ReconciliationResponse.class)
                .block();
    }

    // ==================== Provider ====================

    @Override
    public ResponseEntity<ProviderBalanceResponse> getProviderBalance() {
        log.debug("Calling getProviderBalance");

        return webClient.get()
                .uri(BASE + "/provider/balance")
                .retrieve()
                .toEntity(ProviderBalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<BankResponse>> listBanks(boolean impsOnly, boolean neftOnly, boolean popularOnly, String search) {
        log.debug("Calling listBanks: impsOnly={}, neftOnly={}, popularOnly={}, search={}",
                impsOnly, neftOnly, popularOnly, search);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/banks")
                        .queryParam("impsOnly", impsOnly)
                        .queryParam("neftOnly", neftOnly)
                        .queryParam("popularOnly", popularOnly)
                        .queryParamIfPresent("search", Optional.ofNullable(search))
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BankResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<AccountVerificationResponse> verifyAccount(AccountVerificationRequest request) {
        log.debug("Calling verifyAccount: ifsc={}", request.ifscCode());

        return webClient.post()
                .uri(BASE + "/accounts/verify")
                .bodyValue(request)
                .retrieve()
                .toEntity(AccountVerificationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PayoutTransactionDTO> providerCallback(ProviderCallbackRequest request) {
        log.debug("Calling providerCallback: clientRefId={}", request.clientRefId());

        return webClient.post()
                .uri(BASE + "/provider/callback")
                .bodyValue(request)
                .retrieve()
                .toEntity(PayoutTransactionDTO.class)
                .block();
    }
}
