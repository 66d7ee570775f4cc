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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Payout API interface for bank transfers out of merchant wallets.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Transfer submission and status lookup</li>
 *   <li>Reconciliation of transactions left in PROCESSING</li>
 *   <li>Provider data (float balance, supported banks, account verification, status callbacks)</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>PayoutController - in service module (server-side implementation)</li>
 *   <li>PayoutClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/payout")
public interface PayoutApi {

    // ==================== Transfers ====================

    /**
     * Submits a transfer from the merchant wallet to a bank account.
     *
     * @param merchantId The merchant ID
     * @param request    Transfer details
     * @return Transfer outcome (SUCCESS or PROCESSING)
     */
    @PostMapping("/merchants/{merchantId}/transfers")
    ResponseEntity<PayoutTransferResponse> submitTransfer(
            @PathVariable("merchantId") Long merchantId,
            @RequestBody PayoutTransferRequest request) throws Exception;

    /**
     * Gets a transaction snapshot by id.
     *
     * @param merchantId    The merchant ID (owner of the transaction)
     * @param transactionId The payout transaction ID
     * @param refresh       Re-query the provider when the transaction is unresolved
     * @return Transaction snapshot
     */
    @GetMapping("/merchants/{merchantId}/transfers/{transactionId}")
    ResponseEntity<PayoutTransactionDTO> getTransfer(
            @PathVariable("merchantId") Long merchantId,
            @PathVariable("transactionId") UUID transactionId,
            @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) throws Exception;

    /**
     * Gets a transaction snapshot by client reference id.
     */
    @GetMapping("/merchants/{merchantId}/transfers/by-reference/{clientRefId}")
    ResponseEntity<PayoutTransactionDTO> getTransferByClientRef(
            @PathVariable("merchantId") Long merchantId,
            @PathVariable("clientRefId") String clientRefId,
            @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) throws Exception;

    /**
     * Lists the most recent transactions of a merchant, newest first.
     *
     * @param merchantId The merchant ID
     * @param limit      Maximum number of transactions (capped at 100)
     * @return Transaction snapshots
     */
    @GetMapping("/merchants/{merchantId}/transfers")
    ResponseEntity<List<PayoutTransactionDTO>> listRecentTransfers(
            @PathVariable("merchantId") Long merchantId,
            @RequestParam(value = "limit", defaultValue = "20") int limit);

    @GetMapping("/merchants/{merchantId}/transfers/pending-count")
    ResponseEntity<PendingCountResponse> getPendingCount(
            @PathVariable("merchantId") Long merchantId);

    @GetMapping("/merchants/{merchantId}/balance")
    ResponseEntity<BalanceResponse> getBalance(
            @PathVariable("merchantId") Long merchantId) throws Exception;

    /**
     * Resolves the charge for a prospective transfer without submitting it.
     */
    @GetMapping("/merchants/{merchantId}/charges")
    ResponseEntity<ChargePreviewResponse> previewCharge(
            @PathVariable("merchantId") Long merchantId,
            @RequestParam("amount") BigDecimal amount,
            @RequestParam("transferMode") TransferMode transferMode) throws Exception;

    // ==================== Reconciliation ====================

    /**
     * Runs reconciliation on demand.
     *
     * @param request Optional scope (merchant and/or explicit transaction ids)
     * @return Run summary
     */
    @PostMapping("/reconciliation")
    ResponseEntity<ReconciliationResponse> reconcile(
            @RequestBody(required = false) ReconciliationRequest request);

    // ==================== Provider ====================

    @GetMapping("/provider/balance")
    ResponseEntity<ProviderBalanceResponse> getProviderBalance() throws Exception;

    /**
     * Lists banks supported by the provider.
     */
    @GetMapping("/banks")
    ResponseEntity<List<BankResponse>> listBanks(
            @RequestParam(value = "impsOnly", defaultValue = "false") boolean impsOnly,
            @RequestParam(value = "neftOnly", defaultValue = "false") boolean neftOnly,
            @RequestParam(value = "popularOnly", defaultValue = "false") boolean popularOnly,
            @RequestParam(value = "search", required = false) String search) throws Exception;

    /**
     * Verifies a beneficiary account with the provider and returns the registered holder name.
     *
     * @param request Account number and IFSC; separators are ignored and IFSC is case-insensitive
     * @return Verification result; a failed verification is answered with 400
     */
    @PostMapping("/accounts/verify")
    ResponseEntity<AccountVerificationResponse> verifyAccount(
            @Valid @RequestBody AccountVerificationRequest request) throws Exception;

    /**
     * Receives a final status pushed by the provider.
     */
    @PostMapping("/provider/callback")
    ResponseEntity<PayoutTransactionDTO> providerCallback(
            @Valid @RequestBody ProviderCallbackRequest request) throws Exception;
}
