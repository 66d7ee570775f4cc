package com.nosota.mpayout.controller;

import com.nosota.mpayout.api.PayoutApi;
import com.nosota.mpayout.api.dto.PayoutTransactionDTO;
import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.api.request.PayoutTransferRequest;
import com.nosota.mpayout.api.request.AccountVerificationRequest;
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
import com.nosota.mpayout.dto.ReconciliationScope;
import com.nosota.mpayout.dto.ReconciliationSummary;
import com.nosota.mpayout.mapper.PayoutTransactionMapper;
import com.nosota.mpayout.model.PayoutTransaction;
import com.nosota.mpayout.service.AccountVerificationService;
import com.nosota.mpayout.service.PayoutBankService;
import com.nosota.mpayout.service.PayoutReconciliationService;
import com.nosota.mpayout.service.PayoutTransactionService;
import com.nosota.mpayout.service.PayoutTransferService;
import com.nosota.mpayout.service.WalletLedgerGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for payout transfers.
 *
 * <p>Implements {@link PayoutApi} interface for:
 * <ul>
 *   <li>Transfer submission and lookup</li>
 *   <li>Wallet balance and charge preview</li>
 *   <li>Reconciliation on demand</li>
 *   <li>Provider float, bank list, account verification and status callbacks</li>
 * </ul>
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class PayoutController implements PayoutApi {

    private final PayoutTransferService payoutTransferService;
    private final PayoutTransactionService payoutTransactionService;
    private final PayoutReconciliationService payoutReconciliationService;
    private final PayoutBankService payoutBankService;
    private final AccountVerificationService accountVerificationService;
    private final WalletLedgerGateway walletLedgerGateway;

    // ==================== Transfers ====================

    @Override
    public ResponseEntity<PayoutTransferResponse> submitTransfer(Long merchantId, PayoutTransferRequest request)
            throws Exception {
        PayoutTransferResponse response = payoutTransferService.submit(merchantId, request);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PayoutTransactionDTO> getTransfer(Long merchantId, UUID transactionId, boolean refresh)
            throws Exception {
        PayoutTransaction tx = payoutTransactionService.getForMerchant(merchantId, transactionId);
        return ResponseEntity.ok(toDTO(tx, refresh));
    }

    @Override
    public ResponseEntity<PayoutTransactionDTO> getTransferByClientRef(Long merchantId, String clientRefId,
                                                                       boolean refresh) throws Exception {
        PayoutTransaction tx = payoutTransactionService.getForMerchantByClientRef(merchantId, clientRefId);
        return ResponseEntity.ok(toDTO(tx, refresh));
    }

    @Override
    public ResponseEntity<List<PayoutTransactionDTO>> listRecentTransfers(Long merchantId, int limit) {
        List<PayoutTransaction> transactions = payoutTransactionService.listRecent(merchantId, limit);
        return ResponseEntity.ok(PayoutTransactionMapper.INSTANCE.toDTOList(transactions));
    }

    @Override
    public ResponseEntity<PendingCountResponse> getPendingCount(Long merchantId) {
        long pending = payoutTransactionService.countPending(merchantId);
        return ResponseEntity.ok(new PendingCountResponse(merchantId, pending));
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(Long merchantId) throws Exception {
        BigDecimal balance = walletLedgerGateway.balance(merchantId);
        return ResponseEntity.ok(new BalanceResponse(merchantId, balance));
    }

    @Override
    public ResponseEntity<ChargePreviewResponse> previewCharge(Long merchantId, BigDecimal amount,
                                                               TransferMode transferMode) throws Exception {
        return ResponseEntity.ok(payoutTransferService.previewCharge(merchantId, amount, transferMode));
    }

    // ==================== Reconciliation ====================

    @Override
    public ResponseEntity<ReconciliationResponse> reconcile(ReconciliationRequest request) {
        ReconciliationScope scope = request == null
                ? ReconciliationScope.all()
                : new ReconciliationScope(request.merchantId(), request.transactionIds());
        ReconciliationSummary summary = payoutReconciliationService.reconcile(scope);
        return ResponseEntity.ok(PayoutTransactionMapper.INSTANCE.toResponse(summary));
    }

    // ==================== Provider ====================

    @Override
    public ResponseEntity<ProviderBalanceResponse> getProviderBalance() throws Exception {
        return ResponseEntity.ok(payoutBankService.getProviderBalance());
    }

    @Override
    public ResponseEntity<List<BankResponse>> listBanks(boolean impsOnly, boolean neftOnly, boolean popularOnly,
                                                        String search) throws Exception {
        return ResponseEntity.ok(payoutBankService.listBanks(impsOnly, neftOnly, popularOnly, search));
    }

    @Override
    public ResponseEntity<AccountVerificationResponse> verifyAccount(AccountVerificationRequest request)
            throws Exception {
        return ResponseEntity.ok(accountVerificationService.verify(request));
    }

    @Override
    public ResponseEntity<PayoutTransactionDTO> providerCallback(ProviderCallbackRequest request) throws Exception {
        payoutReconciliationService.applyCallback(request);
        PayoutTransaction tx = payoutTransactionService.findByClientRefId(request.clientRefId()).orElseThrow();
        return ResponseEntity.ok(PayoutTransactionMapper.INSTANCE.toDTO(tx));
    }

    private PayoutTransactionDTO toDTO(PayoutTransaction tx, boolean refresh) {
        PayoutTransaction current = refresh ? payoutReconciliationService.refreshStatus(tx) : tx;
        return PayoutTransactionMapper.INSTANCE.toDTO(current);
    }
}
