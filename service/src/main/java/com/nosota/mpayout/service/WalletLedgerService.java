package com.nosota.mpayout.service;

import com.nosota.mpayout.error.InsufficientFundsException;
import com.nosota.mpayout.error.WalletNotFoundException;
import com.nosota.mpayout.model.FundCategory;
import com.nosota.mpayout.model.LedgerEntry;
import com.nosota.mpayout.model.LedgerEntryStatus;
import com.nosota.mpayout.model.LedgerEntryType;
import com.nosota.mpayout.model.Wallet;
import com.nosota.mpayout.repository.LedgerEntryRepository;
import com.nosota.mpayout.repository.WalletRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA implementation of {@link WalletLedgerGateway}.
 *
 * <p>The merchant's {@link Wallet} row is locked with PESSIMISTIC_WRITE before the balance is read,
 * so reservation and refund for one merchant are serialized by the database. The balance is always
 * derived from the ledger, never stored.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletLedgerService implements WalletLedgerGateway {

    private final WalletRepository walletRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final Clock clock;

    @Override
    public BigDecimal balance(Long merchantId) throws WalletNotFoundException {
        Wallet wallet = walletRepository.findByOwnerId(merchantId)
                .orElseThrow(() -> new WalletNotFoundException("Wallet for merchant " + merchantId + " not found"));
        return balanceOf(wallet);
    }

    @Override
    @Transactional(rollbackOn = {InsufficientFundsException.class, WalletNotFoundException.class})
    public Long reserve(Long merchantId, UUID transactionId, BigDecimal totalAmount,
                        String description, String reference)
            throws WalletNotFoundException, InsufficientFundsException {

        Wallet wallet = lockWallet(merchantId);

        BigDecimal available = balanceOf(wallet);
        if (available.compareTo(totalAmount) < 0) {
            throw new InsufficientFundsException(
                    String.format("Insufficient funds in wallet of merchant %d: available=%s, required=%s",
                            merchantId, available, totalAmount),
                    available, totalAmount);
        }

        LedgerEntry debit = newEntry(wallet, transactionId, LedgerEntryType.DEBIT, reference, description);
        debit.setDebitAmount(totalAmount);
        debit.setStatus(LedgerEntryStatus.PENDING);
        LedgerEntry saved = ledgerEntryRepository.save(debit);

        log.info("Reserved funds: merchantId={}, transactionId={}, amount={}, balanceBefore={}, entryId={}",
                merchantId, transactionId, totalAmount, available, saved.getId());
        return saved.getId();
    }

    @Override
    @Transactional(rollbackOn = WalletNotFoundException.class)
    public Long refund(Long merchantId, UUID transactionId, BigDecimal totalAmount,
                       String description, String reference) throws WalletNotFoundException {

        Wallet wallet = lockWallet(merchantId);

        Optional<LedgerEntry> existing = ledgerEntryRepository
                .findFirstByTransactionIdAndEntryType(transactionId, LedgerEntryType.REFUND);
        if (existing.isPresent()) {
            log.warn("Refund for transaction {} already booked as entry {}, not booking again",
                    transactionId, existing.get().getId());
            return existing.get().getId();
        }

        LedgerEntry refund = newEntry(wallet, transactionId, LedgerEntryType.REFUND, reference, description);
        refund.setCreditAmount(totalAmount);
        refund.setStatus(LedgerEntryStatus.COMPLETED);
        LedgerEntry saved = ledgerEntryRepository.save(refund);

        log.info("Refunded funds: merchantId={}, transactionId={}, amount={}, reference={}, entryId={}",
                merchantId, transactionId, totalAmount, reference, saved.getId());
        return saved.getId();
    }

    @Override
    @Transactional
    public Long credit(Long merchantId, BigDecimal amount, String description,
                       String reference) {
        Wallet wallet = walletRepository.getOneForUpdate(merchantId)
                .orElseGet(() -> createWallet(merchantId));

        LedgerEntry credit = newEntry(wallet, null, LedgerEntryType.CREDIT, reference, description);
        credit.setCreditAmount(amount);
        credit.setStatus(LedgerEntryStatus.COMPLETED);
        LedgerEntry saved = ledgerEntryRepository.save(credit);

        log.info("Credited wallet: merchantId={}, amount={}, reference={}, entryId={}",
                merchantId, amount, reference, saved.getId());
        return saved.getId();
    }

    @Override
    @Transactional
    public boolean completeEntry(Long entryId) {
        return moveEntry(entryId, LedgerEntryStatus.COMPLETED);
    }

    @Override
    @Transactional
    public boolean failEntry(Long entryId) {
        return moveEntry(entryId, LedgerEntryStatus.FAILED);
    }

    private boolean moveEntry(Long entryId, LedgerEntryStatus target) {
        LedgerEntry entry = ledgerEntryRepository.findById(entryId)
                .orElseThrow(() -> new EntityNotFoundException("Ledger entry " + entryId + " not found"));

        if (entry.getStatus() != LedgerEntryStatus.PENDING) {
            log.debug("Ledger entry {} already {}, not moving to {}", entryId, entry.getStatus(), target);
            return false;
        }
        entry.setStatus(target);
        ledgerEntryRepository.save(entry);
        return true;
    }

    private Wallet lockWallet(Long merchantId) throws WalletNotFoundException {
        return walletRepository.getOneForUpdate(merchantId)
                .orElseThrow(() -> new WalletNotFoundException("Wallet for merchant " + merchantId + " not found"));
    }

    private BigDecimal balanceOf(Wallet wallet) {
        BigDecimal balance = ledgerEntryRepository.getBalance(wallet.getId());
        return balance != null ? balance : BigDecimal.ZERO;
    }

    private Wallet createWallet(Long merchantId) {
        Wallet wallet = new Wallet();
        wallet.setOwnerId(merchantId);
        wallet.setDescription("Primary wallet of merchant " + merchantId);
        wallet.setCreatedAt(LocalDateTime.now(clock));
        Wallet saved = walletRepository.saveAndFlush(wallet);
        log.info("Created wallet {} for merchant {}", saved.getId(), merchantId);
        return saved;
    }

    private LedgerEntry newEntry(Wallet wallet, UUID transactionId, LedgerEntryType type,
                                 String reference, String description) {
        LedgerEntry entry = new LedgerEntry();
        entry.setOwnerId(wallet.getOwnerId());
        entry.setWalletId(wallet.getId());
        entry.setFundCategory(FundCategory.PAYOUT);
        entry.setEntryType(type);
        entry.setReferenceId(reference);
        entry.setTransactionId(transactionId);
        entry.setRemarks(description);
        entry.setCreatedAt(LocalDateTime.now(clock));
        return entry;
    }
}
