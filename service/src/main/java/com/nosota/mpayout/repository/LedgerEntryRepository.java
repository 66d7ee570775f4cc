package com.nosota.mpayout.repository;

import com.nosota.mpayout.model.LedgerEntry;
import com.nosota.mpayout.model.LedgerEntryType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    /**
     * Balance of a wallet: credits minus debits over all of its entries.
     *
     * @param walletId The wallet ID
     * @return Balance, or null for a wallet without entries
     */
    @Query("SELECT SUM(e.creditAmount - e.debitAmount) FROM LedgerEntry e WHERE e.walletId = :walletId")
    BigDecimal getBalance(@Param("walletId") Integer walletId);

    List<LedgerEntry> findByTransactionIdOrderByIdAsc(UUID transactionId);

    Optional<LedgerEntry> findFirstByTransactionIdAndEntryType(UUID transactionId, LedgerEntryType entryType);

    long countByTransactionIdAndEntryType(UUID transactionId, LedgerEntryType entryType);
}
