package com.nosota.mpayout.repository;

import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.model.PayoutTransaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayoutTransactionRepository extends JpaRepository<PayoutTransaction, UUID> {

    /**
     * Retrieves a transaction and locks it for update, so that concurrent resolvers
     * (live request, reconciliation run, provider callback) apply at most one transition.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM PayoutTransaction t WHERE t.id = :id")
    Optional<PayoutTransaction> getOneForUpdate(@Param("id") UUID id);

    Optional<PayoutTransaction> findByClientRefId(String clientRefId);

    /**
     * Most recent transaction to the same destination in the given statuses created after {@code since}.
     */
    Optional<PayoutTransaction> findFirstByMerchantIdAndAccountNumberAndStatusInAndCreatedAtAfterOrderByCreatedAtDesc(
            Long merchantId, String accountNumber, Collection<PayoutStatus> statuses, LocalDateTime since);

    List<PayoutTransaction> findByMerchantIdOrderByCreatedAtDesc(Long merchantId, Pageable pageable);

    long countByMerchantIdAndStatusIn(Long merchantId, Collection<PayoutStatus> statuses);

    // ==================== Reconciliation selection (oldest first) ====================

    List<PayoutTransaction> findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
            Collection<PayoutStatus> statuses, LocalDateTime cutoff, Pageable pageable);

    List<PayoutTransaction> findByMerchantIdAndStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
            Long merchantId, Collection<PayoutStatus> statuses, LocalDateTime cutoff, Pageable pageable);

    List<PayoutTransaction> findByIdInAndStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
            Collection<UUID> ids, Collection<PayoutStatus> statuses, LocalDateTime cutoff, Pageable pageable);

    List<PayoutTransaction> findByMerchantIdAndIdInAndStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
            Long merchantId, Collection<UUID> ids, Collection<PayoutStatus> statuses, LocalDateTime cutoff,
            Pageable pageable);
}
