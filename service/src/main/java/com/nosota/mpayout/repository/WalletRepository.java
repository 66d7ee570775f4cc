package com.nosota.mpayout.repository;

import com.nosota.mpayout.model.Wallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WalletRepository extends JpaRepository<Wallet, Integer> {
    /**
     * Retrieves the merchant's {@link Wallet} and locks it for update.
     * <p>
     * Every reservation and refund takes this <b>pessimistic write lock</b> first, so two concurrent
     * movements for the same merchant are serialized by the database. Keep the surrounding
     * transaction short: other movements of the merchant block until it commits.
     * </p>
     *
     * @param ownerId The merchant ID.
     * @return The wallet, locked for update, or empty if the merchant has no wallet.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.ownerId = :ownerId")
    Optional<Wallet> getOneForUpdate(@Param("ownerId") Long ownerId);

    Optional<Wallet> findByOwnerId(Long ownerId);
}
