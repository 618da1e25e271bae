package com.lendingpool.repository;

import com.lendingpool.model.Pool;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Pool rows. Writers always go through {@link #findForUpdate(String)} so two operations
 * touching the same pool are serialized by the database row lock.
 */
@Repository
public interface PoolRepository extends JpaRepository<Pool, String> {

    /**
     * SELECT ... FOR UPDATE. The lock is held until the surrounding transaction
     * commits or rolls back.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT p FROM Pool p WHERE p.asset = :asset")
    Optional<Pool> findForUpdate(@Param("asset") String asset);

    List<Pool> findAllByOrderByAssetAsc();

    /** Asset ids only; no Pool entity is loaded, so a following lock reads the current row. */
    @Query("SELECT p.asset FROM Pool p ORDER BY p.asset")
    List<String> findAllAssets();
}
