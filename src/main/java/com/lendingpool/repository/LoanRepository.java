package com.lendingpool.repository;

import com.lendingpool.model.Loan;
import com.lendingpool.model.LoanAssets;
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

@Repository
public interface LoanRepository extends JpaRepository<Loan, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT l FROM Loan l WHERE l.id = :id")
    Optional<Loan> findForUpdate(@Param("id") Long id);

    @Query("SELECT new com.lendingpool.model.LoanAssets(l.id, l.collateralAsset, l.borrowAsset, l.status) "
            + "FROM Loan l WHERE l.id = :id")
    Optional<LoanAssets> findAssetsById(@Param("id") Long id);

    List<Loan> findByBorrowerOrderByIdAsc(String borrower);

    @Query("SELECT COALESCE(MAX(l.id), 0) FROM Loan l")
    long findMaxId();
}
