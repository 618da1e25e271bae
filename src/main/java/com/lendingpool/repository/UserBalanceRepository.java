package com.lendingpool.repository;

import com.lendingpool.model.UserBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserBalanceRepository extends JpaRepository<UserBalance, Long> {

    // Callers already hold the pool lock; this keeps concurrent writers of one account ordered too
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM UserBalance b WHERE b.account = :account AND b.asset = :asset")
    Optional<UserBalance> findForUpdate(@Param("account") String account, @Param("asset") String asset);

    Optional<UserBalance> findByAccountAndAsset(String account, String asset);

    List<UserBalance> findByAccountOrderByAssetAsc(String account);
}
