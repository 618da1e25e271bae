package com.lendingpool.repository;

import com.lendingpool.model.InterestRateCurve;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface InterestRateCurveRepository extends JpaRepository<InterestRateCurve, String> {
}
