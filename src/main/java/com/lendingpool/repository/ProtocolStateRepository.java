package com.lendingpool.repository;

import com.lendingpool.model.ProtocolState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProtocolStateRepository extends JpaRepository<ProtocolState, Long> {
}
