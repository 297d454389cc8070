package com.flagship.settlement_engine.withdrawal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PayoutAccountRepository extends JpaRepository<PayoutAccountEntity, UUID> {
}
