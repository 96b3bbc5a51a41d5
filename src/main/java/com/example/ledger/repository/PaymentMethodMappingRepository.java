package com.example.ledger.repository;

import com.example.ledger.domain.PaymentMethod;
import com.example.ledger.domain.PaymentMethodMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentMethodMappingRepository extends JpaRepository<PaymentMethodMapping, Long> {

    Optional<PaymentMethodMapping> findByOrgIdAndMethod(Long orgId, PaymentMethod method);

    List<PaymentMethodMapping> findByOrgIdOrderByMethod(Long orgId);
}
