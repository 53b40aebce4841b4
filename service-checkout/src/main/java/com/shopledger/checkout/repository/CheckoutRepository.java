package com.shopledger.checkout.repository;

import com.shopledger.checkout.entity.Checkout;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CheckoutRepository extends JpaRepository<Checkout, Long> {

    Optional<Checkout> findByToken(UUID token);
}
