package com.shopledger.checkout.repository;

import com.shopledger.checkout.entity.CheckoutLine;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CheckoutLineRepository extends JpaRepository<CheckoutLine, Long> {

    List<CheckoutLine> findByCheckoutIdOrderById(Long checkoutId);

    Optional<CheckoutLine> findByCheckoutIdAndVariantId(Long checkoutId, Long variantId);
}
