package com.shopledger.checkout.repository;

import com.shopledger.checkout.entity.ShippingMethod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ShippingMethodRepository extends JpaRepository<ShippingMethod, Long> {

    /**
     * 채널에 할당되고 국가를 포함하는 배송 구역의 배송 방법
     */
    @Query("SELECT DISTINCT m FROM ShippingMethod m JOIN m.shippingZone z JOIN z.channels c JOIN z.countries zc " +
            "WHERE c.id = :channelId AND zc = :countryCode ORDER BY m.id")
    List<ShippingMethod> findApplicable(@Param("channelId") Long channelId,
                                        @Param("countryCode") String countryCode);
}
