package com.shopledger.checkout.repository;

import com.shopledger.checkout.entity.ShippingZone;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ShippingZoneRepository extends JpaRepository<ShippingZone, Long> {

    /**
     * 채널에 배송 구역이 하나라도 할당되어 있는지
     */
    boolean existsByChannelsId(Long channelId);
}
