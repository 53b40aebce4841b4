package com.shopledger.checkout.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "warehouses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Warehouse {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    /**
     * 이 창고에서 배송 가능한 배송 구역 (소유 측은 ShippingZone)
     */
    @ManyToMany(mappedBy = "warehouses")
    private Set<ShippingZone> shippingZones = new HashSet<>();

    @Builder
    public Warehouse(String name) {
        this.name = name;
    }
}
