package com.shopledger.checkout.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * 배송 구역
 * <p>
 * 국가 코드 집합과, 그 국가로 배송할 수 있는 창고 / 판매 채널을 묶는다.
 * 재고 적격성 판단(목적지 국가 → 창고)의 기준이 된다.
 */
@Entity
@Table(name = "shipping_zones")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ShippingZone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @ElementCollection
    @CollectionTable(name = "shipping_zone_countries",
            joinColumns = @JoinColumn(name = "shipping_zone_id"))
    @Column(name = "country_code", nullable = false, length = 2)
    private Set<String> countries = new HashSet<>();

    @ManyToMany
    @JoinTable(name = "shipping_zone_warehouses",
            joinColumns = @JoinColumn(name = "shipping_zone_id"),
            inverseJoinColumns = @JoinColumn(name = "warehouse_id"))
    private Set<Warehouse> warehouses = new HashSet<>();

    @ManyToMany
    @JoinTable(name = "shipping_zone_channels",
            joinColumns = @JoinColumn(name = "shipping_zone_id"),
            inverseJoinColumns = @JoinColumn(name = "channel_id"))
    private Set<Channel> channels = new HashSet<>();

    @Builder
    public ShippingZone(String name, Set<String> countries) {
        this.name = name;
        if (countries != null) {
            this.countries.addAll(countries);
        }
    }

    public void addWarehouse(Warehouse warehouse) {
        this.warehouses.add(warehouse);
        warehouse.getShippingZones().add(this);
    }

    public void addChannel(Channel channel) {
        this.channels.add(channel);
    }

    public void removeChannel(Channel channel) {
        this.channels.remove(channel);
    }
}
