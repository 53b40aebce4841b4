package com.shopledger.checkout.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 진행 중인(아직 주문으로 전환되지 않은) 체크아웃
 */
@Entity
@Table(name = "checkouts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Checkout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false)
    private UUID token;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "channel_id", nullable = false)
    private Channel channel;

    /**
     * 재고 적격성 판단에 쓰이는 국가 코드. 배송지가 설정되면 배송지 국가를 따른다.
     */
    @Column(nullable = false, length = 2)
    private String country;

    @Embedded
    @AttributeOverride(name = "country", column = @Column(name = "shipping_country", length = 2))
    private Address shippingAddress;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shipping_method_id")
    private ShippingMethod shippingMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "shipping_state", nullable = false, length = 40)
    private CheckoutShippingState shippingState;

    @Column(name = "last_change", nullable = false)
    private LocalDateTime lastChange;

    @Version
    private Long version;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "checkout", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<CheckoutLine> lines = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        if (this.token == null) {
            this.token = UUID.randomUUID();
        }
        if (this.shippingState == null) {
            this.shippingState = CheckoutShippingState.NO_SHIPPING_ADDRESS;
        }
        if (this.lastChange == null) {
            this.lastChange = this.createdAt;
        }
    }

    @Builder
    public Checkout(Channel channel, String country, LocalDateTime lastChange) {
        this.token = UUID.randomUUID();
        this.channel = channel;
        this.country = country;
        this.lastChange = lastChange;
        this.shippingState = CheckoutShippingState.NO_SHIPPING_ADDRESS;
    }

    // 비즈니스 메서드
    public void addLine(CheckoutLine line) {
        this.lines.add(line);
    }

    public void removeLine(CheckoutLine line) {
        this.lines.remove(line);
    }

    /**
     * 배송지 변경. 체크아웃 국가도 배송지 국가로 바뀐다.
     */
    public void updateShippingAddress(Address address, LocalDateTime now) {
        this.shippingAddress = address;
        this.country = address.getCountry();
        if (this.shippingState == CheckoutShippingState.NO_SHIPPING_ADDRESS) {
            this.shippingState = CheckoutShippingState.ADDRESS_SET_METHOD_VALID;
        }
        touch(now);
    }

    public void selectShippingMethod(ShippingMethod method, LocalDateTime now) {
        this.shippingMethod = method;
        this.shippingState = CheckoutShippingState.ADDRESS_SET_METHOD_VALID;
        touch(now);
    }

    public void markShippingMethodValid() {
        this.shippingState = CheckoutShippingState.ADDRESS_SET_METHOD_VALID;
    }

    /**
     * 배송지 변경으로 무효가 된 배송 방법 해제 (주소는 유지)
     */
    public void clearShippingMethod() {
        this.shippingMethod = null;
        this.shippingState = CheckoutShippingState.ADDRESS_SET_METHOD_CLEARED;
    }

    public boolean hasShippingAddress() {
        return this.shippingAddress != null;
    }

    public void touch(LocalDateTime now) {
        this.lastChange = now;
    }
}
