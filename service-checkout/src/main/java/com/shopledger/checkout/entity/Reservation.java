package com.shopledger.checkout.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 체크아웃 라인이 특정 재고에 걸어둔 시간 제한 예약
 * <p>
 * reservedUntil 이 지나면 만료된 것으로 간주되어 가용 재고 계산에서 제외된다.
 * 만료된 행은 즉시 삭제되지 않으며 정리 스케줄러가 나중에 지운다.
 * 라인-재고 쌍마다 하나만 존재하고, 다시 예약하면 기존 행을 갱신한다.
 */
@Entity
@Table(name = "reservations",
        uniqueConstraints = @UniqueConstraint(columnNames = {"checkout_line_id", "stock_id"}),
        indexes = @Index(name = "idx_reservations_stock_until", columnList = "stock_id, reserved_until"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Reservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "checkout_line_id", nullable = false)
    private CheckoutLine checkoutLine;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "stock_id", nullable = false)
    private Stock stock;

    @Column(name = "quantity_reserved", nullable = false)
    private Integer quantityReserved;

    @Column(name = "reserved_until", nullable = false)
    private LocalDateTime reservedUntil;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    @Builder
    public Reservation(CheckoutLine checkoutLine, Stock stock, Integer quantityReserved, LocalDateTime reservedUntil) {
        if (quantityReserved == null || quantityReserved <= 0) {
            throw new IllegalArgumentException("예약 수량은 0보다 커야 합니다: " + quantityReserved);
        }
        this.checkoutLine = checkoutLine;
        this.stock = stock;
        this.quantityReserved = quantityReserved;
        this.reservedUntil = reservedUntil;
    }

    /**
     * 기존 예약을 새 수량 / 만료 시각으로 갱신
     */
    public void renew(int quantity, LocalDateTime until) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("예약 수량은 0보다 커야 합니다: " + quantity);
        }
        this.quantityReserved = quantity;
        this.reservedUntil = until;
    }
}
