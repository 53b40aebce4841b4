package com.shopledger.checkout.entity;

import com.shopledger.common.exception.BusinessException;
import com.shopledger.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 창고별 / 상품 옵션별 재고
 * <p>
 * quantity 는 항상 0 이상. 예약은 이 값을 직접 차감하지 않고
 * Reservation 행으로 따로 관리된다 (가용 재고 = quantity - 활성 예약 합계).
 */
@Entity
@Table(name = "stocks",
        uniqueConstraints = @UniqueConstraint(columnNames = {"warehouse_id", "product_variant_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Stock {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "warehouse_id", nullable = false)
    private Warehouse warehouse;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_variant_id", nullable = false)
    private ProductVariant variant;

    @Column(nullable = false)
    private Integer quantity;

    @Version
    private Long version;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
        if (this.quantity == null) {
            this.quantity = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    @Builder
    public Stock(Warehouse warehouse, ProductVariant variant, Integer quantity) {
        this.warehouse = warehouse;
        this.variant = variant;
        this.quantity = validateQuantity(quantity != null ? quantity : 0);
    }

    /**
     * 재고 수량 변경 (입고, 실사 조정)
     */
    public void changeQuantity(int newQuantity) {
        this.quantity = validateQuantity(newQuantity);
    }

    private static int validateQuantity(int quantity) {
        if (quantity < 0) {
            throw new BusinessException("재고 수량은 음수일 수 없습니다: " + quantity,
                    ErrorCode.INVALID_INPUT.toErrorInfo("재고 수량은 음수일 수 없습니다", "quantity"));
        }
        return quantity;
    }
}
