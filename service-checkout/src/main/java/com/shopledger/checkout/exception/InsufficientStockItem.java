package com.shopledger.checkout.exception;

/**
 * 재고 부족 품목 (요청 수량 대비 가용 수량)
 */
public record InsufficientStockItem(
        Long variantId,
        int requestedQuantity,
        int availableQuantity
) {
}
