package com.shopledger.checkout.service;

/**
 * 한 재고의 가용 수량 계산 결과
 *
 * @param stockId          재고 ID
 * @param quantity         재고 수량
 * @param reservedQuantity 활성 예약 합계 (계산에서 제외된 체크아웃 분은 빠짐)
 */
public record StockAvailability(
        Long stockId,
        int quantity,
        int reservedQuantity
) {

    /**
     * quantity - reservedQuantity. 정합성이 깨졌으면 음수일 수 있다.
     */
    public int rawAvailable() {
        return quantity - reservedQuantity;
    }

    /**
     * 호출자에게 보여줄 가용 수량 (0 미만으로 내려가지 않음)
     */
    public int displayQuantity() {
        return Math.max(rawAvailable(), 0);
    }

    public boolean integrityViolated() {
        return rawAvailable() < 0;
    }
}
