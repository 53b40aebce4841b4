package com.shopledger.common.exception;


import com.shopledger.common.dto.ErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    // ========================================
    // 공통
    // ========================================
    INVALID_INPUT("INVALID", "잘못된 입력입니다", null),
    INTERNAL_ERROR("INTERNAL_ERROR", "내부 서버 오류가 발생했습니다", null),

    /** Stock / Checkout @Version 충돌 */
    OPTIMISTIC_LOCK_CONFLICT("OPTIMISTIC_LOCK_CONFLICT", "다른 요청이 먼저 처리되었습니다. 다시 시도해주세요.", null),

    // ========================================
    // 인프라/시스템 (락)
    // ========================================
    /** 분산 락 획득 실패 (Redis RLock) */
    LOCK_ACQUISITION_FAILED("LOCK_ACQUISITION_FAILED", "리소스 잠금 획득에 실패했습니다. 잠시 후 다시 시도해주세요.", null),

    /** 락 획득 중 인터럽트 발생 */
    LOCK_INTERRUPTED("LOCK_INTERRUPTED", "요청 처리가 중단되었습니다.", null),

    // ========================================
    // 체크아웃
    // ========================================
    CHECKOUT_NOT_FOUND("NOT_FOUND", "체크아웃을 찾을 수 없습니다", "id"),
    CHECKOUT_LINE_NOT_FOUND("NOT_FOUND", "체크아웃 라인을 찾을 수 없습니다", "lineId"),
    CHANNEL_NOT_FOUND("NOT_FOUND", "채널을 찾을 수 없습니다", "channel"),
    SHIPPING_METHOD_NOT_FOUND("NOT_FOUND", "배송 방법을 찾을 수 없습니다", "shippingMethodId"),
    SHIPPING_METHOD_NOT_APPLICABLE("SHIPPING_METHOD_NOT_APPLICABLE", "현재 배송지에 사용할 수 없는 배송 방법입니다", "shippingMethod"),

    // ========================================
    // 재고
    // ========================================
    STOCK_NOT_FOUND("NOT_FOUND", "재고를 찾을 수 없습니다", "stockId"),
    VARIANT_NOT_FOUND("NOT_FOUND", "상품 옵션을 찾을 수 없습니다", "variantId"),
    WAREHOUSE_NOT_FOUND("NOT_FOUND", "창고를 찾을 수 없습니다", "warehouseId"),
    INSUFFICIENT_STOCK("INSUFFICIENT_STOCK", "재고가 부족합니다", "quantity"),

    /** 가용 재고 계산 결과가 음수 (로그 전용, 사용자에게 노출하지 않음) */
    STOCK_INTEGRITY_VIOLATION("STOCK_INTEGRITY_VIOLATION", "예약 합계가 재고 수량을 초과했습니다", null),
    ;

    private final String code;
    private final String message;
    private final String field;

    public ErrorInfo toErrorInfo() {
        return ErrorInfo.of(this.code, this.message, this.field);
    }

    /**
     * 같은 코드에 상황별 메시지 / 필드를 붙일 때 (예: INVALID_INPUT + "quantity")
     */
    public ErrorInfo toErrorInfo(String message, String field) {
        return ErrorInfo.of(this.code, message, field);
    }
}
