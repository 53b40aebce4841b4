package com.shopledger.checkout.gateway;

/**
 * 외부 플러그인이 제외한 배송 방법과 그 사유
 */
public record ExcludedShippingMethod(Long shippingMethodId, String reason) {
}
