package com.shopledger.checkout.entity;

/**
 * 체크아웃 배송 상태
 * <p>
 * 상태 전이:
 * NO_SHIPPING_ADDRESS → (배송지 변경) → ADDRESS_SET_METHOD_VALID
 *                                      ↘ ADDRESS_SET_METHOD_CLEARED
 * 배송지를 다시 변경하면 두 상태 중 하나로 다시 전이한다.
 */
public enum CheckoutShippingState {

    /**
     * 배송지 미입력
     */
    NO_SHIPPING_ADDRESS,

    /**
     * 배송지 입력 완료, 선택된 배송 방법이 없거나 여전히 유효함
     */
    ADDRESS_SET_METHOD_VALID,

    /**
     * 배송지 변경으로 기존 배송 방법이 무효가 되어 해제됨
     */
    ADDRESS_SET_METHOD_CLEARED
}
