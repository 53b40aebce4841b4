package com.shopledger.checkout.gateway;

import com.shopledger.checkout.entity.Checkout;
import com.shopledger.checkout.entity.ShippingMethod;

import java.util.List;

/**
 * 배송 방법 제외 판단 추상화 (웹훅 / 외부 플러그인)
 *
 * 체크아웃과 후보 배송 방법 목록을 받아, 사용할 수 없는 것들을 사유와 함께 돌려준다.
 */
public interface ShippingMethodExclusionGateway {

    List<ExcludedShippingMethod> excludedShippingMethodsForCheckout(Checkout checkout,
                                                                    List<ShippingMethod> candidates);
}
