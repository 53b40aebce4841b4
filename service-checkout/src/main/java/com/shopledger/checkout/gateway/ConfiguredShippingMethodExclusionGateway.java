package com.shopledger.checkout.gateway;

import com.shopledger.checkout.entity.Checkout;
import com.shopledger.checkout.entity.ShippingMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * 설정 기반 배송 방법 제외 구현체
 *
 * 설정 가능:
 * - checkout.shipping.excluded-method-ids: 항상 제외할 배송 방법 ID 목록 (기본 없음)
 * - checkout.shipping.exclusion-reason: 제외 사유 문구
 */
@Slf4j
@Component
public class ConfiguredShippingMethodExclusionGateway implements ShippingMethodExclusionGateway {

    @Value("${checkout.shipping.excluded-method-ids:}")
    private Set<Long> excludedMethodIds;

    @Value("${checkout.shipping.exclusion-reason:excluded by configuration}")
    private String reason;

    @Override
    public List<ExcludedShippingMethod> excludedShippingMethodsForCheckout(Checkout checkout,
                                                                           List<ShippingMethod> candidates) {
        if (excludedMethodIds == null || excludedMethodIds.isEmpty()) {
            return List.of();
        }

        List<ExcludedShippingMethod> excluded = candidates.stream()
                .map(ShippingMethod::getId)
                .filter(excludedMethodIds::contains)
                .map(id -> new ExcludedShippingMethod(id, reason))
                .toList();

        if (!excluded.isEmpty()) {
            log.info("[ShippingExclusion] 설정으로 제외된 배송 방법: checkoutToken={}, ids={}",
                    checkout.getToken(), excluded.stream().map(ExcludedShippingMethod::shippingMethodId).toList());
        }
        return excluded;
    }
}
