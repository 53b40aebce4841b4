package com.shopledger.checkout.service;

import com.shopledger.checkout.entity.Checkout;
import com.shopledger.checkout.entity.ShippingMethod;
import com.shopledger.checkout.gateway.ExcludedShippingMethod;
import com.shopledger.checkout.gateway.ShippingMethodExclusionGateway;
import com.shopledger.checkout.repository.ShippingMethodRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 배송 방법 유효성 검증
 * <p>
 * 적용 가능한 배송 방법 = 체크아웃 국가를 포함하고 채널에 할당된 배송 구역의 방법
 * 중에서 외부 제외 게이트웨이가 제외하지 않은 것.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShippingMethodValidator {

    private final ShippingMethodRepository shippingMethodRepository;
    private final ShippingMethodExclusionGateway exclusionGateway;

    public List<ShippingMethod> applicableShippingMethods(Checkout checkout) {
        List<ShippingMethod> candidates = shippingMethodRepository.findApplicable(
                checkout.getChannel().getId(), checkout.getCountry());
        if (candidates.isEmpty()) {
            return candidates;
        }

        Set<Long> excludedIds = exclusionGateway.excludedShippingMethodsForCheckout(checkout, candidates).stream()
                .map(ExcludedShippingMethod::shippingMethodId)
                .collect(Collectors.toSet());

        return candidates.stream()
                .filter(method -> !excludedIds.contains(method.getId()))
                .toList();
    }

    public boolean isApplicable(Checkout checkout, ShippingMethod method) {
        return applicableShippingMethods(checkout).stream()
                .anyMatch(candidate -> candidate.getId().equals(method.getId()));
    }

    /**
     * 선택된 배송 방법이 더 이상 적용 불가하면 해제한다. 배송지는 그대로 둔다.
     *
     * @return 배송 방법이 해제되었으면 true
     */
    public boolean updateShippingMethodIfInvalid(Checkout checkout) {
        ShippingMethod current = checkout.getShippingMethod();
        if (current == null) {
            return false;
        }

        if (isApplicable(checkout, current)) {
            checkout.markShippingMethodValid();
            return false;
        }

        log.info("배송 방법 해제 (적용 불가): checkoutToken={}, shippingMethodId={}, country={}",
                checkout.getToken(), current.getId(), checkout.getCountry());
        checkout.clearShippingMethod();
        return true;
    }
}
