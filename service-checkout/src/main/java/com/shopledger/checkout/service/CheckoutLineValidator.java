package com.shopledger.checkout.service;

import com.shopledger.checkout.entity.Checkout;
import com.shopledger.checkout.entity.CheckoutLine;
import com.shopledger.checkout.entity.Stock;
import com.shopledger.checkout.exception.InsufficientStockException;
import com.shopledger.checkout.exception.InsufficientStockItem;
import com.shopledger.checkout.repository.ShippingZoneRepository;
import com.shopledger.checkout.repository.StockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 체크아웃 라인 재고 검증
 *
 * <h3>절차</h3>
 * <ol>
 *   <li>적격 재고: 목적지 국가를 포함하고 채널에 할당된 배송 구역의 창고 재고</li>
 *   <li>적격 재고별 가용 수량 계산 (현재 체크아웃의 예약은 제외)</li>
 *   <li>적격 재고 전체의 가용 수량 합계와 요청 수량 비교</li>
 * </ol>
 * 채널에 배송 구역이 하나도 없으면 적격 재고가 없으므로 항상 재고 부족이다.
 */
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class CheckoutLineValidator {

    private final StockRepository stockRepository;
    private final ShippingZoneRepository shippingZoneRepository;
    private final AvailabilityCalculator availabilityCalculator;
    private final Clock clock;

    public List<Stock> eligibleStocks(Long channelId, Long variantId, String countryCode) {
        if (!shippingZoneRepository.existsByChannelsId(channelId)) {
            log.debug("채널에 배송 구역 없음: channelId={}", channelId);
            return List.of();
        }
        return stockRepository.findEligibleStocks(channelId, variantId, countryCode);
    }

    /**
     * 적격 재고 전체의 가용 수량 합계 (재고별로 0 미만은 0으로 본다)
     */
    public int availableQuantity(Long channelId, Long variantId, String countryCode,
                                 Long excludeCheckoutId, LocalDateTime asOf) {
        return eligibleStocks(channelId, variantId, countryCode).stream()
                .map(stock -> availabilityCalculator.available(stock, asOf, excludeCheckoutId))
                .mapToInt(StockAvailability::displayQuantity)
                .sum();
    }

    /**
     * 단일 상품 옵션 수량 검증
     *
     * @throws InsufficientStockException 가용 수량 합계가 요청 수량보다 작을 때
     */
    public void checkQuantity(Long channelId, Long variantId, int quantity, String countryCode,
                              Long excludeCheckoutId) {
        int available = availableQuantity(channelId, variantId, countryCode, excludeCheckoutId, LocalDateTime.now(clock));
        if (available < quantity) {
            log.info("재고 부족: variantId={}, country={}, requested={}, available={}",
                    variantId, countryCode, quantity, available);
            throw InsufficientStockException.of(variantId, quantity, available);
        }
    }

    /**
     * 체크아웃의 모든 라인을 목적지 국가 기준으로 검증. 부족한 라인을 한 번에 모아 보고한다.
     *
     * @throws InsufficientStockException 하나 이상의 라인이 부족할 때
     */
    public void checkLines(Checkout checkout, String countryCode) {
        LocalDateTime asOf = LocalDateTime.now(clock);
        Long channelId = checkout.getChannel().getId();
        List<InsufficientStockItem> shortages = new ArrayList<>();

        for (CheckoutLine line : checkout.getLines()) {
            Long variantId = line.getVariant().getId();
            int available = availableQuantity(channelId, variantId, countryCode, checkout.getId(), asOf);
            if (available < line.getQuantity()) {
                shortages.add(new InsufficientStockItem(variantId, line.getQuantity(), available));
            }
        }

        if (!shortages.isEmpty()) {
            log.info("체크아웃 라인 재고 부족: checkoutToken={}, country={}, shortages={}",
                    checkout.getToken(), countryCode, shortages);
            throw new InsufficientStockException(shortages);
        }
    }
}
