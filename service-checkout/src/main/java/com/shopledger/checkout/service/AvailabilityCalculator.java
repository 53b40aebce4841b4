package com.shopledger.checkout.service;

import com.shopledger.checkout.config.SiteSettings;
import com.shopledger.checkout.entity.Reservation;
import com.shopledger.checkout.entity.Stock;
import com.shopledger.checkout.repository.ReservationRepository;
import com.shopledger.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 가용 재고 계산기
 *
 * <pre>
 * available = stock.quantity - sum(활성 예약 수량, excludeCheckoutId 의 예약 제외)
 * </pre>
 * 결과가 음수이면 예약 합계가 재고를 넘어선 정합성 위반이다. 값을 숨기지 않고
 * {@link StockAvailability#integrityViolated()} 로 표시하고 경고 로그를 남긴다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AvailabilityCalculator {

    private final ReservationRepository reservationRepository;
    private final SiteSettings siteSettings;

    /**
     * 조회용 가용 재고 (잠금 없음)
     * <p>
     * 예약 기능이 꺼져 있으면 예약을 무시하고 재고 수량만 본다.
     *
     * @param excludeCheckoutId 이 체크아웃의 예약은 계산에서 제외 (null 이면 모두 포함)
     */
    public StockAvailability available(Stock stock, LocalDateTime asOf, Long excludeCheckoutId) {
        if (!siteSettings.isReservationEnabled()) {
            return calculate(stock, List.of());
        }
        return calculate(stock, reservationRepository.findActive(stock.getId(), asOf, excludeCheckoutId));
    }

    /**
     * 주어진 활성 예약 목록으로 계산
     */
    public StockAvailability calculate(Stock stock, List<Reservation> activeReservations) {
        int reserved = activeReservations.stream()
                .mapToInt(Reservation::getQuantityReserved)
                .sum();

        StockAvailability availability = new StockAvailability(stock.getId(), stock.getQuantity(), reserved);
        if (availability.integrityViolated()) {
            log.warn("[{}] 예약 합계가 재고 수량을 초과: stockId={}, quantity={}, reserved={}",
                    ErrorCode.STOCK_INTEGRITY_VIOLATION.getCode(),
                    stock.getId(), stock.getQuantity(), reserved);
        }
        return availability;
    }
}
