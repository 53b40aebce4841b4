package com.shopledger.checkout.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 사이트 설정 (재고 예약 / 기본 국가)
 *
 * 설정 가능:
 * - checkout.reservation.enabled: 체크아웃 재고 예약 사용 여부 (기본 false)
 * - checkout.reservation.duration-minutes: 예약 유지 시간 (기본 20분)
 * - checkout.default-country: 배송지 없는 체크아웃의 국가 (기본 US)
 */
@Component
@Getter
public class SiteSettings {

    @Value("${checkout.reservation.enabled:false}")
    private boolean reservationEnabled;

    @Value("${checkout.reservation.duration-minutes:20}")
    private long reservationDurationMinutes;

    @Value("${checkout.default-country:US}")
    private String defaultCountry;

    public Duration getReservationDuration() {
        return Duration.ofMinutes(reservationDurationMinutes);
    }
}
