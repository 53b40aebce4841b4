package com.shopledger.checkout.scheduler;

import com.shopledger.checkout.service.ReservationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 만료 예약 정리 스케줄러
 *
 * <p>만료 판단은 조회 시점에 이루어지므로 이 스케줄러가 없어도 가용 재고 계산은 정확하다.
 * 테이블이 계속 커지지 않도록 만료된 행을 주기적으로 지울 뿐이다.</p>
 *
 * 설정:
 * - checkout.reservation.cleanup.enabled: 사용 여부
 * - checkout.reservation.cleanup.interval-ms: 실행 간격 (기본 10분)
 */
@Component
@ConditionalOnProperty(prefix = "checkout.reservation.cleanup", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ReservationCleanupScheduler {

    private final ReservationLedger reservationLedger;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${checkout.reservation.cleanup.interval-ms:600000}",
            initialDelayString = "${checkout.reservation.cleanup.interval-ms:600000}")
    public void purgeExpiredReservations() {
        LocalDateTime now = LocalDateTime.now(clock);
        int deleted = reservationLedger.purgeExpired(now);

        if (deleted > 0) {
            log.info("만료 예약 정리 완료: {}개 삭제 (기준 시각 {})", deleted, now);
        }
    }
}
