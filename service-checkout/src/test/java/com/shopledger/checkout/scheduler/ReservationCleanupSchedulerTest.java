package com.shopledger.checkout.scheduler;

import com.shopledger.checkout.service.ReservationLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReservationCleanupSchedulerTest {

    @Mock
    private ReservationLedger reservationLedger;

    @Test
    @DisplayName("현재 시각 기준으로 만료 예약을 정리한다")
    void purgeExpiredReservations_usesClockNow() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        LocalDateTime now = LocalDateTime.of(2024, 5, 1, 12, 0);
        when(reservationLedger.purgeExpired(now)).thenReturn(3);

        new ReservationCleanupScheduler(reservationLedger, clock).purgeExpiredReservations();

        verify(reservationLedger).purgeExpired(now);
    }
}
