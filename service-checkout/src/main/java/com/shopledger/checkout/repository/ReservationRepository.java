package com.shopledger.checkout.repository;

import com.shopledger.checkout.entity.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    /**
     * 활성 예약 (reservedUntil > asOf)
     */
    @Query("SELECT r FROM Reservation r WHERE r.stock.id = :stockId AND r.reservedUntil > :asOf")
    List<Reservation> findActiveByStockId(@Param("stockId") Long stockId,
                                          @Param("asOf") LocalDateTime asOf);

    /**
     * 활성 예약 중 특정 체크아웃의 라인에 속한 것은 제외
     */
    @Query("SELECT r FROM Reservation r WHERE r.stock.id = :stockId AND r.reservedUntil > :asOf " +
            "AND r.checkoutLine.checkout.id <> :checkoutId")
    List<Reservation> findActiveByStockIdExcludingCheckout(@Param("stockId") Long stockId,
                                                           @Param("asOf") LocalDateTime asOf,
                                                           @Param("checkoutId") Long checkoutId);

    default List<Reservation> findActive(Long stockId, LocalDateTime asOf, Long excludeCheckoutId) {
        if (excludeCheckoutId == null) {
            return findActiveByStockId(stockId, asOf);
        }
        return findActiveByStockIdExcludingCheckout(stockId, asOf, excludeCheckoutId);
    }

    List<Reservation> findByCheckoutLineId(Long checkoutLineId);

    Optional<Reservation> findByCheckoutLineIdAndStockId(Long checkoutLineId, Long stockId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Reservation r WHERE r.checkoutLine.id = :checkoutLineId")
    int deleteByCheckoutLineId(@Param("checkoutLineId") Long checkoutLineId);

    /**
     * 만료된 예약 물리 삭제 (정리 스케줄러용)
     */
    @Modifying
    @Query("DELETE FROM Reservation r WHERE r.reservedUntil <= :asOf")
    int deleteExpired(@Param("asOf") LocalDateTime asOf);
}
