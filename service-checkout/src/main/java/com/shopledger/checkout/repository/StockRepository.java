package com.shopledger.checkout.repository;

import com.shopledger.checkout.entity.Stock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * 재고 레포지토리
 *
 * <h3>핵심 쿼리</h3>
 * <ul>
 *   <li>{@link #findEligibleStocks} - 목적지 국가 / 채널 기준으로 출고 가능한 재고</li>
 *   <li>{@link #findByIdForUpdate} - 예약 직전 재고 행 잠금 (SELECT ... FOR UPDATE)</li>
 * </ul>
 */
public interface StockRepository extends JpaRepository<Stock, Long> {

    /**
     * 재고 행 잠금 조회
     * <p>
     * 잠금은 트랜잭션 종료 시 해제된다. 같은 트랜잭션에서 이미 읽은 재고라면 잠금만 올리고,
     * 그 사이 다른 트랜잭션이 재고를 바꿨다면 @Version 검사로 낙관적 락 충돌이 난다.
     */
    @Query("SELECT s FROM Stock s WHERE s.id = :stockId")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Stock> findByIdForUpdate(@Param("stockId") Long stockId);

    /**
     * 적격 재고 조회
     *
     * <p>창고가 속한 배송 구역 중 하나라도</p>
     * <ul>
     *   <li>목적지 국가를 포함하고</li>
     *   <li>체크아웃 채널에 할당되어 있으면</li>
     * </ul>
     * <p>그 창고의 재고는 적격이다. stock id 오름차순 (락 순서와 동일)</p>
     */
    @Query("SELECT DISTINCT s FROM Stock s JOIN s.warehouse w JOIN w.shippingZones z " +
            "JOIN z.channels c JOIN z.countries zc " +
            "WHERE s.variant.id = :variantId AND c.id = :channelId AND zc = :countryCode " +
            "ORDER BY s.id")
    List<Stock> findEligibleStocks(@Param("channelId") Long channelId,
                                   @Param("variantId") Long variantId,
                                   @Param("countryCode") String countryCode);
}
