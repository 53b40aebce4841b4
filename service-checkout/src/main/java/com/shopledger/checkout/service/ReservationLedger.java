package com.shopledger.checkout.service;

import com.shopledger.checkout.entity.CheckoutLine;
import com.shopledger.checkout.entity.Reservation;
import com.shopledger.checkout.entity.Stock;
import com.shopledger.checkout.exception.InsufficientStockException;
import com.shopledger.checkout.lock.StockLock;
import com.shopledger.checkout.repository.CheckoutLineRepository;
import com.shopledger.checkout.repository.ReservationRepository;
import com.shopledger.common.exception.BusinessException;
import com.shopledger.common.exception.ErrorCode;
import com.shopledger.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 재고 예약 원장
 *
 * <h3>예약 생성 순서</h3>
 * <ol>
 *   <li>대상 재고 잠금 ({@link StockLock}, stock id 오름차순)</li>
 *   <li>잠금 이후 활성 예약 조회, 가용 수량 재확인 (자기 체크아웃 예약 제외)</li>
 *   <li>부족하면 InsufficientStockException, 아니면 예약 생성/갱신</li>
 * </ol>
 * 잠금은 트랜잭션 종료 시 해제되므로 하나의 reserve 트랜잭션 동안만 유지된다.
 * 만료는 조회 시점 기준으로 판단하며 (reservedUntil > asOf) 물리 삭제는 정리 스케줄러 몫이다.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class ReservationLedger {

    private final ReservationRepository reservationRepository;
    private final CheckoutLineRepository checkoutLineRepository;
    private final CheckoutLineValidator checkoutLineValidator;
    private final AvailabilityCalculator availabilityCalculator;
    private final StockLock stockLock;
    private final Clock clock;

    /**
     * 활성 예약 조회
     *
     * @param excludeCheckoutId 이 체크아웃의 라인에 속한 예약은 제외 (null 이면 전체)
     */
    public List<Reservation> activeReservations(Long stockId, LocalDateTime asOf, Long excludeCheckoutId) {
        return reservationRepository.findActive(stockId, asOf, excludeCheckoutId);
    }

    public List<Reservation> reservationsOf(Long checkoutLineId) {
        return reservationRepository.findByCheckoutLineId(checkoutLineId);
    }

    /**
     * 단일 재고 예약
     * <p>
     * 같은 라인이 이미 이 재고에 예약을 갖고 있으면 새 수량 / 만료 시각으로 교체한다.
     *
     * @throws InsufficientStockException 잠금 이후 재확인한 가용 수량이 부족할 때
     */
    @Transactional(timeout = 30)
    public Reservation reserve(Long checkoutLineId, Long stockId, int quantity, Duration duration) {
        validateRequest(quantity, duration);
        CheckoutLine line = getLine(checkoutLineId);
        Long checkoutId = line.getCheckout().getId();

        return stockLock.executeWithLock(List.of(stockId), stocks -> {
            Stock stock = stocks.get(0);
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime until = now.plus(duration);

            StockAvailability availability = availabilityCalculator.calculate(
                    stock, reservationRepository.findActive(stockId, now, checkoutId));
            if (availability.displayQuantity() < quantity) {
                log.info("예약 실패 (재고 부족): lineId={}, stockId={}, requested={}, available={}",
                        checkoutLineId, stockId, quantity, availability.displayQuantity());
                throw InsufficientStockException.of(stock.getVariant().getId(), quantity, availability.displayQuantity());
            }

            Reservation reservation = reservationRepository.findByCheckoutLineIdAndStockId(checkoutLineId, stockId)
                    .map(existing -> {
                        existing.renew(quantity, until);
                        return existing;
                    })
                    .orElseGet(() -> reservationRepository.save(Reservation.builder()
                            .checkoutLine(line)
                            .stock(stock)
                            .quantityReserved(quantity)
                            .reservedUntil(until)
                            .build()));

            log.info("재고 예약 완료: lineId={}, stockId={}, quantity={}, reservedUntil={}, available={}",
                    checkoutLineId, stockId, quantity, until, availability.displayQuantity() - quantity);
            return reservation;
        });
    }

    /**
     * 라인 수량 전체를 적격 재고들에 나누어 예약
     * <p>
     * 기존 예약을 지우고, stock id 순서대로 각 재고의 가용 수량만큼 채워 나간다.
     * 합계가 모자라면 예외가 발생하고 트랜잭션 롤백으로 기존 예약이 복구된다.
     */
    @Transactional(timeout = 30)
    public List<Reservation> reserveForLine(Long checkoutLineId, String countryCode, Duration duration) {
        CheckoutLine line = getLine(checkoutLineId);
        int requested = line.getQuantity();
        validateRequest(requested, duration);

        Long checkoutId = line.getCheckout().getId();
        Long variantId = line.getVariant().getId();
        List<Stock> eligible = checkoutLineValidator.eligibleStocks(
                line.getCheckout().getChannel().getId(), variantId, countryCode);
        if (eligible.isEmpty()) {
            log.info("예약 실패 (적격 재고 없음): lineId={}, variantId={}, country={}",
                    checkoutLineId, variantId, countryCode);
            throw InsufficientStockException.of(variantId, requested, 0);
        }

        List<Long> stockIds = eligible.stream().map(Stock::getId).toList();
        return stockLock.executeWithLock(stockIds, stocks -> {
            int released = reservationRepository.deleteByCheckoutLineId(checkoutLineId);
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime until = now.plus(duration);

            int remaining = requested;
            int totalAvailable = 0;
            List<Reservation> planned = new ArrayList<>();
            for (Stock stock : stocks) {
                StockAvailability availability = availabilityCalculator.calculate(
                        stock, reservationRepository.findActive(stock.getId(), now, checkoutId));
                totalAvailable += availability.displayQuantity();

                int take = Math.min(remaining, availability.displayQuantity());
                if (take > 0) {
                    planned.add(Reservation.builder()
                            .checkoutLine(line)
                            .stock(stock)
                            .quantityReserved(take)
                            .reservedUntil(until)
                            .build());
                    remaining -= take;
                }
            }

            if (remaining > 0) {
                log.info("예약 실패 (재고 부족): lineId={}, variantId={}, requested={}, available={}",
                        checkoutLineId, variantId, requested, totalAvailable);
                throw InsufficientStockException.of(variantId, requested, totalAvailable);
            }

            List<Reservation> saved = reservationRepository.saveAll(planned);
            log.info("라인 예약 완료: lineId={}, variantId={}, quantity={}, stocks={}, replaced={}, reservedUntil={}",
                    checkoutLineId, variantId, requested, saved.size(), released, until);
            return saved;
        });
    }

    /**
     * 라인의 예약 해제 (멱등)
     *
     * @return 삭제된 예약 수
     */
    @Transactional
    public int release(Long checkoutLineId) {
        int deleted = reservationRepository.deleteByCheckoutLineId(checkoutLineId);
        if (deleted > 0) {
            log.info("예약 해제: lineId={}, count={}", checkoutLineId, deleted);
        }
        return deleted;
    }

    /**
     * 만료된 예약 물리 삭제
     *
     * @return 삭제된 예약 수
     */
    @Transactional
    public int purgeExpired(LocalDateTime asOf) {
        return reservationRepository.deleteExpired(asOf);
    }

    private CheckoutLine getLine(Long checkoutLineId) {
        return checkoutLineRepository.findById(checkoutLineId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.CHECKOUT_LINE_NOT_FOUND, checkoutLineId));
    }

    private void validateRequest(int quantity, Duration duration) {
        if (quantity <= 0) {
            throw new BusinessException("예약 수량은 0보다 커야 합니다: " + quantity,
                    ErrorCode.INVALID_INPUT.toErrorInfo("예약 수량은 0보다 커야 합니다", "quantity"));
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new BusinessException("예약 유지 시간이 올바르지 않습니다: " + duration,
                    ErrorCode.INVALID_INPUT.toErrorInfo("예약 유지 시간이 올바르지 않습니다", "duration"));
        }
    }
}
