package com.shopledger.checkout.service;

import com.shopledger.checkout.config.SiteSettings;
import com.shopledger.checkout.entity.Address;
import com.shopledger.checkout.entity.Channel;
import com.shopledger.checkout.entity.Checkout;
import com.shopledger.checkout.entity.CheckoutLine;
import com.shopledger.checkout.entity.ProductVariant;
import com.shopledger.checkout.entity.ShippingMethod;
import com.shopledger.checkout.exception.InsufficientStockException;
import com.shopledger.checkout.repository.ChannelRepository;
import com.shopledger.checkout.repository.CheckoutLineRepository;
import com.shopledger.checkout.repository.CheckoutRepository;
import com.shopledger.checkout.repository.ProductVariantRepository;
import com.shopledger.checkout.repository.ShippingMethodRepository;
import com.shopledger.common.exception.BusinessException;
import com.shopledger.common.exception.ErrorCode;
import com.shopledger.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class CheckoutService {

    private final CheckoutRepository checkoutRepository;
    private final CheckoutLineRepository checkoutLineRepository;
    private final ChannelRepository channelRepository;
    private final ProductVariantRepository productVariantRepository;
    private final ShippingMethodRepository shippingMethodRepository;
    private final CheckoutLineValidator checkoutLineValidator;
    private final ShippingMethodValidator shippingMethodValidator;
    private final ReservationLedger reservationLedger;
    private final SiteSettings siteSettings;
    private final Clock clock;

    /**
     * 체크아웃 생성
     *
     * @param countryCode null 이면 checkout.default-country 사용
     */
    @Transactional
    public Checkout createCheckout(String channelSlug, String countryCode) {
        Channel channel = channelRepository.findBySlug(channelSlug)
                .orElseThrow(() -> new NotFoundException(ErrorCode.CHANNEL_NOT_FOUND, channelSlug));
        String country = countryCode != null && !countryCode.isBlank()
                ? countryCode
                : siteSettings.getDefaultCountry();

        Checkout checkout = checkoutRepository.save(Checkout.builder()
                .channel(channel)
                .country(country)
                .lastChange(LocalDateTime.now(clock))
                .build());

        log.info("체크아웃 생성: token={}, channel={}, country={}", checkout.getToken(), channelSlug, country);
        return checkout;
    }

    /**
     * 체크아웃 조회 (토큰)
     */
    public Checkout getCheckout(UUID token) {
        return checkoutRepository.findByToken(token)
                .orElseThrow(() -> new NotFoundException(ErrorCode.CHECKOUT_NOT_FOUND, token));
    }

    public List<CheckoutLine> getLines(UUID token) {
        return checkoutLineRepository.findByCheckoutIdOrderById(getCheckout(token).getId());
    }

    public List<ShippingMethod> getApplicableShippingMethods(UUID token) {
        return shippingMethodValidator.applicableShippingMethods(getCheckout(token));
    }

    /**
     * 상품 옵션 추가
     *
     * <h3>처리 순서</h3>
     * <ol>
     *   <li>체크아웃 국가 기준 재고 검증 (기존 라인 수량 + 추가 수량)</li>
     *   <li>라인 생성 또는 수량 증가</li>
     *   <li>예약 기능이 켜져 있으면 라인 전체 수량을 적격 재고에 예약</li>
     * </ol>
     */
    @Transactional
    public CheckoutLine addLine(UUID token, Long variantId, int quantity) {
        if (quantity <= 0) {
            throw new BusinessException("수량은 0보다 커야 합니다: " + quantity,
                    ErrorCode.INVALID_INPUT.toErrorInfo("수량은 0보다 커야 합니다", "quantity"));
        }

        Checkout checkout = getCheckout(token);
        ProductVariant variant = productVariantRepository.findById(variantId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.VARIANT_NOT_FOUND, variantId));

        CheckoutLine line = checkoutLineRepository.findByCheckoutIdAndVariantId(checkout.getId(), variantId)
                .orElse(null);
        int newQuantity = (line != null ? line.getQuantity() : 0) + quantity;

        checkoutLineValidator.checkQuantity(checkout.getChannel().getId(), variantId, newQuantity,
                checkout.getCountry(), checkout.getId());

        if (line == null) {
            line = CheckoutLine.builder()
                    .checkout(checkout)
                    .variant(variant)
                    .quantity(quantity)
                    .build();
            checkout.addLine(line);
            line = checkoutLineRepository.save(line);
        } else {
            line.increaseQuantity(quantity);
        }
        checkoutLineRepository.flush();

        if (siteSettings.isReservationEnabled()) {
            reservationLedger.reserveForLine(line.getId(), checkout.getCountry(), siteSettings.getReservationDuration());
        }
        checkout.touch(LocalDateTime.now(clock));

        log.info("체크아웃 라인 추가: token={}, variantId={}, lineQuantity={}", token, variantId, newQuantity);
        return line;
    }

    /**
     * 라인 삭제 (예약 먼저 해제)
     */
    @Transactional
    public void removeLine(UUID token, Long lineId) {
        Checkout checkout = getCheckout(token);
        CheckoutLine line = checkoutLineRepository.findById(lineId)
                .filter(found -> found.getCheckout().getId().equals(checkout.getId()))
                .orElseThrow(() -> new NotFoundException(ErrorCode.CHECKOUT_LINE_NOT_FOUND, lineId));

        int released = reservationLedger.release(lineId);
        checkout.removeLine(line);
        checkoutLineRepository.delete(line);
        checkout.touch(LocalDateTime.now(clock));

        log.info("체크아웃 라인 삭제: token={}, lineId={}, releasedReservations={}", token, lineId, released);
    }

    /**
     * 배송지 변경
     *
     * <h3>처리 순서</h3>
     * <ol>
     *   <li>새 배송지 국가 기준으로 모든 라인 재고 검증 (자기 예약 제외)</li>
     *   <li>배송지 / 국가 저장, lastChange 갱신</li>
     *   <li>선택된 배송 방법이 새 배송지에서 무효면 해제</li>
     * </ol>
     * 재고가 부족하면 체크아웃은 전혀 바뀌지 않는다 (lastChange 포함).
     *
     * @throws InsufficientStockException 새 국가로 출고 가능한 재고가 부족할 때
     */
    @Transactional
    public Checkout updateShippingAddress(UUID token, Address address) {
        if (address == null || address.getCountry() == null || address.getCountry().isBlank()) {
            throw new BusinessException("배송지 국가가 필요합니다",
                    ErrorCode.INVALID_INPUT.toErrorInfo("배송지 국가가 필요합니다", "country"));
        }

        Checkout checkout = getCheckout(token);
        checkoutLineValidator.checkLines(checkout, address.getCountry());

        checkout.updateShippingAddress(address, LocalDateTime.now(clock));
        boolean cleared = shippingMethodValidator.updateShippingMethodIfInvalid(checkout);

        log.info("배송지 변경 완료: token={}, country={}, shippingState={}, shippingMethodCleared={}",
                token, checkout.getCountry(), checkout.getShippingState(), cleared);
        return checkout;
    }

    /**
     * 배송 방법 선택 (현재 배송지에 적용 가능한 방법만)
     */
    @Transactional
    public Checkout selectShippingMethod(UUID token, Long shippingMethodId) {
        Checkout checkout = getCheckout(token);
        if (!checkout.hasShippingAddress()) {
            throw new BusinessException("배송지를 먼저 입력해야 합니다",
                    ErrorCode.INVALID_INPUT.toErrorInfo("배송지를 먼저 입력해야 합니다", "shippingAddress"));
        }

        ShippingMethod method = shippingMethodRepository.findById(shippingMethodId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.SHIPPING_METHOD_NOT_FOUND, shippingMethodId));
        if (!shippingMethodValidator.isApplicable(checkout, method)) {
            throw new BusinessException(ErrorCode.SHIPPING_METHOD_NOT_APPLICABLE);
        }

        checkout.selectShippingMethod(method, LocalDateTime.now(clock));
        log.info("배송 방법 선택: token={}, shippingMethodId={}", token, shippingMethodId);
        return checkout;
    }
}
