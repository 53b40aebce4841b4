package com.shopledger.checkout.service;

import com.shopledger.checkout.entity.Address;
import com.shopledger.checkout.entity.Checkout;
import com.shopledger.checkout.entity.CheckoutLine;
import com.shopledger.checkout.entity.CheckoutShippingState;
import com.shopledger.checkout.exception.InsufficientStockException;
import com.shopledger.checkout.repository.ReservationRepository;
import com.shopledger.checkout.support.CheckoutTestFixture;
import com.shopledger.checkout.support.MutableClock;
import com.shopledger.common.exception.BusinessException;
import com.shopledger.common.exception.NotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

import static com.shopledger.checkout.support.CheckoutTestFixture.CHANNEL_SLUG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class CheckoutServiceTest {

    @Autowired
    private CheckoutService checkoutService;

    @Autowired
    private StockService stockService;

    @Autowired
    private ReservationRepository reservationRepository;

    @Autowired
    private CheckoutTestFixture fixture;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        fixture.setUp();
    }

    @AfterEach
    void tearDown() {
        fixture.cleanUp();
    }

    @Test
    @DisplayName("배송지 변경: 주소가 저장되고 lastChange 가 갱신된다")
    void updateShippingAddress_persistsAddressAndTouchesLastChange() {
        // given
        UUID token = createCheckoutWithLine(2);
        LocalDateTime before = checkoutService.getCheckout(token).getLastChange();
        clock.advance(Duration.ofSeconds(5));

        // when
        checkoutService.updateShippingAddress(token, address("US"));

        // then
        Checkout checkout = checkoutService.getCheckout(token);
        assertThat(checkout.getShippingAddress().getFirstName()).isEqualTo("John");
        assertThat(checkout.getShippingAddress().getCity()).isEqualTo("NEW YORK");
        assertThat(checkout.getShippingAddress().getCountry()).isEqualTo("US");
        assertThat(checkout.getShippingState()).isEqualTo(CheckoutShippingState.ADDRESS_SET_METHOD_VALID);
        assertThat(checkout.getLastChange()).isAfter(before);
    }

    @Test
    @DisplayName("배송지 변경: 체크아웃 국가가 배송지 국가로 바뀐다")
    void updateShippingAddress_changesCheckoutCountry() {
        // given
        UUID token = createCheckoutWithLine(2);
        assertThat(checkoutService.getCheckout(token).getCountry()).isEqualTo("US");

        // when
        checkoutService.updateShippingAddress(token, address("PL"));

        // then
        assertThat(checkoutService.getCheckout(token).getCountry()).isEqualTo("PL");
    }

    @Test
    @DisplayName("재고 부족: quantity 필드 오류, 체크아웃은 바뀌지 않는다")
    void updateShippingAddress_insufficientStock_leavesCheckoutUntouched() {
        // given
        UUID token = createCheckoutWithLine(2);
        stockService.changeQuantity(fixture.getUsStock().getId(), 0);
        Checkout before = checkoutService.getCheckout(token);
        clock.advance(Duration.ofSeconds(5));

        // when & then
        assertThatThrownBy(() -> checkoutService.updateShippingAddress(token, address("US")))
                .isInstanceOf(InsufficientStockException.class)
                .satisfies(e -> {
                    InsufficientStockException ex = (InsufficientStockException) e;
                    assertThat(ex.getErrorInfo().getField()).isEqualTo("quantity");
                    assertThat(ex.getErrorInfo().getCode()).isEqualTo("INSUFFICIENT_STOCK");
                    assertThat(ex.getItems()).hasSize(1);
                    assertThat(ex.getItems().get(0).requestedQuantity()).isEqualTo(2);
                    assertThat(ex.getItems().get(0).availableQuantity()).isZero();
                });

        Checkout after = checkoutService.getCheckout(token);
        assertThat(after.getLastChange()).isEqualTo(before.getLastChange());
        assertThat(after.getShippingAddress()).isNull();
    }

    @Test
    @DisplayName("다른 체크아웃의 예약이 있어도 남은 수량이 충분하면 성공한다")
    void updateShippingAddress_reservedByOtherCheckout_stillEnough() {
        // given: 재고 3, 다른 체크아웃이 1 예약, 이 체크아웃은 2
        stockService.changeQuantity(fixture.getUsStock().getId(), 3);
        createCheckoutWithLine(1);
        UUID token = createCheckoutWithLine(2);

        // when
        Checkout checkout = checkoutService.updateShippingAddress(token, address("US"));

        // then
        assertThat(checkout.getCountry()).isEqualTo("US");
        assertThat(checkoutService.getCheckout(token).getShippingAddress()).isNotNull();
    }

    @Test
    @DisplayName("다른 체크아웃의 예약이 재고를 넘어서면 재고 부족으로 실패한다")
    void updateShippingAddress_overReservedStock_fails() {
        // given: 이 체크아웃 2, 다른 체크아웃 3 예약 후 재고를 2로 줄임
        UUID token = createCheckoutWithLine(2);
        createCheckoutWithLine(3);
        stockService.changeQuantity(fixture.getUsStock().getId(), 2);

        // when & then
        assertThatThrownBy(() -> checkoutService.updateShippingAddress(token, address("US")))
                .isInstanceOf(InsufficientStockException.class)
                .satisfies(e -> assertThat(((InsufficientStockException) e).getErrorInfo().getCode())
                        .isEqualTo("INSUFFICIENT_STOCK"));

        assertThat(stockService.getAvailability(fixture.getUsStock().getId()).integrityViolated()).isTrue();
        assertThat(stockService.getAvailability(fixture.getUsStock().getId()).displayQuantity()).isZero();
    }

    @Test
    @DisplayName("채널에 배송 구역이 없으면 재고 부족으로 실패한다")
    void updateShippingAddress_channelWithoutShippingZones_fails() {
        // given
        UUID token = createCheckoutWithLine(2);
        fixture.detachChannelFromAllZones();
        LocalDateTime lastChange = checkoutService.getCheckout(token).getLastChange();
        clock.advance(Duration.ofSeconds(5));

        // when & then
        assertThatThrownBy(() -> checkoutService.updateShippingAddress(token, address("US")))
                .isInstanceOf(InsufficientStockException.class)
                .satisfies(e -> assertThat(((InsufficientStockException) e).getErrorInfo().getField())
                        .isEqualTo("quantity"));

        Checkout checkout = checkoutService.getCheckout(token);
        assertThat(checkout.getLastChange()).isEqualTo(lastChange);
        assertThat(checkout.getShippingAddress()).isNull();
    }

    @Test
    @DisplayName("다른 체크아웃이 재고를 모두 예약하면 실패하고, 그 예약이 만료되면 성공한다")
    void updateShippingAddress_blockedByReservationUntilItExpires() {
        // given: B 는 PL 에서 1개, 이후 US 재고 2 를 A 가 모두 예약
        UUID checkoutB = checkoutService.createCheckout(CHANNEL_SLUG, "PL").getToken();
        checkoutService.addLine(checkoutB, fixture.getVariant().getId(), 1);
        stockService.changeQuantity(fixture.getUsStock().getId(), 2);
        createCheckoutWithLine(2);

        // when & then: A 의 예약이 살아 있는 동안은 재고 부족
        assertThatThrownBy(() -> checkoutService.updateShippingAddress(checkoutB, address("US")))
                .isInstanceOf(InsufficientStockException.class)
                .satisfies(e -> {
                    InsufficientStockException ex = (InsufficientStockException) e;
                    assertThat(ex.getErrorInfo().getField()).isEqualTo("quantity");
                    assertThat(ex.getItems().get(0).availableQuantity()).isZero();
                });
        assertThat(checkoutService.getCheckout(checkoutB).getCountry()).isEqualTo("PL");

        // when: 예약 유지 시간(20분)이 지나면
        clock.advance(Duration.ofMinutes(21));
        Checkout checkout = checkoutService.updateShippingAddress(checkoutB, address("US"));

        // then
        assertThat(checkout.getCountry()).isEqualTo("US");
        assertThat(checkoutService.getCheckout(checkoutB).getShippingAddress().getCountry()).isEqualTo("US");
    }

    @Test
    @DisplayName("새 배송지에 적용할 수 없는 배송 방법은 해제된다")
    void updateShippingAddress_invalidShippingMethod_isCleared() {
        // given
        UUID token = createCheckoutWithLine(2);
        checkoutService.updateShippingAddress(token, address("US"));
        checkoutService.selectShippingMethod(token, fixture.getUsShippingMethod().getId());

        // when
        checkoutService.updateShippingAddress(token, address("PL"));

        // then
        Checkout checkout = checkoutService.getCheckout(token);
        assertThat(checkout.getShippingMethod()).isNull();
        assertThat(checkout.getShippingState()).isEqualTo(CheckoutShippingState.ADDRESS_SET_METHOD_CLEARED);
        assertThat(checkout.getShippingAddress().getCountry()).isEqualTo("PL");
    }

    @Test
    @DisplayName("여전히 적용 가능한 배송 방법은 유지된다")
    void updateShippingAddress_validShippingMethod_isKept() {
        // given
        UUID token = createCheckoutWithLine(2);
        checkoutService.updateShippingAddress(token, address("US"));
        checkoutService.selectShippingMethod(token, fixture.getUsShippingMethod().getId());

        // when
        checkoutService.updateShippingAddress(token, address("US"));

        // then
        assertThat(checkoutService.getCheckout(token).getShippingMethod()).isNotNull();
    }

    @Test
    @DisplayName("배송지 국가가 없으면 country 필드 오류")
    void updateShippingAddress_missingCountry_fails() {
        UUID token = createCheckoutWithLine(1);

        assertThatThrownBy(() -> checkoutService.updateShippingAddress(token, Address.builder().city("WARSAW").build()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorInfo().getField()).isEqualTo("country"));
    }

    @Test
    @DisplayName("적용 불가능한 배송 방법은 선택할 수 없다")
    void selectShippingMethod_notApplicable_fails() {
        UUID token = createCheckoutWithLine(1);
        checkoutService.updateShippingAddress(token, address("US"));

        assertThatThrownBy(() -> checkoutService.selectShippingMethod(token, fixture.getEuropeShippingMethod().getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorInfo().getCode())
                        .isEqualTo("SHIPPING_METHOD_NOT_APPLICABLE"));
    }

    @Test
    @DisplayName("라인 추가 시 예약이 생기고, 삭제 시 해제된다")
    void addLineAndRemoveLine_reserveAndRelease() {
        // given
        UUID token = checkoutService.createCheckout(CHANNEL_SLUG, null).getToken();

        // when
        CheckoutLine line = checkoutService.addLine(token, fixture.getVariant().getId(), 4);

        // then
        assertThat(reservationRepository.findByCheckoutLineId(line.getId()))
                .singleElement()
                .satisfies(reservation -> assertThat(reservation.getQuantityReserved()).isEqualTo(4));
        assertThat(stockService.getAvailability(fixture.getUsStock().getId()).displayQuantity())
                .isEqualTo(CheckoutTestFixture.DEFAULT_QUANTITY - 4);

        // when
        checkoutService.removeLine(token, line.getId());

        // then
        assertThat(reservationRepository.findByCheckoutLineId(line.getId())).isEmpty();
        assertThat(checkoutService.getLines(token)).isEmpty();
        assertThat(stockService.getAvailability(fixture.getUsStock().getId()).displayQuantity())
                .isEqualTo(CheckoutTestFixture.DEFAULT_QUANTITY);
    }

    @Test
    @DisplayName("같은 상품 옵션을 다시 담으면 라인 수량이 늘고 예약도 교체된다")
    void addLine_sameVariant_increasesQuantity() {
        UUID token = checkoutService.createCheckout(CHANNEL_SLUG, "US").getToken();

        checkoutService.addLine(token, fixture.getVariant().getId(), 2);
        CheckoutLine line = checkoutService.addLine(token, fixture.getVariant().getId(), 3);

        assertThat(checkoutService.getLines(token)).singleElement()
                .satisfies(found -> assertThat(found.getQuantity()).isEqualTo(5));
        assertThat(reservationRepository.findByCheckoutLineId(line.getId()))
                .singleElement()
                .satisfies(reservation -> assertThat(reservation.getQuantityReserved()).isEqualTo(5));
    }

    @Test
    @DisplayName("가용 재고를 넘는 수량은 담을 수 없다")
    void addLine_overAvailable_fails() {
        UUID token = checkoutService.createCheckout(CHANNEL_SLUG, "US").getToken();

        assertThatThrownBy(() -> checkoutService.addLine(token, fixture.getVariant().getId(),
                CheckoutTestFixture.DEFAULT_QUANTITY + 1))
                .isInstanceOf(InsufficientStockException.class);
        assertThat(checkoutService.getLines(token)).isEmpty();
    }

    @Test
    @DisplayName("없는 체크아웃 토큰은 NotFoundException")
    void getCheckout_unknownToken_throwsNotFound() {
        assertThatThrownBy(() -> checkoutService.getCheckout(UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
    }

    private UUID createCheckoutWithLine(int quantity) {
        UUID token = checkoutService.createCheckout(CHANNEL_SLUG, "US").getToken();
        checkoutService.addLine(token, fixture.getVariant().getId(), quantity);
        return token;
    }

    static Address address(String country) {
        return Address.builder()
                .firstName("John")
                .lastName("Doe")
                .streetAddress1("1470 Pinewood Avenue")
                .city("NEW YORK")
                .postalCode("10001")
                .country(country)
                .build();
    }
}
