package com.shopledger.checkout.controller;

import com.shopledger.checkout.entity.Address;
import com.shopledger.checkout.entity.Checkout;
import com.shopledger.checkout.entity.CheckoutLine;
import com.shopledger.checkout.entity.CheckoutShippingState;
import com.shopledger.checkout.entity.ShippingMethod;
import com.shopledger.checkout.service.CheckoutService;
import com.shopledger.common.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/checkouts")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutService checkoutService;

    /**
     * 체크아웃 생성
     */
    @PostMapping
    public ApiResponse<CheckoutResponse> createCheckout(
            @RequestParam String channel,
            @RequestParam(required = false) String country) {
        Checkout checkout = checkoutService.createCheckout(channel, country);
        return ApiResponse.success(CheckoutResponse.from(checkout, List.of()));
    }

    /**
     * 체크아웃 조회
     */
    @GetMapping("/{token}")
    public ApiResponse<CheckoutResponse> getCheckout(@PathVariable UUID token) {
        return ApiResponse.success(response(token));
    }

    /**
     * 상품 옵션 추가 (예약 기능이 켜져 있으면 재고 예약 포함)
     */
    @PostMapping("/{token}/lines")
    public ApiResponse<CheckoutResponse> addLine(
            @PathVariable UUID token,
            @RequestBody AddLineRequest request) {
        checkoutService.addLine(token, request.variantId(), request.quantity());
        return ApiResponse.success(response(token));
    }

    /**
     * 라인 삭제 (예약 해제 포함)
     */
    @DeleteMapping("/{token}/lines/{lineId}")
    public ApiResponse<CheckoutResponse> removeLine(
            @PathVariable UUID token,
            @PathVariable Long lineId) {
        checkoutService.removeLine(token, lineId);
        return ApiResponse.success(response(token));
    }

    /**
     * 배송지 변경
     */
    @PutMapping("/{token}/shipping-address")
    public ApiResponse<CheckoutResponse> updateShippingAddress(
            @PathVariable UUID token,
            @RequestBody ShippingAddressRequest request) {
        checkoutService.updateShippingAddress(token, request.toAddress());
        return ApiResponse.success(response(token));
    }

    /**
     * 배송 방법 선택
     */
    @PutMapping("/{token}/shipping-method")
    public ApiResponse<CheckoutResponse> selectShippingMethod(
            @PathVariable UUID token,
            @RequestParam Long shippingMethodId) {
        checkoutService.selectShippingMethod(token, shippingMethodId);
        return ApiResponse.success(response(token));
    }

    /**
     * 현재 배송지에 적용 가능한 배송 방법
     */
    @GetMapping("/{token}/shipping-methods")
    public ApiResponse<List<ShippingMethodResponse>> getShippingMethods(@PathVariable UUID token) {
        return ApiResponse.success(checkoutService.getApplicableShippingMethods(token).stream()
                .map(ShippingMethodResponse::from)
                .toList());
    }

    private CheckoutResponse response(UUID token) {
        return CheckoutResponse.from(checkoutService.getCheckout(token), checkoutService.getLines(token));
    }

    // 요청 DTO
    public record AddLineRequest(
            Long variantId,
            int quantity
    ) {
    }

    public record ShippingAddressRequest(
            String firstName,
            String lastName,
            String companyName,
            String streetAddress1,
            String streetAddress2,
            String city,
            String cityArea,
            String postalCode,
            String country,
            String countryArea,
            String phone
    ) {
        public Address toAddress() {
            return Address.builder()
                    .firstName(firstName)
                    .lastName(lastName)
                    .companyName(companyName)
                    .streetAddress1(streetAddress1)
                    .streetAddress2(streetAddress2)
                    .city(city)
                    .cityArea(cityArea)
                    .postalCode(postalCode)
                    .country(country)
                    .countryArea(countryArea)
                    .phone(phone)
                    .build();
        }
    }

    // 응답 DTO
    public record CheckoutResponse(
            UUID token,
            String country,
            ShippingAddressRequest shippingAddress,
            Long shippingMethodId,
            CheckoutShippingState shippingState,
            LocalDateTime lastChange,
            List<LineResponse> lines
    ) {
        public static CheckoutResponse from(Checkout checkout, List<CheckoutLine> lines) {
            Address address = checkout.getShippingAddress();
            return new CheckoutResponse(
                    checkout.getToken(),
                    checkout.getCountry(),
                    address == null ? null : new ShippingAddressRequest(
                            address.getFirstName(),
                            address.getLastName(),
                            address.getCompanyName(),
                            address.getStreetAddress1(),
                            address.getStreetAddress2(),
                            address.getCity(),
                            address.getCityArea(),
                            address.getPostalCode(),
                            address.getCountry(),
                            address.getCountryArea(),
                            address.getPhone()),
                    checkout.getShippingMethod() == null ? null : checkout.getShippingMethod().getId(),
                    checkout.getShippingState(),
                    checkout.getLastChange(),
                    lines.stream().map(LineResponse::from).toList()
            );
        }
    }

    public record LineResponse(
            Long id,
            Long variantId,
            int quantity
    ) {
        public static LineResponse from(CheckoutLine line) {
            return new LineResponse(line.getId(), line.getVariant().getId(), line.getQuantity());
        }
    }

    public record ShippingMethodResponse(
            Long id,
            String name
    ) {
        public static ShippingMethodResponse from(ShippingMethod method) {
            return new ShippingMethodResponse(method.getId(), method.getName());
        }
    }
}
