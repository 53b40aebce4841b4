package com.shopledger.checkout.controller;

import com.shopledger.checkout.service.StockAvailability;
import com.shopledger.checkout.service.StockService;
import com.shopledger.common.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/stocks")
@RequiredArgsConstructor
public class StockController {

    private final StockService stockService;

    /**
     * 가용 재고 조회 (조회용, 잠금 없음)
     */
    @GetMapping("/{stockId}/availability")
    public ApiResponse<AvailabilityResponse> getAvailability(@PathVariable Long stockId) {
        return ApiResponse.success(AvailabilityResponse.from(stockService.getAvailability(stockId)));
    }

    // 응답 DTO
    public record AvailabilityResponse(
            Long stockId,
            int quantity,
            int reservedQuantity,
            int availableQuantity
    ) {
        public static AvailabilityResponse from(StockAvailability availability) {
            return new AvailabilityResponse(
                    availability.stockId(),
                    availability.quantity(),
                    availability.reservedQuantity(),
                    availability.displayQuantity()
            );
        }
    }
}
