package com.shopledger.checkout.service;

import com.shopledger.checkout.entity.ProductVariant;
import com.shopledger.checkout.entity.Stock;
import com.shopledger.checkout.entity.Warehouse;
import com.shopledger.checkout.repository.ProductVariantRepository;
import com.shopledger.checkout.repository.StockRepository;
import com.shopledger.checkout.repository.WarehouseRepository;
import com.shopledger.common.exception.ErrorCode;
import com.shopledger.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class StockService {

    private final StockRepository stockRepository;
    private final WarehouseRepository warehouseRepository;
    private final ProductVariantRepository productVariantRepository;
    private final AvailabilityCalculator availabilityCalculator;
    private final Clock clock;

    /**
     * 재고 조회
     */
    public Stock getStock(Long stockId) {
        return stockRepository.findById(stockId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.STOCK_NOT_FOUND, stockId));
    }

    /**
     * 재고 수량 (부수효과 없음)
     */
    public int getQuantity(Long stockId) {
        return getStock(stockId).getQuantity();
    }

    /**
     * 조회용 가용 재고 (잠금 없음, 모든 체크아웃의 활성 예약 포함)
     */
    public StockAvailability getAvailability(Long stockId) {
        Stock stock = getStock(stockId);
        return availabilityCalculator.available(stock, LocalDateTime.now(clock), null);
    }

    /**
     * 재고 등록
     */
    @Transactional
    public Stock createStock(Long warehouseId, Long variantId, int quantity) {
        Warehouse warehouse = warehouseRepository.findById(warehouseId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.WAREHOUSE_NOT_FOUND, warehouseId));
        ProductVariant variant = productVariantRepository.findById(variantId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.VARIANT_NOT_FOUND, variantId));

        Stock stock = stockRepository.save(Stock.builder()
                .warehouse(warehouse)
                .variant(variant)
                .quantity(quantity)
                .build());

        log.info("재고 등록 완료: stockId={}, warehouseId={}, variantId={}, quantity={}",
                stock.getId(), warehouseId, variantId, quantity);
        return stock;
    }

    /**
     * 재고 수량 변경 (입고, 실사 조정)
     * <p>
     * 이미 잡혀 있는 예약은 소급해서 검사하지 않는다.
     */
    @Transactional
    public Stock changeQuantity(Long stockId, int quantity) {
        Stock stock = getStock(stockId);
        int before = stock.getQuantity();
        stock.changeQuantity(quantity);

        log.info("재고 수량 변경: stockId={}, before={}, after={}", stockId, before, quantity);
        return stock;
    }
}
