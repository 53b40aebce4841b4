package com.shopledger.checkout.exception;

import com.shopledger.common.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * 재고 부족 응답: 공통 오류 정보에 부족 품목 목록을 data 로 함께 내려준다.
 * 나머지 예외는 GlobalExceptionHandler 가 처리한다.
 */
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class CheckoutExceptionHandler {

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ApiResponse<List<InsufficientStockItem>>> handleInsufficientStock(
            InsufficientStockException e) {
        log.warn("재고 부족: field={}, items={}", e.getErrorInfo().getField(), e.getItems());

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.fail(e.getErrorInfo(), e.getItems()));
    }
}
