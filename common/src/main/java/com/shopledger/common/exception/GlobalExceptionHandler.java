package com.shopledger.common.exception;

import com.shopledger.common.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 전역 예외 처리기
 *
 * <h2>예외 분류</h2>
 * <pre>
 * - NotFoundException: 참조 대상 없음 (404 Not Found)
 * - BusinessException: 비즈니스 규칙 위반, 재고 부족 등 (400 Bad Request)
 * - OptimisticLockingFailureException: 동시 수정 충돌 (409 Conflict)
 * - 기타 Exception: 시스템 오류 (500 Internal Server Error)
 * </pre>
 * Spring은 더 구체적인 예외 핸들러를 먼저 매칭하므로 NotFoundException이
 * BusinessException보다 우선한다.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 참조 대상 없음 (404 Not Found)
     */
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFoundException(NotFoundException e) {
        log.warn("조회 대상 없음: code={}, message={}", e.getErrorInfo().getCode(), e.getMessage());

        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.fail(e.getErrorInfo()));
    }

    /**
     * 비즈니스 예외 처리 (400 Bad Request)
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("비즈니스 예외 발생: code={}, field={}, message={}",
                e.getErrorInfo().getCode(), e.getErrorInfo().getField(), e.getMessage());

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.fail(e.getErrorInfo()));
    }

    /**
     * 낙관적 락 충돌 처리 (409 Conflict)
     * <p>
     * Stock / Checkout 의 @Version 충돌 시 발생한다. 클라이언트는 다시 조회 후 재시도해야 한다.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleOptimisticLockException(
            OptimisticLockingFailureException e) {
        log.warn("낙관적 락 충돌 발생: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.fail(ErrorCode.OPTIMISTIC_LOCK_CONFLICT.toErrorInfo()));
    }

    /**
     * 기타 모든 예외 처리 (500 Internal Server Error)
     * <p>
     * 예외 메시지를 클라이언트에 노출하지 않고 일반적인 에러 메시지를 반환한다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("예외 발생: ", e);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.fail(ErrorCode.INTERNAL_ERROR.toErrorInfo()));
    }
}
