package com.shopledger.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Builder
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private ErrorInfo errorInfo;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> fail(ErrorInfo errorInfo) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorInfo(errorInfo)
                .build();
    }

    /**
     * 실패 응답 + 상세 데이터 (예: 재고 부족 품목 목록)
     */
    public static <T> ApiResponse<T> fail(ErrorInfo errorInfo, T data) {
        return ApiResponse.<T>builder()
                .success(false)
                .data(data)
                .errorInfo(errorInfo)
                .build();
    }
}
