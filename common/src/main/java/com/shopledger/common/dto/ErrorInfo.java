package com.shopledger.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 오류 응답 정보
 * <p>
 * field: 오류가 발생한 입력 필드 (예: "quantity"). 특정 필드와 무관하면 null
 */
@Builder
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorInfo {

    private String code;
    private String message;
    private String field;

    public static ErrorInfo of(String code, String message, String field) {
        return ErrorInfo.builder()
                .code(code)
                .message(message)
                .field(field)
                .build();
    }
}
