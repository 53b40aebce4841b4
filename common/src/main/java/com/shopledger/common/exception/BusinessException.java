package com.shopledger.common.exception;

import com.shopledger.common.dto.ErrorInfo;
import lombok.Getter;

@Getter
public class BusinessException extends RuntimeException {
    private final ErrorInfo errorInfo;

    public BusinessException(String message, ErrorInfo errorInfo) {
        super(message);
        this.errorInfo = errorInfo;
    }

    public BusinessException(ErrorInfo errorInfo) {
        super(errorInfo.getMessage());
        this.errorInfo = errorInfo;
    }

    public BusinessException(ErrorCode errorCode) {
        this(errorCode.toErrorInfo());
    }
}
