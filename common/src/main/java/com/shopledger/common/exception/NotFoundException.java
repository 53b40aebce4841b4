package com.shopledger.common.exception;

/**
 * 참조 대상(재고, 체크아웃, 라인 등)이 존재하지 않을 때 발생 (404)
 */
public class NotFoundException extends BusinessException {

    public NotFoundException(ErrorCode errorCode, Object id) {
        super(errorCode.getMessage() + ": " + id, errorCode.toErrorInfo());
    }
}
