package com.shopledger.checkout.exception;

import com.shopledger.common.exception.BusinessException;
import com.shopledger.common.exception.ErrorCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 요청 수량이 가용 재고를 초과할 때 발생 (field: "quantity", code: INSUFFICIENT_STOCK)
 * <p>
 * 재시도 대상이 아니다. 사용자가 수량 또는 배송지를 바꿔야 한다.
 */
@Getter
public class InsufficientStockException extends BusinessException {

    private final List<InsufficientStockItem> items;

    public InsufficientStockException(List<InsufficientStockItem> items) {
        super(buildMessage(items), ErrorCode.INSUFFICIENT_STOCK.toErrorInfo());
        this.items = List.copyOf(items);
    }

    public static InsufficientStockException of(Long variantId, int requested, int available) {
        return new InsufficientStockException(List.of(new InsufficientStockItem(variantId, requested, available)));
    }

    private static String buildMessage(List<InsufficientStockItem> items) {
        return ErrorCode.INSUFFICIENT_STOCK.getMessage() + ": " + items.stream()
                .map(item -> "variantId=" + item.variantId()
                        + " (requested=" + item.requestedQuantity()
                        + ", available=" + item.availableQuantity() + ")")
                .collect(Collectors.joining(", "));
    }
}
