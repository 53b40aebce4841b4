package com.shopledger.checkout.lock;

import com.shopledger.checkout.entity.Stock;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * 재고 행 단위 직렬화 장치
 * <p>
 * 가용 재고 재확인 → 예약 생성 구간을 같은 재고에 대해 직렬화한다.
 * 구현체는 stock id 오름차순으로 잠그고, 잠금 이후 최신 상태로 읽은 재고를
 * 같은 순서로 action 에 넘긴다. 잠금은 호출한 트랜잭션이 끝날 때까지만 유지된다.
 *
 * @see PessimisticStockLock
 * @see RedissonStockLock
 */
public interface StockLock {

    <T> T executeWithLock(Collection<Long> stockIds, Function<List<Stock>, T> action);

    static List<Long> lockOrder(Collection<Long> stockIds) {
        return stockIds.stream().distinct().sorted().toList();
    }
}
