package com.shopledger.checkout.lock;

import com.shopledger.checkout.entity.Stock;
import com.shopledger.checkout.repository.StockRepository;
import com.shopledger.common.exception.ErrorCode;
import com.shopledger.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * DB 행 잠금 (SELECT ... FOR UPDATE)
 * <p>
 * 트랜잭션 안에서만 호출할 수 있고, 잠금은 커밋/롤백 시 해제된다.
 */
@Component
@ConditionalOnProperty(prefix = "checkout.reservation", name = "lock-strategy",
        havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PessimisticStockLock implements StockLock {

    private final StockRepository stockRepository;

    @Override
    public <T> T executeWithLock(Collection<Long> stockIds, Function<List<Stock>, T> action) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("재고 행 잠금은 트랜잭션 안에서만 사용할 수 있습니다");
        }

        List<Stock> locked = new ArrayList<>();
        for (Long stockId : StockLock.lockOrder(stockIds)) {
            Stock stock = stockRepository.findByIdForUpdate(stockId)
                    .orElseThrow(() -> new NotFoundException(ErrorCode.STOCK_NOT_FOUND, stockId));
            locked.add(stock);
            log.debug("[RowLock] 재고 행 잠금: stockId={}", stockId);
        }
        return action.apply(locked);
    }
}
