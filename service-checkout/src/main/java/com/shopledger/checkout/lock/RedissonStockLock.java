package com.shopledger.checkout.lock;

import com.shopledger.checkout.entity.Stock;
import com.shopledger.checkout.repository.StockRepository;
import com.shopledger.common.exception.BusinessException;
import com.shopledger.common.exception.ErrorCode;
import com.shopledger.common.exception.NotFoundException;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Redisson 분산 락 (RLock)
 *
 * <h3>동작</h3>
 * <ol>
 *   <li>stock id 오름차순으로 lock:stock:{id} 획득 (tryLock, 대기/임대 시간 제한)</li>
 *   <li>재고를 다시 읽어 action 실행</li>
 *   <li>트랜잭션이 있으면 커밋/롤백 이후에, 없으면 즉시 역순으로 해제</li>
 * </ol>
 * 커밋 전에 락을 풀면 다른 인스턴스가 아직 커밋되지 않은 예약을 못 보고 통과할 수 있다.
 */
@Component
@ConditionalOnProperty(prefix = "checkout.reservation", name = "lock-strategy", havingValue = "redisson")
@Slf4j
public class RedissonStockLock implements StockLock {

    static final String LOCK_KEY_PREFIX = "lock:stock:";

    private final RedissonClient redissonClient;
    private final StockRepository stockRepository;
    private final EntityManager entityManager;
    private final long waitSeconds;
    private final long leaseSeconds;

    public RedissonStockLock(RedissonClient redissonClient,
                             StockRepository stockRepository,
                             EntityManager entityManager,
                             @Value("${checkout.reservation.lock.wait-seconds:5}") long waitSeconds,
                             @Value("${checkout.reservation.lock.lease-seconds:30}") long leaseSeconds) {
        this.redissonClient = redissonClient;
        this.stockRepository = stockRepository;
        this.entityManager = entityManager;
        this.waitSeconds = waitSeconds;
        this.leaseSeconds = leaseSeconds;
    }

    @Override
    public <T> T executeWithLock(Collection<Long> stockIds, Function<List<Stock>, T> action) {
        List<RLock> acquired = new ArrayList<>();
        boolean deferredRelease = false;

        try {
            for (Long stockId : StockLock.lockOrder(stockIds)) {
                String lockKey = LOCK_KEY_PREFIX + stockId;
                RLock lock = redissonClient.getLock(lockKey);
                if (!lock.tryLock(waitSeconds, leaseSeconds, TimeUnit.SECONDS)) {
                    log.warn("[DistributedLock] 락 획득 실패: {}", lockKey);
                    throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED);
                }
                acquired.add(lock);
                log.debug("[DistributedLock] 락 획득 : {}", lockKey);
            }

            List<Stock> stocks = new ArrayList<>();
            for (Long stockId : StockLock.lockOrder(stockIds)) {
                Stock stock = stockRepository.findById(stockId)
                        .orElseThrow(() -> new NotFoundException(ErrorCode.STOCK_NOT_FOUND, stockId));
                if (entityManager.contains(stock)) {
                    entityManager.refresh(stock);
                }
                stocks.add(stock);
            }

            T result = action.apply(stocks);
            deferredRelease = releaseAfterCompletion(acquired);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.LOCK_INTERRUPTED);
        } finally {
            if (!deferredRelease) {
                unlockAll(acquired);
            }
        }
    }

    private boolean releaseAfterCompletion(List<RLock> acquired) {
        if (acquired.isEmpty() || !TransactionSynchronizationManager.isSynchronizationActive()) {
            return false;
        }
        List<RLock> locks = List.copyOf(acquired);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                unlockAll(locks);
            }
        });
        return true;
    }

    private void unlockAll(List<RLock> locks) {
        for (int i = locks.size() - 1; i >= 0; i--) {
            RLock lock = locks.get(i);
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("[DistributedLock] 락 해제: {}", lock.getName());
            }
        }
    }
}
