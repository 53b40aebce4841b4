package com.shopledger.checkout.lock;

import com.shopledger.checkout.entity.Stock;
import com.shopledger.checkout.repository.StockRepository;
import com.shopledger.common.exception.NotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PessimisticStockLockTest {

    @Mock
    private StockRepository stockRepository;

    @InjectMocks
    private PessimisticStockLock stockLock;

    @AfterEach
    void tearDown() {
        TransactionSynchronizationManager.setActualTransactionActive(false);
    }

    @Test
    @DisplayName("stock id 오름차순으로 FOR UPDATE 조회 후 같은 순서로 action 에 넘긴다")
    void executeWithLock_locksInAscendingOrder() {
        // given
        TransactionSynchronizationManager.setActualTransactionActive(true);
        Stock stock1 = Stock.builder().quantity(1).build();
        Stock stock2 = Stock.builder().quantity(2).build();
        when(stockRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(stock1));
        when(stockRepository.findByIdForUpdate(2L)).thenReturn(Optional.of(stock2));

        // when
        List<Stock> locked = stockLock.executeWithLock(List.of(2L, 1L), stocks -> stocks);

        // then
        assertThat(locked).containsExactly(stock1, stock2);
        InOrder order = inOrder(stockRepository);
        order.verify(stockRepository).findByIdForUpdate(1L);
        order.verify(stockRepository).findByIdForUpdate(2L);
    }

    @Test
    @DisplayName("없는 재고는 STOCK_NOT_FOUND")
    void executeWithLock_unknownStock_throwsNotFound() {
        TransactionSynchronizationManager.setActualTransactionActive(true);
        when(stockRepository.findByIdForUpdate(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> stockLock.executeWithLock(List.of(9L), stocks -> stocks))
                .isInstanceOf(NotFoundException.class)
                .satisfies(e -> assertThat(((NotFoundException) e).getErrorInfo().getField()).isEqualTo("stockId"));
    }

    @Test
    @DisplayName("트랜잭션 밖에서는 잠글 수 없다")
    void executeWithLock_outsideTransaction_fails() {
        assertThatThrownBy(() -> stockLock.executeWithLock(List.of(1L), stocks -> stocks))
                .isInstanceOf(IllegalStateException.class);
        verify(stockRepository, never()).findByIdForUpdate(anyLong());
    }
}
