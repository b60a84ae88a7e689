package com.flagship.hour_ledger.observability;

import com.flagship.hour_ledger.ledger.StudentBalanceRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerHealthIndicatorTest {

    @Mock
    private StudentBalanceRepository balanceRepository;

    @InjectMocks
    private LedgerHealthIndicator indicator;

    @Test
    @DisplayName("UP when no balance is overdrawn")
    void testUp() {
        when(balanceRepository.countOverdrawn()).thenReturn(0L);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(0L, health.getDetails().get("overdrawnBalances"));
    }

    @Test
    @DisplayName("DOWN when a balance is overdrawn")
    void testDownWhenOverdrawn() {
        when(balanceRepository.countOverdrawn()).thenReturn(2L);

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(2L, health.getDetails().get("overdrawnBalances"));
    }

    @Test
    @DisplayName("DOWN when the database cannot be queried")
    void testDownOnError() {
        when(balanceRepository.countOverdrawn()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("connection refused", health.getDetails().get("error"));
    }
}
