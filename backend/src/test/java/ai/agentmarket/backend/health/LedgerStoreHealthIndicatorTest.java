package ai.agentmarket.backend.health;

import ai.agentmarket.backend.store.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.RedisConnectionFailureException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerStoreHealthIndicatorTest {

    @Mock
    private LedgerStore ledgerStore;

    private LedgerStoreHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new LedgerStoreHealthIndicator(ledgerStore);
    }

    @Test
    void health_WhenCountSucceeds_ShouldReturnUpStatus() {
        // Arrange
        when(ledgerStore.count()).thenReturn(3L);
        when(ledgerStore.storeType()).thenReturn("memory");

        // Act
        Health result = healthIndicator.health();

        // Assert
        assertEquals(Status.UP, result.getStatus());
        assertEquals("memory", result.getDetails().get("store"));
        assertEquals(3L, result.getDetails().get("records"));
        assertTrue(result.getDetails().containsKey("response_time_ms"));
        verify(ledgerStore, never()).snapshot();
    }

    @Test
    void health_WhenStoreUnreachable_ShouldReturnDownStatus() {
        // Arrange
        when(ledgerStore.count()).thenThrow(new RedisConnectionFailureException("Connection refused"));
        when(ledgerStore.storeType()).thenReturn("redis");

        // Act
        Health result = healthIndicator.health();

        // Assert
        assertEquals(Status.DOWN, result.getStatus());
        assertEquals("redis", result.getDetails().get("store"));
        assertEquals("RedisConnectionFailureException", result.getDetails().get("error"));
        assertEquals("Connection refused", result.getDetails().get("message"));
    }
}
