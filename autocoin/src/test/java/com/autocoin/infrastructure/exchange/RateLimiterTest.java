package com.autocoin.infrastructure.exchange;

import com.autocoin.infrastructure.metrics.TradingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RateLimiterTest {

    @Mock
    private TradingMetrics metrics;

    private final AtomicLong clock = new AtomicLong(0);
    private final List<Duration> sleeps = new ArrayList<>();
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new RateLimiter(3, Duration.ofSeconds(1), clock::get, d -> {
            sleeps.add(d);
            clock.addAndGet(d.toNanos());
        }, metrics);
    }

    @Test
    void acquire_withinBudgetDoesNotWait() throws InterruptedException {
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        assertTrue(sleeps.isEmpty(), "Three requests fit a three-request window");
        assertEquals(3, limiter.getRequestCount());
        verifyNoInteractions(metrics);
    }

    @Test
    void acquire_fullWindowWaitsForRemainder() throws InterruptedException {
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();
        clock.addAndGet(Duration.ofMillis(400).toNanos());

        limiter.acquire();

        assertEquals(List.of(Duration.ofMillis(600)), sleeps, "Should wait out the rest of the window");
        assertEquals(1, limiter.getRequestCount(), "New window starts with this request");
        verify(metrics).recordRateLimitWait(Duration.ofMillis(600));
    }

    @Test
    void acquire_elapsedWindowResetsCount() throws InterruptedException {
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();
        clock.addAndGet(Duration.ofSeconds(1).toNanos());

        limiter.acquire();

        assertTrue(sleeps.isEmpty(), "A new window needs no wait");
        assertEquals(1, limiter.getRequestCount());
    }

    @Test
    void constructor_rejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class,
            () -> new RateLimiter(0, Duration.ofSeconds(1), metrics));
        assertThrows(IllegalArgumentException.class,
            () -> new RateLimiter(1, Duration.ZERO, metrics));
    }
}
