package net.scanward.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RetryPolicyTest {

    @Test
    void exponential_doubles_then_caps() {
        RetryPolicy p = RetryPolicy.exponential(Duration.ofMillis(100), Duration.ofMillis(500));
        assertEquals(Duration.ofMillis(100), p.nextBackoff(1));
        assertEquals(Duration.ofMillis(200), p.nextBackoff(2));
        assertEquals(Duration.ofMillis(400), p.nextBackoff(3));
        assertEquals(Duration.ofMillis(500), p.nextBackoff(4));
        assertEquals(Duration.ofMillis(500), p.nextBackoff(60));
    }

    @Test
    void fixed_ignores_attempt() {
        RetryPolicy p = RetryPolicy.fixed(Duration.ofSeconds(3));
        assertEquals(Duration.ofSeconds(3), p.nextBackoff(1));
        assertEquals(Duration.ofSeconds(3), p.nextBackoff(9));
    }
}
