package com.example.rabbitretry.session;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * ChannelHealthGuard 单元测试
 */
class ChannelHealthGuardTest {

    private ChannelHealthGuard guard;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        guard = new ChannelHealthGuard();
        invocations = new AtomicInteger();
    }

    @Test
    void testGuarded_OpenSession() {
        // When
        GuardResult result = guard.guarded(() -> SessionState.OPEN, "ack", invocations::incrementAndGet);

        // Then
        assertEquals(GuardResult.OK, result);
        assertEquals(1, invocations.get());
    }

    @Test
    void testGuarded_ClosedSession() {
        // When
        GuardResult result = guard.guarded(() -> SessionState.CLOSED, "ack", invocations::incrementAndGet);

        // Then
        assertEquals(GuardResult.SKIPPED, result);
        assertEquals(0, invocations.get());
    }

    @Test
    void testGuarded_ClosingSession() {
        // When
        GuardResult result = guard.guarded(() -> SessionState.CLOSING, "publish", invocations::incrementAndGet);

        // Then
        assertEquals(GuardResult.SKIPPED, result);
        assertEquals(0, invocations.get());
    }

    @Test
    void testGuarded_OperationFails() {
        // When
        GuardResult result = guard.guarded(() -> SessionState.OPEN, "ack", () -> {
            throw new IOException("channel is already closed due to channel error");
        });

        // Then
        assertEquals(GuardResult.FAILED, result);
    }
}
