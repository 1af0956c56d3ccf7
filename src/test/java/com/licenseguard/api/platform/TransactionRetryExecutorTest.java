package com.licenseguard.api.platform;

import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransactionRetryExecutorTest {

    private TransactionRetryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new TransactionRetryExecutor(new TransactionRetryConfiguration(3, Duration.ZERO));
    }

    @Test
    void execute_withoutConflicts() {
        val attempts = new AtomicInteger();
        val result = executor.execute(() -> attempts.incrementAndGet() * 10);
        assertEquals(10, result);
        assertEquals(1, attempts.get());
    }

    @Test
    void execute_withTransientConflicts() {
        val attempts = new AtomicInteger();
        val result = executor.execute(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new DataIntegrityViolationException("duplicate key");
            } else if (attempts.get() == 2) {
                throw new CannotAcquireLockException("lock timeout");
            }

            return "converged";
        });

        assertEquals("converged", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void execute_withPersistentConflicts() {
        val attempts = new AtomicInteger();
        val e = assertThrows(TransactionRetriesExhaustedException.class, () -> executor.execute(() -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        }));

        assertEquals(3, e.getAttempts());
        assertEquals(3, attempts.get());
        assertEquals(DataIntegrityViolationException.class, e.getCause().getClass());
    }

    @Test
    void execute_withCheckedException() {
        val attempts = new AtomicInteger();
        assertThrows(IOException.class, () -> executor.execute(() -> {
            attempts.incrementAndGet();
            throw new IOException("not retryable");
        }));

        assertEquals(1, attempts.get());
    }

    @Test
    void execute_withinActiveTransaction() {
        TransactionSynchronizationManager.setActualTransactionActive(true);
        try {
            assertThrows(IllegalStateException.class, () -> executor.execute(() -> 1));
        } finally {
            TransactionSynchronizationManager.setActualTransactionActive(false);
        }
    }

    @Test
    void deferUntilSettled_outsideUnitOfWork() {
        assertFalse(executor.deferUntilSettled(() -> { }));
    }

    @Test
    void deferUntilSettled_withTransientConflicts() {
        val attempts = new AtomicInteger();
        val settled = new ArrayList<Integer>();
        val result = executor.execute(() -> {
            val attempt = attempts.incrementAndGet();
            assertTrue(executor.deferUntilSettled(() -> settled.add(attempt)));
            if (attempt < 3) {
                throw new DataIntegrityViolationException("duplicate key");
            }

            // deferred actions don't run before the unit of work settles.
            assertTrue(settled.isEmpty());
            return attempt;
        });

        assertEquals(3, result);
        assertEquals(List.of(3), settled);
        assertFalse(executor.deferUntilSettled(() -> { }));
    }

    @Test
    void deferUntilSettled_withCheckedException() {
        val settled = new AtomicInteger();
        assertThrows(IOException.class, () -> executor.execute(() -> {
            executor.deferUntilSettled(settled::incrementAndGet);
            throw new IOException("rejected");
        }));

        assertEquals(1, settled.get());
    }

    @Test
    void deferUntilSettled_withPersistentConflicts() {
        val settled = new AtomicInteger();
        assertThrows(TransactionRetriesExhaustedException.class, () -> executor.execute(() -> {
            executor.deferUntilSettled(settled::incrementAndGet);
            throw new DataIntegrityViolationException("duplicate key");
        }));

        assertEquals(0, settled.get());
    }

    @Test
    void deferUntilSettled_withFailingAction() {
        val settled = new AtomicInteger();
        val result = executor.execute(() -> {
            executor.deferUntilSettled(() -> {
                throw new IllegalStateException("storage unavailable");
            });

            executor.deferUntilSettled(settled::incrementAndGet);
            return "done";
        });

        assertEquals("done", result);
        assertEquals(1, settled.get());
    }
}
