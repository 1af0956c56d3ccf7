package com.licenseguard.api.platform;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * <p>
 * Re-runs a transactional unit of work when it loses a race against a concurrent writer.</p>
 *
 * <p>
 * Units of work rely on unique constraints and conditional updates instead of in-process locks.
 * When two requests race, the loser fails with a {@link DataIntegrityViolationException} (e.g. a
 * duplicate key on an insert) or a {@link TransientDataAccessException} (e.g. an optimistic lock
 * failure or a lock timeout). Its transaction has rolled back by then, so running the whole unit
 * again observes the winner's committed rows and converges to the same outcome.</p>
 *
 * <p>
 * The executor must be invoked outside any transaction. It is a separate bean so that the
 * {@code @Transactional} proxy of the unit of work is entered once per attempt.</p>
 *
 * <p>
 * Side effects that must survive a rollback, but must not repeat when an attempt is re-run, are
 * registered with {@link #deferUntilSettled(Runnable)}. They run once the unit of work settles,
 * i.e. it returns or throws an exception that isn't retried, and are discarded along with every
 * attempt that lost a race. Since the unit's transaction has completed by then, they never hold a
 * second connection while the unit holds its first.</p>
 */
@Component
@Slf4j
public class TransactionRetryExecutor {

    private final TransactionRetryConfiguration config;
    private final ThreadLocal<List<Runnable>> deferredActions = new ThreadLocal<>();

    @Autowired
    public TransactionRetryExecutor(@NonNull TransactionRetryConfiguration config) {
        this.config = config;
    }

    /**
     * Runs the given {@code work}, retrying it on storage-level conflicts.
     *
     * @param work a unit of work that starts (and commits) its own transaction.
     * @return the value returned by the first successful attempt.
     * @throws E                                    if the unit of work throws it. It is never
     *                                              retried.
     * @throws TransactionRetriesExhaustedException if every attempt ended in a conflict.
     */
    public <T, E extends Exception> T execute(@NonNull TransactionalWork<T, E> work) throws E {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("retrying a unit of work inside an outer transaction has no effect");
        }

        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= config.getMaxAttempts(); attempt++) {
            val outerActions = deferredActions.get();
            val actions = new ArrayList<Runnable>();
            deferredActions.set(actions);
            var conflicted = false;
            try {
                return work.run();
            } catch (DataIntegrityViolationException | TransientDataAccessException e) {
                conflicted = true;
                lastConflict = e;
                log.debug("attempt {} lost a race with a concurrent transaction", attempt, e);
                if (attempt < config.getMaxAttempts()) {
                    backOff(attempt, e);
                }
            } finally {
                if (outerActions == null) {
                    deferredActions.remove();
                } else {
                    deferredActions.set(outerActions);
                }

                if (!conflicted) {
                    runDeferred(actions);
                }
            }
        }

        throw new TransactionRetriesExhaustedException(config.getMaxAttempts(), lastConflict);
    }

    /**
     * Defers {@code action} until the unit of work that the calling thread is running settles.
     *
     * @return {@code false} if the calling thread isn't running a unit of work. The action is not
     * registered in that case.
     */
    public boolean deferUntilSettled(@NonNull Runnable action) {
        val actions = deferredActions.get();
        if (actions == null) {
            return false;
        }

        actions.add(action);
        return true;
    }

    private static void runDeferred(@NonNull List<Runnable> actions) {
        for (val action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                // the unit of work has already settled, so its outcome must not change.
                log.error("deferred action failed after its unit of work settled", e);
            }
        }
    }

    private void backOff(int attempt, @NonNull RuntimeException conflict) {
        val base = config.getBackoff().toMillis() * attempt;
        if (base <= 0) {
            return;
        }

        try {
            Thread.sleep(base + ThreadLocalRandom.current().nextLong(base + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionRetriesExhaustedException(attempt, conflict);
        }
    }

    /**
     * A unit of work that runs in its own transaction.
     */
    @FunctionalInterface
    public interface TransactionalWork<T, E extends Exception> {

        T run() throws E;
    }
}
