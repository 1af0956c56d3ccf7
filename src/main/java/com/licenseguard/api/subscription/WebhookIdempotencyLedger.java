package com.licenseguard.api.subscription;

import com.licenseguard.api.subscription.entities.WebhookEventRepository;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * <p>
 * Guarantees that each external event mutates the local state at most once, even when the
 * provider retries or replays it.</p>
 *
 * <p>
 * The ledger row for an event and the event's effect are written in the same transaction, so
 * either both commit or neither does. The row is inserted before the effect runs. A concurrent
 * delivery of the same event blocks on the uncommitted row and then fails on the primary key,
 * which rolls it back without ever running the effect twice.</p>
 */
@Component
@Slf4j
class WebhookIdempotencyLedger {

    private final WebhookEventRepository webhookEventRepository;

    @Autowired
    WebhookIdempotencyLedger(@NonNull WebhookEventRepository webhookEventRepository) {
        this.webhookEventRepository = webhookEventRepository;
    }

    /**
     * @return whether the event with the given {@code eventId} was already applied. A {@code false}
     * result isn't authoritative: a concurrent delivery may still apply the event first.
     */
    @Transactional(readOnly = true)
    public boolean isProcessed(@NonNull String eventId) {
        return webhookEventRepository.existsById(eventId);
    }

    /**
     * Applies {@code effect} unless the event with the given {@code eventId} was already applied.
     *
     * @param eventId   provider assigned, globally unique id of the event.
     * @param eventType provider assigned type of the event.
     * @param effect    state mutation authorised by the event.
     * @return {@code true} if the effect was applied, {@code false} if the event is a replay.
     * @throws E                                                       if the effect fails. Nothing
     *                                                                 is recorded in that case.
     * @throws org.springframework.dao.DataIntegrityViolationException if a concurrent delivery of
     *                                                                 the same event won the race.
     */
    @Transactional(rollbackFor = Throwable.class)
    public <E extends Exception> boolean processExternalEvent(
        @NonNull String eventId,
        @NonNull String eventType,
        @NonNull Effect<E> effect
    ) throws E {
        if (webhookEventRepository.existsById(eventId)) {
            log.info("ignoring replayed event: id={} type={}", eventId, eventType);
            return false;
        }

        webhookEventRepository.insert(eventId, eventType);
        effect.apply();
        return true;
    }

    /**
     * A state mutation authorised by an external event.
     */
    @FunctionalInterface
    interface Effect<E extends Exception> {

        void apply() throws E;
    }
}
