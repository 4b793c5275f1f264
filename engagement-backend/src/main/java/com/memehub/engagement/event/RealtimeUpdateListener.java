package com.memehub.engagement.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed changes to the realtime gateway on the async executor.
 * Runs after commit only, and a failed push is logged, never rethrown.
 */
@Component
public class RealtimeUpdateListener {

    private static final Logger log = LoggerFactory.getLogger(RealtimeUpdateListener.class);

    static final String TOPIC_USER = "user.";
    static final String TOPIC_MEME = "meme.";

    private final RealtimeGateway gateway;

    public RealtimeUpdateListener(RealtimeGateway gateway) {
        this.gateway = gateway;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEngagementUpdate(EngagementUpdateEvent event) {
        String topic = event.getMemeId() != null ? TOPIC_MEME + event.getMemeId() : TOPIC_USER + event.getUserId();
        deliver(topic, event);
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRankChanged(RankChangedEvent event) {
        deliver(TOPIC_USER + event.getUserId(), event);
    }

    private void deliver(String topic, Object payload) {
        try {
            gateway.push(topic, payload);
        } catch (RuntimeException e) {
            log.warn("Realtime push to {} failed, dropping update {}: {}", topic, payload, e.getMessage());
        }
    }
}
