package com.memehub.engagement.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default gateway: logs the update. A push channel replaces it with a @Primary bean.
 */
@Component
public class LoggingRealtimeGateway implements RealtimeGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingRealtimeGateway.class);

    @Override
    public void push(String topic, Object payload) {
        log.debug("Realtime update [{}]: {}", topic, payload);
    }
}
