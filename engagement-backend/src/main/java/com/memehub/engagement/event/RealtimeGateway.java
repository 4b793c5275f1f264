package com.memehub.engagement.event;

/**
 * Push channel to other viewers (websocket hub or similar, owned by the
 * presentation layer). Delivery is best-effort.
 */
public interface RealtimeGateway {

    void push(String topic, Object payload);
}
