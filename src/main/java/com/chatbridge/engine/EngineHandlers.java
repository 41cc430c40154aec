package com.chatbridge.engine;

import com.chatbridge.shared.model.Envelope;

/**
 * Optional behavior hooks invoked after an event has been stored and forwarded. A throwing
 * hook is logged and never stops event processing.
 */
public interface EngineHandlers {

    EngineHandlers NONE = new EngineHandlers() {};

    default void onMessage(Envelope envelope) {}

    default void onReceipt(Envelope envelope) {}

    default void onPresence(Envelope envelope) {}

    default void onGroupUpdate(Envelope envelope) {}

    default void onError(Throwable error) {}
}
