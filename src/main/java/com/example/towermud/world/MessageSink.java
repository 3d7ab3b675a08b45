package com.example.towermud.world;

/**
 * Outbound text channel of one connected player. Implementations must not
 * block the caller.
 */
@FunctionalInterface
public interface MessageSink {

    /** Sink that drops everything, for players without a live connection. */
    MessageSink NONE = text -> { };

    void send(String text);
}
