package com.kvrestore.core.event;

/**
 * Single destination for recovery events. Components receive one sink at construction and emit
 * every notice through it.
 */
@FunctionalInterface
public interface EventSink {

  void emit(RecoveryEvent event);
}
