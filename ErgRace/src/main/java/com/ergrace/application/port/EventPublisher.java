package com.ergrace.application.port;

import com.ergrace.domain.CoordinatorEvent;

public interface EventPublisher {
  /** Deliver one event to one connection. May throw if the connection is gone. */
  void send(String sessionId, CoordinatorEvent event);
}
