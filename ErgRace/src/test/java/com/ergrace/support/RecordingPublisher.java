package com.ergrace.support;

import com.ergrace.application.port.EventPublisher;
import com.ergrace.domain.CoordinatorEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Keeps every delivery in order; sessions listed in {@link #failFor} throw instead. A hook set
 * with {@link #onSend} runs after each recorded delivery, on the delivering thread.
 */
public class RecordingPublisher implements EventPublisher {
  public record Delivery(String sessionId, CoordinatorEvent event) {}

  private final List<Delivery> deliveries = new ArrayList<>();
  private final Set<String> failFor = ConcurrentHashMap.newKeySet();

  private volatile BiConsumer<String, CoordinatorEvent> onSend = (sessionId, event) -> {};

  @Override
  public void send(String sessionId, CoordinatorEvent event) {
    if (failFor.contains(sessionId)) {
      throw new IllegalStateException("session " + sessionId + " is gone");
    }
    synchronized (this) {
      deliveries.add(new Delivery(sessionId, event));
    }
    onSend.accept(sessionId, event);
  }

  public void onSend(BiConsumer<String, CoordinatorEvent> hook) {
    onSend = hook;
  }

  public void failFor(String sessionId) {
    failFor.add(sessionId);
  }

  public synchronized List<Delivery> deliveries() {
    return List.copyOf(deliveries);
  }

  public synchronized List<CoordinatorEvent> eventsFor(String sessionId) {
    return deliveries.stream()
        .filter(d -> d.sessionId().equals(sessionId))
        .map(Delivery::event)
        .toList();
  }

  public synchronized <T extends CoordinatorEvent> List<T> eventsOf(String sessionId, Class<T> type) {
    return eventsFor(sessionId).stream().filter(type::isInstance).map(type::cast).toList();
  }

  public synchronized List<String> typesFor(String sessionId) {
    return eventsFor(sessionId).stream().map(CoordinatorEvent::type).toList();
  }

  public synchronized void clear() {
    deliveries.clear();
  }
}
