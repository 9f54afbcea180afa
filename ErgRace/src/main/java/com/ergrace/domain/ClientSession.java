package com.ergrace.domain;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Per-connection state: who the connection says it is and which lobby rooms it is in. */
public class ClientSession {
  private final String id;
  private final Set<String> rooms = ConcurrentHashMap.newKeySet();

  private volatile String userId;

  public ClientSession(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public String userId() {
    return userId;
  }

  public void userId(String u) {
    userId = u;
  }

  public boolean identified() {
    return userId != null;
  }

  public Set<String> rooms() {
    return rooms;
  }
}
