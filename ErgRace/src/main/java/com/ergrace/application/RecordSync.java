package com.ergrace.application;

import com.ergrace.application.port.RaceRecordStore;
import com.ergrace.domain.LobbyRecord;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.ProfileUpdate;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.domain.UserProfile;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget bridge to the {@link RaceRecordStore}.
 *
 * <p>Writes run on the record executor and are never retried; a failure is logged and dropped.
 * Reads run on the caller's thread and degrade to empty.
 */
@Service
public class RecordSync {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final RaceRecordStore store;
  private final Executor executor;

  public RecordSync(RaceRecordStore store, @Qualifier("recordExecutor") Executor executor) {
    this.store = store;
    this.executor = executor;
  }

  public void lobbyCreated(LobbySnapshot lobby) {
    submit("onLobbyCreated " + lobby.id(), s -> s.onLobbyCreated(lobby));
  }

  public void lobbyStatusChanged(LobbySnapshot lobby) {
    submit(
        "onLobbyStatusChanged " + lobby.id(),
        s -> s.onLobbyStatusChanged(lobby.id(), lobby.status(), lobby.participantCount()));
  }

  /** Completion fans out to the lobby, the race record and the user stats. */
  public void raceCompleted(LobbySnapshot lobby, RaceSnapshot race) {
    if (lobby != null) {
      submit("onLobbyCompleted " + lobby.id(), s -> s.onLobbyCompleted(lobby));
    }
    submit("onRaceCompleted " + race.id(), s -> s.onRaceCompleted(race));
    submit("onUserStatsShouldUpdate " + race.id(), s -> s.onUserStatsShouldUpdate(race));
  }

  public Optional<UserProfile> fetchProfile(String userId) {
    return read("fetchUserProfile " + userId, () -> store.fetchUserProfile(userId));
  }

  public Optional<UserProfile> saveProfile(String userId, ProfileUpdate data) {
    return read("saveUserProfile " + userId, () -> store.saveUserProfile(userId, data));
  }

  public List<LobbyRecord> waitingLobbies() {
    try {
      return store.loadWaitingLobbies();
    } catch (RuntimeException e) {
      log.warn("loadWaitingLobbies failed: {}", e.getMessage());
      return List.of();
    }
  }

  private void submit(String op, Consumer<RaceRecordStore> call) {
    try {
      executor.execute(() -> {
        try {
          call.accept(store);
        } catch (RuntimeException e) {
          log.warn("Record store {} failed: {}", op, e.getMessage());
        }
      });
    } catch (RejectedExecutionException e) {
      log.warn("Record store {} not submitted: {}", op, e.getMessage());
    }
  }

  private <T> Optional<T> read(String op, Supplier<Optional<T>> call) {
    try {
      return call.get();
    } catch (RuntimeException e) {
      log.warn("Record store {} failed: {}", op, e.getMessage());
      return Optional.empty();
    }
  }
}
