package com.ergrace.infrastructure;

import com.ergrace.application.port.RaceRecordStore;
import com.ergrace.domain.LobbyRecord;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.LobbyStatus;
import com.ergrace.domain.ProfileUpdate;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.domain.UserProfile;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Store used when persistence is off: writes are dropped, reads find nothing. */
@Component
@ConditionalOnProperty(name = "ergrace.store.enabled", havingValue = "false", matchIfMissing = true)
public class NoopRaceRecordStore implements RaceRecordStore {
  private static final Logger log = LoggerFactory.getLogger(NoopRaceRecordStore.class);

  public NoopRaceRecordStore() {
    log.info("Record store disabled; lobbies and races live in memory only");
  }

  @Override
  public void onLobbyCreated(LobbySnapshot lobby) {}

  @Override
  public void onLobbyStatusChanged(String lobbyId, LobbyStatus status, int participantCount) {}

  @Override
  public void onLobbyCompleted(LobbySnapshot lobby) {}

  @Override
  public void onRaceCompleted(RaceSnapshot race) {}

  @Override
  public void onUserStatsShouldUpdate(RaceSnapshot race) {}

  @Override
  public Optional<UserProfile> fetchUserProfile(String userId) {
    return Optional.empty();
  }

  @Override
  public Optional<UserProfile> saveUserProfile(String userId, ProfileUpdate data) {
    return Optional.empty();
  }

  @Override
  public List<LobbyRecord> loadWaitingLobbies() {
    return List.of();
  }
}
