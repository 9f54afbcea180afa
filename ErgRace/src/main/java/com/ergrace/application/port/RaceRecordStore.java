package com.ergrace.application.port;

import com.ergrace.domain.LobbyRecord;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.LobbyStatus;
import com.ergrace.domain.ProfileUpdate;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.domain.UserProfile;
import java.util.List;
import java.util.Optional;

/**
 * Durable mirror of lobbies, races and user stats. The coordinator treats every method as best
 * effort: implementations may throw, and the in-memory state never depends on the outcome.
 */
public interface RaceRecordStore {
  void onLobbyCreated(LobbySnapshot lobby);

  void onLobbyStatusChanged(String lobbyId, LobbyStatus status, int participantCount);

  void onLobbyCompleted(LobbySnapshot lobby);

  void onRaceCompleted(RaceSnapshot race);

  /** Count the race for every human participant and a win for the human in first place. */
  void onUserStatsShouldUpdate(RaceSnapshot race);

  Optional<UserProfile> fetchUserProfile(String userId);

  Optional<UserProfile> saveUserProfile(String userId, ProfileUpdate data);

  /** Lobbies still waiting when the process last stopped. */
  List<LobbyRecord> loadWaitingLobbies();
}
