package com.ergrace.application;

import com.ergrace.application.RaceCoordinator.Entrant;
import com.ergrace.application.RaceCoordinator.LobbyTerms;
import com.ergrace.application.RaceCoordinator.Rejoined;
import com.ergrace.domain.BotDifficulty;
import com.ergrace.domain.CoordinatorEvent.LobbyCreated;
import com.ergrace.domain.CoordinatorEvent.LobbyList;
import com.ergrace.domain.CoordinatorEvent.RaceCompleted;
import com.ergrace.domain.CoordinatorEvent.RaceUpdate;
import com.ergrace.domain.EquipmentType;
import com.ergrace.domain.LobbyRecord;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.LobbyStatus;
import com.ergrace.domain.PayoutMode;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.domain.RaceStatus;
import com.ergrace.support.Harness;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RaceCoordinatorTest {
  private Harness h;

  @AfterEach
  void tearDown() {
    if (h != null) h.close();
  }

  private LobbySnapshot create(String sid, String creator, int max, int min) {
    return h.coordinator.createLobby(
        sid, new LobbyTerms(creator, 500, "1.5", PayoutMode.WINNER_TAKES_ALL, max, min));
  }

  private static Entrant entrant(String id) {
    return new Entrant(id, "Rower " + id, "0x" + id, EquipmentType.ROWER);
  }

  @Test
  void createLobby_notifiesCreatorRefreshesListsAndRecords() {
    h = new Harness();
    h.events.connect("watcher");

    LobbySnapshot l = create("s1", "alice", 4, 2);

    assertEquals(List.of("lobby_created", "lobby_list"), h.publisher.typesFor("s1"));
    assertEquals(l, h.publisher.eventsOf("s1", LobbyCreated.class).get(0).lobby());
    assertEquals(List.of("lobby_list"), h.publisher.typesFor("watcher"));
    assertEquals(List.of("onLobbyCreated:" + l.id()), h.store.calls());
    assertEquals(Set.of("s1"), h.events.roomMembers(l.id()));
  }

  @Test
  void createLobby_appliesConfiguredDefaults() {
    h = new Harness();

    LobbySnapshot l = h.coordinator.createLobby(null, new LobbyTerms("a", 2000, null, null, null, null));

    assertEquals(10, l.maxParticipants());
    assertEquals(2, l.minParticipants());
    assertTrue(h.events.roomMembers(l.id()).isEmpty());
  }

  @Test
  void joinLobby_updatesRoomAndRecordsCount() {
    h = new Harness();
    LobbySnapshot l = create("s1", "alice", 4, 2);
    h.publisher.clear();

    LobbySnapshot joined = h.coordinator.joinLobby("s2", l.id(), entrant("bob"));

    assertEquals(1, joined.participantCount());
    assertEquals("0xbob", joined.participants().get(0).walletAddress());
    assertEquals(List.of("lobby_updated", "lobby_list"), h.publisher.typesFor("s1"));
    assertEquals(List.of("lobby_updated", "lobby_list"), h.publisher.typesFor("s2"));
    assertTrue(h.store.calls().contains("onLobbyStatusChanged:" + l.id() + ":WAITING:1"));
  }

  @Test
  void joinLobby_withoutParticipantId_isRejected() {
    h = new Harness();
    LobbySnapshot l = create("s1", "alice", 4, 2);

    assertThrows(
        IllegalArgumentException.class,
        () -> h.coordinator.joinLobby("s1", l.id(), new Entrant(" ", "x", null, null)));
    assertThrows(NoSuchElementException.class, () -> h.coordinator.joinLobby("s1", "nope", entrant("a")));
  }

  @Test
  void setReady_unknownLobby_isNotFound() {
    h = new Harness();

    assertThrows(NoSuchElementException.class, () -> h.coordinator.setReady("nope", "a"));
  }

  @Test
  void identify_filtersLaterLobbyLists() {
    h = new Harness();
    create(null, "bob", 4, 2);
    LobbySnapshot mine = create(null, "alice", 4, 2);

    List<LobbySnapshot> visible = h.coordinator.identify("s1", "alice");

    assertEquals(List.of(mine.id()), visible.stream().map(LobbySnapshot::id).toList());
    List<LobbyList> pushed = h.publisher.eventsOf("s1", LobbyList.class);
    assertEquals(List.of(mine.id()), pushed.get(pushed.size() - 1).lobbies().stream().map(LobbySnapshot::id).toList());
    assertEquals(2, h.coordinator.listLobbies(null, null).size());
  }

  @Test
  void leaveLobby_dropsSessionFromRoom() {
    h = new Harness();
    LobbySnapshot l = create("s1", "alice", 4, 2);
    h.coordinator.joinLobby("s2", l.id(), entrant("bob"));

    LobbySnapshot after = h.coordinator.leaveLobby("s2", l.id(), "bob");

    assertEquals(0, after.participantCount());
    assertEquals(Set.of("s1"), h.events.roomMembers(l.id()));
    assertThrows(NoSuchElementException.class, () -> h.coordinator.leaveLobby("s2", "nope", "bob"));
  }

  @Test
  void disconnect_keepsRosterAndRejoinCatchesUp() {
    h = new Harness();
    LobbySnapshot l = create("s1", "alice", 2, 2);
    h.coordinator.joinLobby("s1", l.id(), entrant("alice"));
    h.coordinator.setReady(l.id(), "alice");
    h.coordinator.addBot(l.id(), BotDifficulty.EASY);
    RaceSnapshot pending = h.coordinator.startRace(l.id());
    Harness.await(() -> h.engine.find(pending.id()).orElseThrow().status() == RaceStatus.RACING);

    h.coordinator.disconnected("s1");
    assertTrue(h.events.roomMembers(l.id()).isEmpty());
    h.clock.advance(Duration.ofSeconds(30));
    h.engine.tick(pending.id());
    assertEquals(2, h.coordinator.getLobby(l.id()).participantCount());

    Rejoined r = h.coordinator.rejoin("s1-again", l.id());

    assertEquals(LobbyStatus.IN_PROGRESS, r.lobby().status());
    assertNotNull(r.race());
    assertEquals(RaceStatus.RACING, r.race().status());
    assertEquals(99.0, r.race().participants().stream().filter(p -> p.bot()).findFirst().orElseThrow().distance(), 1e-9);
    assertEquals(List.of("lobby_updated", "race_update"), h.publisher.typesFor("s1-again"));
    assertTrue(h.events.roomMembers(l.id()).contains("s1-again"));
  }

  @Test
  void rejoin_waitingLobbyHasNoRace() {
    h = new Harness();
    LobbySnapshot l = create(null, "alice", 4, 2);

    Rejoined r = h.coordinator.rejoin("s9", l.id());

    assertEquals(l.id(), r.lobby().id());
    assertNull(r.race());
    assertEquals(List.of("lobby_updated"), h.publisher.typesFor("s9"));
    assertThrows(NoSuchElementException.class, () -> h.coordinator.rejoin("s9", "nope"));
  }

  @Test
  void fullRace_overBothTransportsPaths() {
    h = new Harness();
    LobbySnapshot l = create("s1", "alice", 2, 2);
    h.coordinator.joinLobby("s1", l.id(), entrant("alice"));
    h.coordinator.setReady(l.id(), "alice");
    String bot = h.coordinator.addBot(l.id(), BotDifficulty.EASY).bot().id();
    RaceSnapshot pending = h.coordinator.startRace(l.id());
    assertEquals(LobbyStatus.IN_PROGRESS, h.coordinator.getLobby(l.id()).status());
    Harness.await(() -> h.coordinator.getRace(pending.id()).status() == RaceStatus.RACING);

    h.clock.advance(Duration.ofSeconds(120));
    h.coordinator.reportMetrics(pending.id(), "alice", 500, 120, 200);
    h.clock.advance(Duration.ofSeconds(40));
    h.engine.tick(pending.id());

    RaceSnapshot done = h.coordinator.getRace(pending.id());
    assertEquals(RaceStatus.COMPLETED, done.status());
    assertEquals(1, done.participant("alice").orElseThrow().position());
    assertEquals(2, done.participant(bot).orElseThrow().position());
    assertEquals(1, h.publisher.eventsOf("s1", RaceCompleted.class).size());
    assertEquals(LobbyStatus.COMPLETED, h.coordinator.getLobby(l.id()).status());
    assertTrue(h.store.calls().contains("onLobbyStatusChanged:" + l.id() + ":IN_PROGRESS:2"));
  }

  @Test
  void cancelLobby_abortsItsRace() {
    h = new Harness(true, 60_000);
    LobbySnapshot l = create("s1", "alice", 2, 2);
    h.coordinator.addBot(l.id(), BotDifficulty.HARD);
    h.coordinator.addBot(l.id(), BotDifficulty.ELITE);
    RaceSnapshot pending = h.coordinator.startRace(l.id());

    assertThrows(IllegalStateException.class, () -> h.coordinator.cancelLobby(l.id(), "mallory"));
    assertEquals(RaceStatus.PENDING, h.coordinator.getRace(pending.id()).status());
    LobbySnapshot cancelled = h.coordinator.cancelLobby(l.id(), "alice");

    assertEquals(LobbyStatus.CANCELLED, cancelled.status());
    assertEquals(RaceStatus.ABORTED, h.coordinator.getRace(pending.id()).status());
    assertTrue(h.coordinator.listLobbies(null, null).isEmpty());
  }

  @Test
  void cancelLobby_onceRaceCompleted_isRejectedAndLobbyCompletes() {
    h = new Harness();
    LobbySnapshot l = create("s1", "alice", 2, 2);
    h.coordinator.joinLobby("s1", l.id(), entrant("alice"));
    h.coordinator.setReady(l.id(), "alice");
    h.coordinator.addBot(l.id(), BotDifficulty.EASY);
    RaceSnapshot race = h.coordinator.startRace(l.id());
    Harness.await(() -> h.coordinator.getRace(race.id()).status() == RaceStatus.RACING);

    // the creator cancels as soon as the finished race is announced, before its lobby closes
    List<IllegalStateException> rejected = new CopyOnWriteArrayList<>();
    h.publisher.onSend((sid, e) -> {
      if (e instanceof RaceUpdate u && u.race().status() == RaceStatus.COMPLETED) {
        rejected.add(assertThrows(
            IllegalStateException.class, () -> h.coordinator.cancelLobby(l.id(), "alice")));
      }
    });
    h.clock.advance(Duration.ofSeconds(120));
    h.coordinator.reportMetrics(race.id(), "alice", 500, 120, 200);
    h.clock.advance(Duration.ofSeconds(40));
    h.engine.tick(race.id());

    assertEquals(1, rejected.size());
    assertEquals("Race already completed", rejected.get(0).getMessage());
    assertEquals(RaceStatus.COMPLETED, h.coordinator.getRace(race.id()).status());
    LobbySnapshot lobby = h.coordinator.getLobby(l.id());
    assertEquals(LobbyStatus.COMPLETED, lobby.status());
    assertEquals(2, lobby.raceResults().size());
    assertEquals(1, h.publisher.eventsOf("s1", RaceCompleted.class).size());
    assertTrue(h.store.calls().contains("onLobbyCompleted:" + l.id()));
    assertTrue(h.store.calls().stream().noneMatch(c -> c.endsWith(":CANCELLED:2")));
  }

  @Test
  void getRace_unknown_isNotFound() {
    h = new Harness();

    assertThrows(NoSuchElementException.class, () -> h.coordinator.getRace("nope"));
    assertThrows(NoSuchElementException.class, () -> h.coordinator.getLobby("nope"));
  }

  @Test
  void recoverWaitingLobbies_restoresStoredLobbies() {
    h = new Harness();
    h.store.waiting(
        new LobbyRecord("kept", "alice", 1000, "0", PayoutMode.TOP_THREE, LobbyStatus.WAITING,
            8, 2, Instant.parse("2024-12-31T09:00:00Z")));

    h.coordinator.recoverWaitingLobbies();

    assertEquals(PayoutMode.TOP_THREE, h.coordinator.getLobby("kept").payoutMode());
    assertEquals(1, h.coordinator.status().lobbies());
  }

  @Test
  void status_countsLobbiesRacesAndSessions() {
    h = new Harness();
    create("s1", "alice", 4, 2);
    h.coordinator.subscribed("s2");

    RaceCoordinator.ServerStatus s = h.coordinator.status();

    assertEquals(1, s.lobbies());
    assertEquals(0, s.races());
    assertEquals(2, s.sessions());
    assertEquals(List.of("lobby_list"), h.publisher.typesFor("s2"));
  }
}
