package com.ergrace.infrastructure;

import com.ergrace.application.port.RaceRecordStore;
import com.ergrace.domain.LobbyRecord;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.LobbyStatus;
import com.ergrace.domain.PayoutMode;
import com.ergrace.domain.ProfileUpdate;
import com.ergrace.domain.RaceParticipantSnapshot;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.domain.UserProfile;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.sqlite.SQLiteConfig;

/**
 * Record store backed by a local SQLite file.
 *
 * <p>One connection, opened at startup and guarded by a monitor; every statement is
 * parameterized. Failures are rethrown unchecked and left to the caller, which treats the store
 * as best effort. Enum columns hold the constant name, timestamps ISO-8601 text.
 */
@Service
@ConditionalOnProperty(name = "ergrace.store.enabled", havingValue = "true")
public class SqliteRaceRecordStore implements RaceRecordStore {
  private static final Logger log = LoggerFactory.getLogger(SqliteRaceRecordStore.class);

  private static final String[] SCHEMA = {
    "CREATE TABLE IF NOT EXISTS lobbies ("
        + " id TEXT PRIMARY KEY, creator_id TEXT NOT NULL, race_distance INTEGER NOT NULL,"
        + " entry_fee TEXT NOT NULL, payout_mode TEXT NOT NULL, status TEXT NOT NULL,"
        + " max_participants INTEGER NOT NULL, min_participants INTEGER NOT NULL,"
        + " participant_count INTEGER NOT NULL, created_at TEXT NOT NULL,"
        + " completed_at TEXT, race_id TEXT)",
    "CREATE TABLE IF NOT EXISTS races ("
        + " id TEXT PRIMARY KEY, lobby_id TEXT NOT NULL, target_distance INTEGER NOT NULL,"
        + " status TEXT NOT NULL, start_time TEXT, completed_at TEXT NOT NULL,"
        + " finished_count INTEGER NOT NULL)",
    "CREATE TABLE IF NOT EXISTS race_results ("
        + " race_id TEXT NOT NULL, participant_id TEXT NOT NULL, display_name TEXT,"
        + " wallet_address TEXT, equipment_type TEXT, position INTEGER, finish_time INTEGER,"
        + " distance REAL NOT NULL, pace REAL NOT NULL, watts REAL NOT NULL,"
        + " is_bot INTEGER NOT NULL, is_finished INTEGER NOT NULL,"
        + " PRIMARY KEY (race_id, participant_id))",
    "CREATE TABLE IF NOT EXISTS users ("
        + " id TEXT PRIMARY KEY, display_name TEXT, email TEXT, wallet_address TEXT,"
        + " skill_rating INTEGER NOT NULL, total_races INTEGER NOT NULL,"
        + " total_wins INTEGER NOT NULL, total_earnings TEXT NOT NULL,"
        + " created_at TEXT NOT NULL, last_active TEXT NOT NULL)"
  };

  private static final String SQL_INSERT_LOBBY =
      "INSERT OR REPLACE INTO lobbies (id, creator_id, race_distance, entry_fee, payout_mode,"
          + " status, max_participants, min_participants, participant_count, created_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  private static final String SQL_LOBBY_STATUS =
      "UPDATE lobbies SET status = ?, participant_count = ? WHERE id = ?";
  private static final String SQL_LOBBY_COMPLETED =
      "UPDATE lobbies SET status = ?, race_id = ?, completed_at = ? WHERE id = ?";
  private static final String SQL_WAITING_LOBBIES =
      "SELECT id, creator_id, race_distance, entry_fee, payout_mode, max_participants,"
          + " min_participants, created_at FROM lobbies WHERE status = ? ORDER BY created_at";
  private static final String SQL_INSERT_RACE =
      "INSERT OR REPLACE INTO races (id, lobby_id, target_distance, status, start_time,"
          + " completed_at, finished_count) VALUES (?, ?, ?, ?, ?, ?, ?)";
  private static final String SQL_INSERT_RESULT =
      "INSERT OR REPLACE INTO race_results (race_id, participant_id, display_name,"
          + " wallet_address, equipment_type, position, finish_time, distance, pace, watts,"
          + " is_bot, is_finished) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  private static final String SQL_COUNT_RACE =
      "INSERT INTO users (id, display_name, skill_rating, total_races, total_wins,"
          + " total_earnings, created_at, last_active) VALUES (?, ?, ?, 1, ?, '0', ?, ?)"
          + " ON CONFLICT(id) DO UPDATE SET total_races = total_races + 1,"
          + " total_wins = total_wins + excluded.total_wins, last_active = excluded.last_active";
  private static final String SQL_UPSERT_PROFILE =
      "INSERT INTO users (id, display_name, email, wallet_address, skill_rating, total_races,"
          + " total_wins, total_earnings, created_at, last_active)"
          + " VALUES (?, COALESCE(?, 'Rower'), ?, ?, ?, 0, 0, '0', ?, ?)"
          + " ON CONFLICT(id) DO UPDATE SET display_name = COALESCE(?, display_name),"
          + " email = COALESCE(excluded.email, email),"
          + " wallet_address = COALESCE(excluded.wallet_address, wallet_address),"
          + " last_active = excluded.last_active";
  private static final String SQL_USER =
      "SELECT id, display_name, email, wallet_address, skill_rating, total_races, total_wins,"
          + " total_earnings, created_at, last_active FROM users WHERE id = ?";

  private final String jdbcUrl;
  private final Clock clock;
  private final Object lock = new Object();

  private Connection conn;

  public SqliteRaceRecordStore(
      @Value("${ergrace.store.jdbc-url:jdbc:sqlite:ergrace.db}") String jdbcUrl, Clock clock) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "ergrace.store.jdbc-url");
    this.clock = clock;
  }

  /**
   * Open the database, creating the file and its tables when missing.
   *
   * @throws Exception if the connection or the schema cannot be set up
   */
  @PostConstruct
  public void load() throws Exception {
    try {
      if (jdbcUrl.startsWith("jdbc:sqlite:")) {
        String path = jdbcUrl.substring("jdbc:sqlite:".length());
        if (!path.isEmpty() && !path.startsWith(":")) {
          Path parent = Path.of(path).toAbsolutePath().normalize().getParent();
          if (parent != null) Files.createDirectories(parent);
        }
      }

      SQLiteConfig cfg = new SQLiteConfig();
      cfg.enforceForeignKeys(false);

      synchronized (lock) {
        conn = DriverManager.getConnection(jdbcUrl, cfg.toProperties());
        conn.setAutoCommit(true);
        try (Statement s = conn.createStatement()) {
          s.execute("PRAGMA busy_timeout=3000");
          s.execute("PRAGMA journal_mode=WAL");
          s.execute("PRAGMA synchronous=NORMAL");
          for (String ddl : SCHEMA) s.execute(ddl);
        }
      }
      log.info("Record store ready at {}", jdbcUrl);
    } catch (Exception e) {
      close();
      throw e;
    }
  }

  @PreDestroy
  public void close() {
    synchronized (lock) {
      try {
        if (conn != null) conn.close();
      } catch (SQLException e) {
        log.debug("Closing record store failed: {}", e.getMessage());
      }
      conn = null;
    }
  }

  @Override
  public void onLobbyCreated(LobbySnapshot lobby) {
    update("onLobbyCreated", SQL_INSERT_LOBBY, ps -> {
      ps.setString(1, lobby.id());
      ps.setString(2, lobby.creatorId());
      ps.setInt(3, lobby.raceDistance());
      ps.setString(4, lobby.entryFee());
      ps.setString(5, lobby.payoutMode().name());
      ps.setString(6, lobby.status().name());
      ps.setInt(7, lobby.maxParticipants());
      ps.setInt(8, lobby.minParticipants());
      ps.setInt(9, lobby.participantCount());
      ps.setString(10, lobby.createdAt().toString());
    });
  }

  @Override
  public void onLobbyStatusChanged(String lobbyId, LobbyStatus status, int participantCount) {
    update("onLobbyStatusChanged", SQL_LOBBY_STATUS, ps -> {
      ps.setString(1, status.name());
      ps.setInt(2, participantCount);
      ps.setString(3, lobbyId);
    });
  }

  @Override
  public void onLobbyCompleted(LobbySnapshot lobby) {
    update("onLobbyCompleted", SQL_LOBBY_COMPLETED, ps -> {
      ps.setString(1, LobbyStatus.COMPLETED.name());
      ps.setString(2, lobby.raceId());
      ps.setString(3, clock.instant().toString());
      ps.setString(4, lobby.id());
    });
  }

  /** The race row and one result row per participant, in one transaction. */
  @Override
  public void onRaceCompleted(RaceSnapshot race) {
    synchronized (lock) {
      Connection c = open();
      try {
        c.setAutoCommit(false);
        try (PreparedStatement ps = c.prepareStatement(SQL_INSERT_RACE)) {
          ps.setString(1, race.id());
          ps.setString(2, race.lobbyId());
          ps.setInt(3, race.targetDistance());
          ps.setString(4, race.status().name());
          ps.setString(5, race.startTime() == null ? null : race.startTime().toString());
          ps.setString(6, clock.instant().toString());
          ps.setInt(7, race.finishedCount());
          ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement(SQL_INSERT_RESULT)) {
          for (RaceParticipantSnapshot p : race.participants()) {
            ps.setString(1, race.id());
            ps.setString(2, p.id());
            ps.setString(3, p.displayName());
            ps.setString(4, p.walletAddress());
            ps.setString(5, p.equipmentType().name());
            setNullableInt(ps, 6, p.position());
            if (p.finishTime() == null) ps.setNull(7, Types.INTEGER);
            else ps.setLong(7, p.finishTime());
            ps.setDouble(8, p.distance());
            ps.setDouble(9, p.pace());
            ps.setDouble(10, p.watts());
            ps.setInt(11, p.bot() ? 1 : 0);
            ps.setInt(12, p.finished() ? 1 : 0);
            ps.addBatch();
          }
          ps.executeBatch();
        }
        c.commit();
      } catch (SQLException e) {
        rollback(c);
        throw failure("onRaceCompleted", e);
      } finally {
        autoCommit(c);
      }
    }
    log.debug("Race {} recorded with {} results", race.id(), race.participants().size());
  }

  @Override
  public void onUserStatsShouldUpdate(RaceSnapshot race) {
    String now = clock.instant().toString();
    for (RaceParticipantSnapshot p : race.participants()) {
      if (p.bot()) continue;
      boolean won = p.position() != null && p.position() == 1;
      update("onUserStatsShouldUpdate", SQL_COUNT_RACE, ps -> {
        ps.setString(1, p.id());
        ps.setString(2, p.displayName());
        ps.setInt(3, UserProfile.DEFAULT_SKILL_RATING);
        ps.setInt(4, won ? 1 : 0);
        ps.setString(5, now);
        ps.setString(6, now);
      });
    }
  }

  @Override
  public Optional<UserProfile> fetchUserProfile(String userId) {
    synchronized (lock) {
      try (PreparedStatement ps = open().prepareStatement(SQL_USER)) {
        ps.setString(1, userId);
        try (ResultSet rs = ps.executeQuery()) {
          if (!rs.next()) return Optional.empty();
          return Optional.of(
              new UserProfile(
                  rs.getString(1),
                  rs.getString(2),
                  rs.getString(3),
                  rs.getString(4),
                  rs.getInt(5),
                  rs.getInt(6),
                  rs.getInt(7),
                  rs.getString(8),
                  Instant.parse(rs.getString(9)),
                  Instant.parse(rs.getString(10))));
        }
      } catch (SQLException e) {
        throw failure("fetchUserProfile", e);
      }
    }
  }

  /** Create the profile with default stats, or merge the given fields into it. */
  @Override
  public Optional<UserProfile> saveUserProfile(String userId, ProfileUpdate data) {
    String now = clock.instant().toString();
    String displayName = blankToNull(data.displayName());
    update("saveUserProfile", SQL_UPSERT_PROFILE, ps -> {
      ps.setString(1, userId);
      ps.setString(2, displayName);
      ps.setString(3, blankToNull(data.email()));
      ps.setString(4, blankToNull(data.walletAddress()));
      ps.setInt(5, UserProfile.DEFAULT_SKILL_RATING);
      ps.setString(6, now);
      ps.setString(7, now);
      ps.setString(8, displayName);
    });
    return fetchUserProfile(userId);
  }

  @Override
  public List<LobbyRecord> loadWaitingLobbies() {
    synchronized (lock) {
      try (PreparedStatement ps = open().prepareStatement(SQL_WAITING_LOBBIES)) {
        ps.setString(1, LobbyStatus.WAITING.name());
        List<LobbyRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            out.add(
                new LobbyRecord(
                    rs.getString(1),
                    rs.getString(2),
                    rs.getInt(3),
                    rs.getString(4),
                    PayoutMode.valueOf(rs.getString(5)),
                    LobbyStatus.WAITING,
                    rs.getInt(6),
                    rs.getInt(7),
                    Instant.parse(rs.getString(8))));
          }
        }
        return out;
      } catch (SQLException e) {
        throw failure("loadWaitingLobbies", e);
      }
    }
  }

  // Helpers

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  private void update(String op, String sql, Binder binder) {
    synchronized (lock) {
      try (PreparedStatement ps = open().prepareStatement(sql)) {
        binder.bind(ps);
        ps.executeUpdate();
      } catch (SQLException e) {
        throw failure(op, e);
      }
    }
  }

  /** Caller holds the lock. */
  private Connection open() {
    if (conn == null) throw new IllegalStateException("Record store is closed");
    return conn;
  }

  private static void setNullableInt(PreparedStatement ps, int idx, Integer v) throws SQLException {
    if (v == null) ps.setNull(idx, Types.INTEGER);
    else ps.setInt(idx, v);
  }

  private static void rollback(Connection c) {
    try {
      c.rollback();
    } catch (SQLException e) {
      log.debug("Rollback failed: {}", e.getMessage());
    }
  }

  private static void autoCommit(Connection c) {
    try {
      c.setAutoCommit(true);
    } catch (SQLException e) {
      log.debug("Restoring auto-commit failed: {}", e.getMessage());
    }
  }

  private static IllegalStateException failure(String op, SQLException e) {
    return new IllegalStateException(op + " failed: " + e.getMessage(), e);
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }
}
