package com.ergrace.domain;

import java.time.Instant;

/** Roster entry of a lobby. Only {@link #status()} changes after construction. */
public class LobbyParticipant {
  private final String id;
  private final String displayName;
  private final String walletAddress;
  private final EquipmentType equipmentType;
  private final boolean bot;
  private final BotDifficulty botDifficulty;
  private final Instant joinedAt;

  private ParticipantStatus status;

  public LobbyParticipant(
      String id,
      String displayName,
      String walletAddress,
      EquipmentType equipmentType,
      ParticipantStatus status,
      boolean bot,
      BotDifficulty botDifficulty,
      Instant joinedAt) {
    this.id = id;
    this.displayName = displayName;
    this.walletAddress = walletAddress == null ? "" : walletAddress;
    this.equipmentType = equipmentType == null ? EquipmentType.ROWER : equipmentType;
    this.status = status;
    this.bot = bot;
    this.botDifficulty = bot ? botDifficulty : null;
    this.joinedAt = joinedAt;
  }

  public static LobbyParticipant human(
      String id, String displayName, String walletAddress, EquipmentType equipment, Instant now) {
    return new LobbyParticipant(
        id, displayName, walletAddress, equipment, ParticipantStatus.DEPOSITED, false, null, now);
  }

  public static LobbyParticipant bot(
      String id, String displayName, EquipmentType equipment, BotDifficulty d, Instant now) {
    return new LobbyParticipant(id, displayName, "", equipment, ParticipantStatus.READY, true, d, now);
  }

  public String id() {
    return id;
  }

  public String displayName() {
    return displayName;
  }

  public String walletAddress() {
    return walletAddress;
  }

  public EquipmentType equipmentType() {
    return equipmentType;
  }

  public boolean bot() {
    return bot;
  }

  public BotDifficulty botDifficulty() {
    return botDifficulty;
  }

  public Instant joinedAt() {
    return joinedAt;
  }

  public ParticipantStatus status() {
    return status;
  }

  public void status(ParticipantStatus s) {
    status = s;
  }

  public boolean readyOrBot() {
    return bot || status == ParticipantStatus.READY;
  }

  public LobbyParticipantSnapshot snapshot() {
    return new LobbyParticipantSnapshot(
        id, displayName, walletAddress, equipmentType, status, bot, botDifficulty, joinedAt);
  }
}
