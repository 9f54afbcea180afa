package com.ergrace.domain;

/** Live race state of one competitor, copied from the lobby roster when the race spawns. */
public class RaceParticipant {
  private final String id;
  private final String displayName;
  private final String walletAddress;
  private final EquipmentType equipmentType;
  private final boolean bot;
  private final BotDifficulty botDifficulty;

  private double distance;
  private double pace;
  private double watts;
  private boolean finished;
  private Long finishTime;
  private Integer position;

  public RaceParticipant(LobbyParticipant p) {
    this.id = p.id();
    this.displayName = p.displayName();
    this.walletAddress = p.walletAddress();
    this.equipmentType = p.equipmentType();
    this.bot = p.bot();
    this.botDifficulty = p.botDifficulty();
  }

  public String id() {
    return id;
  }

  public String displayName() {
    return displayName;
  }

  public boolean bot() {
    return bot;
  }

  public BotDifficulty botDifficulty() {
    return botDifficulty;
  }

  public double distance() {
    return distance;
  }

  /** Never moves backwards. */
  public void distance(double d) {
    distance = Math.max(distance, d);
  }

  public double pace() {
    return pace;
  }

  public void pace(double p) {
    pace = p;
  }

  public double watts() {
    return watts;
  }

  public void watts(double w) {
    watts = w;
  }

  public boolean finished() {
    return finished;
  }

  public Long finishTime() {
    return finishTime;
  }

  public Integer position() {
    return position;
  }

  /** One-way transition; the distance is pinned to the target. */
  public void finish(int targetDistance, long finishTimeMs, int finishPosition) {
    if (finished) {
      return;
    }
    finished = true;
    distance = targetDistance;
    finishTime = finishTimeMs;
    position = finishPosition;
  }

  public RaceParticipantSnapshot snapshot() {
    return new RaceParticipantSnapshot(
        id,
        displayName,
        walletAddress,
        equipmentType,
        bot,
        botDifficulty,
        distance,
        pace,
        watts,
        finished,
        finishTime,
        position);
  }
}
