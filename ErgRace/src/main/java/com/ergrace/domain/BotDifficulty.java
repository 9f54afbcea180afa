package com.ergrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

/**
 * Simulation profile of a bot racer.
 *
 * <p>Pace is seconds per 500m, watts is instantaneous power, speed is the base meters per second
 * the simulator jitters around.
 */
public enum BotDifficulty {
  @JsonProperty("easy")
  EASY(150, 10, 120, 20, 3.3),
  @JsonProperty("medium")
  MEDIUM(120, 8, 180, 25, 4.2),
  @JsonProperty("hard")
  HARD(100, 5, 250, 30, 5.0),
  @JsonProperty("elite")
  ELITE(90, 3, 320, 35, 5.6);

  private final double averagePace;
  private final double paceVariance;
  private final double averageWatts;
  private final double wattsVariance;
  private final double speedMetersPerSecond;

  BotDifficulty(
      double averagePace,
      double paceVariance,
      double averageWatts,
      double wattsVariance,
      double speedMetersPerSecond) {
    this.averagePace = averagePace;
    this.paceVariance = paceVariance;
    this.averageWatts = averageWatts;
    this.wattsVariance = wattsVariance;
    this.speedMetersPerSecond = speedMetersPerSecond;
  }

  public double averagePace() {
    return averagePace;
  }

  public double paceVariance() {
    return paceVariance;
  }

  public double averageWatts() {
    return averageWatts;
  }

  public double wattsVariance() {
    return wattsVariance;
  }

  public double speedMetersPerSecond() {
    return speedMetersPerSecond;
  }

  /** Lower-case label used in bot display names. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
