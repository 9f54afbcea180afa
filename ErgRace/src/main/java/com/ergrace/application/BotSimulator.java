package com.ergrace.application;

import com.ergrace.domain.BotDifficulty;
import com.ergrace.domain.RaceParticipant;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Progress model for server-side bot racers.
 *
 * <p>A bot's distance is its profile speed, jittered by up to 10% either way, times the elapsed
 * race time. The jitter can make a later sample shorter than an earlier one, so the result is
 * clamped to never fall below the prior distance and never exceed the target. Pace and watts are
 * jittered independently and are for display only.
 */
@Component
public class BotSimulator {
  private static final double SPEED_JITTER = 0.2;

  private final Random random;

  public BotSimulator(Random random) {
    this.random = random;
  }

  public record BotStep(double distance, double pace, int watts) {}

  /**
   * Compute the next sample for a bot.
   *
   * @param difficulty profile to simulate; null is simulated as {@link BotDifficulty#MEDIUM}
   * @param priorDistance distance already covered
   * @param targetDistance race distance in meters
   * @param elapsedSeconds seconds since the race started
   */
  public BotStep step(
      BotDifficulty difficulty, double priorDistance, int targetDistance, double elapsedSeconds) {
    BotDifficulty d = difficulty == null ? BotDifficulty.MEDIUM : difficulty;

    double variance = (random.nextDouble() - 0.5) * SPEED_JITTER;
    double speed = d.speedMetersPerSecond() * (1 + variance);
    double candidate = Math.min(Math.max(0, elapsedSeconds) * speed, targetDistance);
    double distance = Math.max(priorDistance, candidate);

    double pace = d.averagePace() + (random.nextDouble() - 0.5) * d.paceVariance();
    int watts = (int) Math.round(d.averageWatts() + (random.nextDouble() - 0.5) * d.wattsVariance());
    return new BotStep(distance, pace, watts);
  }

  /** Apply one step to a bot participant. Caller holds the race lock. */
  public void advance(RaceParticipant bot, int targetDistance, double elapsedSeconds) {
    BotStep s = step(bot.botDifficulty(), bot.distance(), targetDistance, elapsedSeconds);
    bot.distance(s.distance());
    bot.pace(s.pace());
    bot.watts(s.watts());
  }
}
