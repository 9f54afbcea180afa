package com.ergrace.infrastructure;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Threads, time and randomness of the coordinator core. */
@Configuration
public class CoordinatorConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Random random() {
    return new SecureRandom();
  }

  /** Countdowns and tick loops of every race. */
  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService raceScheduler(
      @Value("${ergrace.race.scheduler-threads:2}") int threads) {
    return Executors.newScheduledThreadPool(threads, daemon("race-timer"));
  }

  /** Single thread, so every connection sees events in production order. */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService broadcastExecutor() {
    return Executors.newSingleThreadExecutor(daemon("event-dispatch"));
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService recordExecutor() {
    return Executors.newSingleThreadExecutor(daemon("record-sync"));
  }

  private static ThreadFactory daemon(String prefix) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
