package com.hold.api.jobs;

import com.hold.application.expiry.MppTimeoutSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically fails incomplete multi-part payments that stopped receiving parts.
 */
@Component
public class MppTimeoutJob {

  private static final Logger log = LoggerFactory.getLogger(MppTimeoutJob.class);

  private final MppTimeoutSweeper sweeper;

  public MppTimeoutJob(MppTimeoutSweeper sweeper) {
    this.sweeper = sweeper;
  }

  @Scheduled(fixedDelayString = "${hold.mpp.sweep-interval-ms:1000}")
  public void tick() {
    try {
      sweeper.sweep();
    } catch (RuntimeException e) {
      log.error("MPP timeout sweep failed", e);
    }
  }
}
