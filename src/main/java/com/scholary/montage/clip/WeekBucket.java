package com.scholary.montage.clip;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.stereotype.Component;

/**
 * Resolves the weekly window clips and montages belong to.
 *
 * <p>A week bucket is keyed by the date of its closing Sunday. On a Sunday the current bucket is
 * the following Sunday, so a week never closes on the day it is computed.
 */
@Component
public class WeekBucket {

  private final Clock clock;
  private final ZoneId zone;

  public WeekBucket(Clock clock, ZoneId montageZone) {
    this.clock = clock;
    this.zone = montageZone;
  }

  /** The week bucket for the current instant. */
  public LocalDate current() {
    return weekEndingFor(LocalDate.now(clock.withZone(zone)));
  }

  /** Last instant of the given bucket in the configured zone. */
  public Instant closesAt(LocalDate weekEnding) {
    return weekEnding.atTime(LocalTime.MAX).atZone(zone).toInstant();
  }

  public static LocalDate weekEndingFor(LocalDate day) {
    int daysUntilSunday = 7 - (day.getDayOfWeek().getValue() % 7);
    return day.plusDays(daysUntilSunday);
  }
}
