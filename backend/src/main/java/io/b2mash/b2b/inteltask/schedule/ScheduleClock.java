package io.b2mash.b2b.inteltask.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/** Converts persisted instants to and from the configured scheduling zone. */
@Component
@EnableConfigurationProperties(TaskSchedulerProperties.class)
public class ScheduleClock {

  private final ZoneId zone;

  public ScheduleClock(TaskSchedulerProperties properties) {
    this.zone = ZoneId.of(properties.zoneId());
  }

  public ZoneId zone() {
    return zone;
  }

  public ZonedDateTime at(Instant instant) {
    return instant.atZone(zone);
  }

  public Instant now() {
    return Instant.now();
  }
}
