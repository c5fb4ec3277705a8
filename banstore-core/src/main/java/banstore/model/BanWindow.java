package banstore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Ban start and end, both at millisecond resolution. The end may lie in the past.
 */
public record BanWindow(Instant start, Instant end) {
  public BanWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }
}
