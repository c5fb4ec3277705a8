package banstore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single ban to apply in a bulk call.
 *
 * @param address address text; malformed values are skipped by the store
 * @param start   ban start
 * @param end     ban end
 */
public record BanRequest(String address, Instant start, Instant end) {
  public BanRequest {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }
}
