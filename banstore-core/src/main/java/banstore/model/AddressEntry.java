package banstore.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of one persisted address row.
 *
 * @param address          binary key and canonical text
 * @param lastFailedLogin  time of the last counted failed login
 * @param failedLoginCount failures since the last ban or reset
 * @param banStartDate     ban start, {@code null} when no ban window is recorded
 * @param banEndDate       ban end, {@code null} when no ban window is recorded
 * @param state            lifecycle state
 */
public record AddressEntry(
    IpAddress address,
    Instant lastFailedLogin,
    int failedLoginCount,
    Instant banStartDate,
    Instant banEndDate,
    AddressState state
) {
  public AddressEntry {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(lastFailedLogin, "lastFailedLogin");
    Objects.requireNonNull(state, "state");
  }

  public String addressText() {
    return address.text();
  }

  public Optional<BanWindow> banWindow() {
    if (banStartDate == null || banEndDate == null) {
      return Optional.empty();
    }
    return Optional.of(new BanWindow(banStartDate, banEndDate));
  }
}
