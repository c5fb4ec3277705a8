package banstore.model;

import java.util.Objects;

/**
 * One pending firewall change produced by reconciliation.
 *
 * @param address canonical address text
 * @param added   {@code true} to add the address to the firewall, {@code false} to remove it
 */
public record AddressDelta(String address, boolean added) {
  public AddressDelta {
    Objects.requireNonNull(address, "address");
  }
}
