package banstore.model;

import java.util.Objects;

/**
 * Inclusive range of addresses of one family.
 *
 * <p>Accepted textual forms for {@link #parse(String)}:
 * <ul>
 *   <li>{@code 10.0.0.1} (single address)</li>
 *   <li>{@code 10.0.0.1-10.0.0.50}</li>
 *   <li>{@code 10.0.0.0/24}, {@code 2001:db8::/32} (CIDR)</li>
 * </ul>
 */
public record AddressRange(IpAddress begin, IpAddress end) {

  public AddressRange {
    Objects.requireNonNull(begin, "begin");
    Objects.requireNonNull(end, "end");
    if (begin.length() != end.length()) {
      throw new IllegalArgumentException("Range mixes address families: " + begin + " - " + end);
    }
    if (begin.compareTo(end) > 0) {
      throw new IllegalArgumentException("Range begin is after end: " + begin + " - " + end);
    }
  }

  public static AddressRange of(String begin, String end) {
    return new AddressRange(IpAddress.parse(begin), IpAddress.parse(end));
  }

  public static AddressRange single(IpAddress address) {
    return new AddressRange(address, address);
  }

  /**
   * Parses a single address, a {@code begin-end} pair or CIDR notation.
   *
   * @throws IllegalArgumentException if the text is not a valid range
   */
  public static AddressRange parse(String text) {
    Objects.requireNonNull(text, "text");
    String s = text.trim();
    int slash = s.indexOf('/');
    if (slash >= 0) {
      return cidr(IpAddress.parse(s.substring(0, slash)), parsePrefix(s.substring(slash + 1), text));
    }
    int dash = s.indexOf('-');
    if (dash >= 0) {
      return of(s.substring(0, dash), s.substring(dash + 1));
    }
    return single(IpAddress.parse(s));
  }

  /** Whether {@code address} lies in this range. Addresses of the other family never do. */
  public boolean contains(IpAddress address) {
    return address.length() == begin.length()
        && begin.compareTo(address) <= 0
        && address.compareTo(end) <= 0;
  }

  @Override
  public String toString() {
    return begin.text() + "-" + end.text();
  }

  private static AddressRange cidr(IpAddress network, int prefixLength) {
    int bits = network.length() * 8;
    if (prefixLength < 0 || prefixLength > bits) {
      throw new IllegalArgumentException(
          "Invalid prefix length (must be 0-" + bits + "): " + prefixLength);
    }
    byte[] low = network.toBytes();
    byte[] high = network.toBytes();
    for (int i = 0; i < low.length; i++) {
      int keep = Math.max(0, Math.min(8, prefixLength - i * 8));
      int mask = keep == 0 ? 0 : (0xff << (8 - keep)) & 0xff;
      low[i] = (byte) (low[i] & mask);
      high[i] = (byte) (high[i] | ~mask);
    }
    return new AddressRange(IpAddress.fromBytes(low), IpAddress.fromBytes(high));
  }

  private static int parsePrefix(String prefix, String text) {
    try {
      return Integer.parseInt(prefix.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid prefix length in CIDR: " + text, e);
    }
  }
}
