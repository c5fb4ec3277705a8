package banstore.model;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * An IPv4 or IPv6 address held as its fixed-width binary key (4 or 16 bytes) together
 * with its canonical display text.
 *
 * <p>Only address literals are accepted; host names are rejected and never resolved.
 * IPv4-mapped IPv6 literals ({@code ::ffff:a.b.c.d}) collapse to the IPv4 address so
 * each host has exactly one key.
 *
 * <p>Ordering is unsigned lexicographic over the key bytes, the same order the store
 * uses for scans.
 */
public final class IpAddress implements Comparable<IpAddress> {
  private static final Pattern IPV4 = Pattern.compile(
      "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}");
  private static final Pattern IPV6_CHARS = Pattern.compile("[0-9A-Fa-f:.]+");

  private final byte[] bytes;
  private final String text;

  private IpAddress(byte[] bytes) {
    this.bytes = bytes;
    this.text = bytes.length == 4 ? formatIpv4(bytes) : formatIpv6(bytes);
  }

  /**
   * Parses an address literal.
   *
   * @param value dotted-quad IPv4 or IPv6 literal, optionally in brackets
   * @return the parsed address
   * @throws IllegalArgumentException if {@code value} is not an address literal
   */
  public static IpAddress parse(String value) {
    Objects.requireNonNull(value, "value");
    String s = value.trim();
    if (s.startsWith("[") && s.endsWith("]")) {
      s = s.substring(1, s.length() - 1);
    }
    if (IPV4.matcher(s).matches()) {
      String[] parts = s.split("\\.");
      byte[] b = new byte[4];
      for (int i = 0; i < 4; i++) {
        b[i] = (byte) Integer.parseInt(parts[i]);
      }
      return new IpAddress(b);
    }
    if (s.indexOf(':') >= 0 && IPV6_CHARS.matcher(s).matches()) {
      try {
        // brackets force literal parsing, no name lookup on failure
        InetAddress inet = InetAddress.getByName("[" + s + "]");
        return new IpAddress(inet.getAddress());
      } catch (UnknownHostException e) {
        throw new IllegalArgumentException("Invalid IP address: " + value, e);
      }
    }
    throw new IllegalArgumentException("Invalid IP address: " + value);
  }

  /**
   * Parses an address literal, returning empty instead of throwing on malformed input.
   */
  public static Optional<IpAddress> tryParse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(parse(value));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /**
   * Rebuilds an address from its stored key.
   *
   * @throws IllegalArgumentException if the key is not 4 or 16 bytes long
   */
  public static IpAddress fromBytes(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length != 4 && bytes.length != 16) {
      throw new IllegalArgumentException("Address key must be 4 or 16 bytes, got " + bytes.length);
    }
    return new IpAddress(bytes.clone());
  }

  /** Returns the address as an {@link InetAddress} without any name lookup. */
  public InetAddress toInetAddress() {
    try {
      return InetAddress.getByAddress(bytes);
    } catch (UnknownHostException e) {
      // unreachable, the length was checked on construction
      throw new IllegalStateException(e);
    }
  }

  /** Creates an address from an {@link InetAddress}. */
  public static IpAddress of(InetAddress address) {
    Objects.requireNonNull(address, "address");
    return new IpAddress(address.getAddress());
  }

  /** Returns a copy of the binary key. */
  public byte[] toBytes() {
    return bytes.clone();
  }

  /** Canonical text: dotted quad for IPv4, compressed lower-case form for IPv6. */
  public String text() {
    return text;
  }

  public boolean isIpv4() {
    return bytes.length == 4;
  }

  /** Key length in bytes, 4 or 16. */
  public int length() {
    return bytes.length;
  }

  @Override
  public int compareTo(IpAddress other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IpAddress that)) return false;
    return Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return text;
  }

  private static String formatIpv4(byte[] b) {
    return (b[0] & 0xff) + "." + (b[1] & 0xff) + "." + (b[2] & 0xff) + "." + (b[3] & 0xff);
  }

  // RFC 5952: lower-case hex, no leading zeros, longest run (>= 2) of zero groups as "::"
  private static String formatIpv6(byte[] b) {
    int[] groups = new int[8];
    for (int i = 0; i < 8; i++) {
      groups[i] = ((b[i * 2] & 0xff) << 8) | (b[i * 2 + 1] & 0xff);
    }
    int bestStart = -1;
    int bestLen = 0;
    int runStart = -1;
    for (int i = 0; i <= 8; i++) {
      if (i < 8 && groups[i] == 0) {
        if (runStart < 0) runStart = i;
      } else if (runStart >= 0) {
        int len = i - runStart;
        if (len > bestLen && len >= 2) {
          bestStart = runStart;
          bestLen = len;
        }
        runStart = -1;
      }
    }
    StringBuilder sb = new StringBuilder(39);
    for (int i = 0; i < 8; i++) {
      if (i == bestStart) {
        sb.append("::");
        i += bestLen - 1;
        continue;
      }
      if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
        sb.append(':');
      }
      sb.append(Integer.toHexString(groups[i]));
    }
    return sb.toString();
  }
}
