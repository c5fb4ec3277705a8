package banstore.model;

import java.time.Instant;

/**
 * Selects rows for enumeration.
 *
 * <p>With neither cut-off set every row matches. Otherwise a row matches if it is in
 * {@link AddressState#FAILED_LOGIN} with a last failed login at or before
 * {@code failedLoginCutoff}, or if it is {@link AddressState#ACTIVE} or
 * {@link AddressState#ADD_PENDING} with a ban end at or before {@code banCutoff}.
 *
 * @param failedLoginCutoff optional failed-login cut-off
 * @param banCutoff         optional ban-end cut-off
 */
public record EntryFilter(Instant failedLoginCutoff, Instant banCutoff) {
  private static final EntryFilter ALL = new EntryFilter(null, null);

  public static EntryFilter all() {
    return ALL;
  }

  public static EntryFilter failedLoginsBefore(Instant cutoff) {
    return new EntryFilter(cutoff, null);
  }

  public static EntryFilter bansEndingBefore(Instant cutoff) {
    return new EntryFilter(null, cutoff);
  }

  public boolean matchesAll() {
    return failedLoginCutoff == null && banCutoff == null;
  }
}
