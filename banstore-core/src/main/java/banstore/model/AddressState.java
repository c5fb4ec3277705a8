package banstore.model;

/**
 * Lifecycle state of an address row. Codes are the persisted column values.
 *
 * <pre>
 *   (absent) ──ban──▶ ADD_PENDING ──reconcile──▶ ACTIVE
 *   FAILED_LOGIN ──ban──▶ ADD_PENDING
 *   ACTIVE / ADD_PENDING ──expiry sweep──▶ REMOVE_PENDING ──reconcile──▶ (deleted)
 *   ACTIVE / ADD_PENDING ──expiry sweep──▶ REMOVE_PENDING_BECOME_FAILED_LOGIN ──reconcile──▶ FAILED_LOGIN
 * </pre>
 */
public enum AddressState {
  /** Ban currently enforced by the firewall. */
  ACTIVE(0),
  /** Ban recorded, not yet applied to the firewall. */
  ADD_PENDING(1),
  /** Ban lifted, awaiting removal from the firewall; the row is deleted afterwards. */
  REMOVE_PENDING(2),
  /** No ban; accumulating failed logins. */
  FAILED_LOGIN(3),
  /**
   * Ban lifted, awaiting removal from the firewall; the row then returns to
   * {@link #FAILED_LOGIN} so escalating ban durations can see the prior offense.
   */
  REMOVE_PENDING_BECOME_FAILED_LOGIN(4);

  private final int code;

  AddressState(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Whether the reconciler reports this state as a pending firewall change. */
  public boolean isPending() {
    return this == ADD_PENDING || this == REMOVE_PENDING || this == REMOVE_PENDING_BECOME_FAILED_LOGIN;
  }

  public static AddressState fromCode(int code) {
    for (AddressState state : values()) {
      if (state.code == code) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown address state code: " + code);
  }
}
