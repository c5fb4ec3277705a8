package banstore.spi;

/**
 * Observability hook for exporting store counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Operations that run in a
 * caller's transaction are reported after that transaction commits.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records failed logins reported for a valid address. Reports against banned or
     * pending addresses are included even though their counter does not move.
     *
     * @param amount the increment that was requested
     */
    void incrementFailedLoginsReported(int amount);

    /**
     * Records bans newly applied or reopened by the conditional ban upsert.
     *
     * @param count number of bans applied
     */
    void incrementBansApplied(int count);

    /**
     * Records deltas confirmed by a committed reconciliation.
     *
     * @param added   additions handed to the firewall
     * @param removed removals handed to the firewall
     */
    void recordDeltasCommitted(int added, int removed);

    /**
     * Increments the count of committed reconciliations.
     */
    void incrementReconcileCommitted();

    /**
     * Increments the count of reconciliations rolled back (declined, abandoned or failed).
     */
    void incrementReconcileRolledBack();

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementFailedLoginsReported(int amount) {
        }

        @Override
        public void incrementBansApplied(int count) {
        }

        @Override
        public void recordDeltasCommitted(int added, int removed) {
        }

        @Override
        public void incrementReconcileCommitted() {
        }

        @Override
        public void incrementReconcileRolledBack() {
        }
    }
}
