package banstore.micrometer;

import banstore.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code banstore.failed_login.reported} - failed logins reported for valid addresses</li>
 *   <li>{@code banstore.ban.applied} - bans applied or reopened</li>
 *   <li>{@code banstore.delta.added} - additions confirmed by a committed reconciliation</li>
 *   <li>{@code banstore.delta.removed} - removals confirmed by a committed reconciliation</li>
 *   <li>{@code banstore.reconcile.committed} - committed reconciliations</li>
 *   <li>{@code banstore.reconcile.rolled_back} - declined, abandoned or failed reconciliations</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code banstore.reconcile.batch.size} - deltas per committed reconciliation</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter failedLoginsReported;
  private final Counter bansApplied;
  private final Counter deltasAdded;
  private final Counter deltasRemoved;
  private final Counter reconcileCommitted;
  private final Counter reconcileRolledBack;
  private final DistributionSummary reconcileBatchSize;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "banstore"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "banstore");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several stores in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "ssh.banstore"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.failedLoginsReported = Counter.builder(namePrefix + ".failed_login.reported")
        .description("Failed logins reported for valid addresses")
        .register(registry);
    this.bansApplied = Counter.builder(namePrefix + ".ban.applied")
        .description("Bans applied or reopened")
        .register(registry);
    this.deltasAdded = Counter.builder(namePrefix + ".delta.added")
        .description("Additions confirmed by committed reconciliations")
        .register(registry);
    this.deltasRemoved = Counter.builder(namePrefix + ".delta.removed")
        .description("Removals confirmed by committed reconciliations")
        .register(registry);
    this.reconcileCommitted = Counter.builder(namePrefix + ".reconcile.committed")
        .description("Committed reconciliations")
        .register(registry);
    this.reconcileRolledBack = Counter.builder(namePrefix + ".reconcile.rolled_back")
        .description("Reconciliations declined, abandoned or failed")
        .register(registry);
    this.reconcileBatchSize = DistributionSummary.builder(namePrefix + ".reconcile.batch.size")
        .description("Deltas per committed reconciliation")
        .register(registry);
  }

  @Override
  public void incrementFailedLoginsReported(int amount) {
    if (closed || amount <= 0) return;
    failedLoginsReported.increment(amount);
  }

  @Override
  public void incrementBansApplied(int count) {
    if (closed || count <= 0) return;
    bansApplied.increment(count);
  }

  @Override
  public void recordDeltasCommitted(int added, int removed) {
    if (closed) return;
    if (added > 0) deltasAdded.increment(added);
    if (removed > 0) deltasRemoved.increment(removed);
    reconcileBatchSize.record(Math.max(added, 0) + Math.max(removed, 0));
  }

  @Override
  public void incrementReconcileCommitted() {
    if (closed) return;
    reconcileCommitted.increment();
  }

  @Override
  public void incrementReconcileRolledBack() {
    if (closed) return;
    reconcileRolledBack.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry. Later calls are
   * ignored.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(failedLoginsReported, bansApplied, deltasAdded, deltasRemoved,
        reconcileCommitted, reconcileRolledBack, reconcileBatchSize)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
