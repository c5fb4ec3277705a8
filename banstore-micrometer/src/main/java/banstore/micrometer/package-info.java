/**
 * Micrometer bridge for exporting ban store counters.
 *
 * <p>{@link banstore.micrometer.MicrometerMetricsExporter} implements the
 * {@link banstore.spi.MetricsExporter} SPI with Micrometer counters and a batch size summary.
 */
package banstore.micrometer;
