/**
 * Service Provider Interfaces (SPI) for extending the ban store.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in transaction management, connection provisioning, persistence, and metrics.
 *
 * @see banstore.spi.TxContext
 * @see banstore.spi.ConnectionProvider
 * @see banstore.spi.AddressStore
 * @see banstore.spi.MetricsExporter
 */
package banstore.spi;
