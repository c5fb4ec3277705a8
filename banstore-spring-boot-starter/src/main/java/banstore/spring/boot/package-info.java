/**
 * Spring Boot auto-configuration for the ban store.
 *
 * <p>Properties live under {@code banstore.*}; see {@link banstore.spring.boot.BanStoreProperties}.
 */
package banstore.spring.boot;
