/**
 * Spring transaction integration.
 *
 * <p>{@link banstore.spring.SpringTxContext} lets {@link banstore.BanStore} calls made inside
 * a {@code @Transactional} method or a {@code TransactionTemplate} join that transaction.
 */
package banstore.spring;
