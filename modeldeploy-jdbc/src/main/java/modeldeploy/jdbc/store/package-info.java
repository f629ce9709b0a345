/**
 * Dialect-specific {@link modeldeploy.spi.ModelStore} implementations and their
 * {@link java.util.ServiceLoader} registry.
 *
 * @see modeldeploy.jdbc.store.JdbcModelStores
 */
package modeldeploy.jdbc.store;
