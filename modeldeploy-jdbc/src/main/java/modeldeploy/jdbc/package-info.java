/**
 * JDBC wiring for the deployment pipeline.
 *
 * <p>{@link modeldeploy.jdbc.ModelDeployments} is the entry point. Connections come from a
 * {@link modeldeploy.jdbc.DataSourceConnectionProvider} (pooled) or a
 * {@link modeldeploy.jdbc.DriverManagerConnectionProvider} built from a
 * {@link modeldeploy.jdbc.DatabaseUri}; the dialect store is picked by
 * {@link modeldeploy.jdbc.store.JdbcModelStores}.
 */
package modeldeploy.jdbc;
