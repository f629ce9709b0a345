/**
 * Spring Boot auto-configuration for model deployments.
 *
 * <p>Adding this starter to a Spring Boot application with a {@link javax.sql.DataSource}
 * provides a {@link modeldeploy.DeploymentOrchestrator} and a {@link ModelDeployer} bound to
 * {@code modeldeploy.*} properties. A Micrometer exporter is registered when a
 * {@code MeterRegistry} is available.
 *
 * @see modeldeploy.spring.boot.ModelDeployProperties
 */
package modeldeploy.spring.boot;
