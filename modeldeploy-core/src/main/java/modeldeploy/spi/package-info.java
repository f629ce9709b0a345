/**
 * Service Provider Interfaces (SPI) for plugging the deployment pipeline into its
 * surroundings.
 *
 * <p>Integrators implement these to supply database connections, artifact resolution,
 * manifest parsing, registry metadata, row persistence and metrics.
 *
 * @see modeldeploy.spi.ConnectionProvider
 * @see modeldeploy.spi.ArtifactResolver
 * @see modeldeploy.spi.ManifestLoader
 * @see modeldeploy.spi.ModelRegistry
 * @see modeldeploy.spi.ModelStore
 * @see modeldeploy.spi.MetricsExporter
 */
package modeldeploy.spi;
