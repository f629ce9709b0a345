package modeldeploy.spring.boot;

import modeldeploy.DeploymentOrchestrator;
import modeldeploy.flavor.FlavorValidator;
import modeldeploy.jdbc.DataSourceConnectionProvider;
import modeldeploy.jdbc.store.AbstractJdbcModelStore;
import modeldeploy.jdbc.store.JdbcModelStores;
import modeldeploy.metadata.MetadataCollector;
import modeldeploy.mlflow.LocalArtifactResolver;
import modeldeploy.mlflow.MlModelManifestLoader;
import modeldeploy.mlflow.MlflowRegistryClient;
import modeldeploy.mlflow.RegistryArtifactResolver;
import modeldeploy.schema.SchemaRegistry;
import modeldeploy.schema.TableNames;
import modeldeploy.spi.ArtifactResolver;
import modeldeploy.spi.ConnectionProvider;
import modeldeploy.spi.ManifestLoader;
import modeldeploy.spi.MetricsExporter;
import modeldeploy.spi.ModelRegistry;
import modeldeploy.spi.ModelStore;
import modeldeploy.tx.TransactionManager;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for model deployments.
 *
 * <p>Wires a {@link DeploymentOrchestrator} to the application {@link DataSource}. Artifacts
 * come from {@code modeldeploy.artifacts.local-root} when set, otherwise from the MLflow
 * registry at {@code modeldeploy.mlflow.tracking-uri}; one of the two is required unless an
 * {@link ArtifactResolver} bean is supplied.
 *
 * @see ModelDeployProperties
 * @see ModelDeployMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(DeploymentOrchestrator.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(ModelDeployProperties.class)
public class ModelDeployAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ModelStore.class)
  public AbstractJdbcModelStore modelStore(DataSource dataSource) {
    return JdbcModelStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public SchemaRegistry schemaRegistry(ConnectionProvider connectionProvider, ModelStore modelStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return new SchemaRegistry(connectionProvider, modelStore,
        metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean
  @ConditionalOnMissingBean
  public TransactionManager modelDeployTransactionManager(ConnectionProvider connectionProvider) {
    return new TransactionManager(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean
  public FlavorValidator flavorValidator(ModelDeployProperties props) {
    return new FlavorValidator(props.getSupportedFlavors());
  }

  @Bean
  @ConditionalOnMissingBean
  public MetadataCollector metadataCollector() {
    return new MetadataCollector();
  }

  @Bean
  @ConditionalOnMissingBean(ManifestLoader.class)
  public MlModelManifestLoader manifestLoader() {
    return new MlModelManifestLoader();
  }

  @Bean
  @ConditionalOnMissingBean(ModelRegistry.class)
  @ConditionalOnProperty(prefix = "modeldeploy.mlflow", name = "tracking-uri")
  public MlflowRegistryClient mlflowRegistryClient(ModelDeployProperties props) {
    ModelDeployProperties.Mlflow mlflow = props.getMlflow();
    MlflowRegistryClient.Builder builder = MlflowRegistryClient.builder()
        .trackingUri(mlflow.getTrackingUri())
        .token(mlflow.getToken())
        .requestTimeout(mlflow.getRequestTimeout());
    if (mlflow.getUsername() != null) {
      builder.basicAuth(mlflow.getUsername(), mlflow.getPassword());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ArtifactResolver artifactResolver(ModelDeployProperties props,
      ObjectProvider<MlflowRegistryClient> registryClient) {
    if (props.getArtifacts().getLocalRoot() != null) {
      return new LocalArtifactResolver(props.getArtifacts().getLocalRoot());
    }
    MlflowRegistryClient client = registryClient.getIfAvailable();
    if (client == null) {
      throw new IllegalStateException(
          "modeldeploy.artifacts.local-root or modeldeploy.mlflow.tracking-uri must be set");
    }
    return new RegistryArtifactResolver(client);
  }

  @Bean
  @ConditionalOnMissingBean
  public DeploymentOrchestrator deploymentOrchestrator(
      ArtifactResolver artifactResolver,
      ManifestLoader manifestLoader,
      FlavorValidator flavorValidator,
      MetadataCollector metadataCollector,
      SchemaRegistry schemaRegistry,
      TransactionManager transactionManager,
      ModelStore modelStore,
      ObjectProvider<ModelRegistry> registryProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return DeploymentOrchestrator.builder()
        .artifactResolver(artifactResolver)
        .manifestLoader(manifestLoader)
        .modelRegistry(registryProvider.getIfAvailable())
        .flavorValidator(flavorValidator)
        .metadataCollector(metadataCollector)
        .schemaRegistry(schemaRegistry)
        .transactionManager(transactionManager)
        .modelStore(modelStore)
        .metrics(metricsProvider.getIfAvailable())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ModelDeployer modelDeployer(DeploymentOrchestrator orchestrator, ModelDeployProperties props) {
    return new ModelDeployer(orchestrator, TableNames.validate(props.getTableName()));
  }
}
