/**
 * Deploys trained, versioned model artifacts into rows of a relational table, so that
 * consumers can read the binary payload and its provenance with plain SQL.
 *
 * <h2>Core Design</h2>
 * <p>{@link modeldeploy.DeploymentOrchestrator} resolves the artifact, validates its flavor
 * with {@link modeldeploy.flavor.FlavorValidator}, assembles the row with
 * {@link modeldeploy.metadata.MetadataCollector}, obtains the table from
 * {@link modeldeploy.schema.SchemaRegistry} and inserts the row inside one
 * {@link modeldeploy.tx.TransactionManager} transaction. Failures surface as a single
 * {@link modeldeploy.DeploymentException} tagged with an {@link modeldeploy.ErrorKind}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>modeldeploy-core</b>: pipeline, error model, SPIs (zero external deps)</li>
 *   <li><b>modeldeploy-jdbc</b>: JDBC model stores (H2, MySQL, PostgreSQL, SQL Server)
 *       and the {@code ModelDeployments} entry point</li>
 *   <li><b>modeldeploy-mlflow</b>: MLflow manifest loader, artifact resolvers and registry client</li>
 *   <li><b>modeldeploy-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>modeldeploy-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store        = JdbcModelStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 *
 * var orchestrator = DeploymentOrchestrator.builder()
 *     .artifactResolver(new LocalArtifactResolver(Path.of("/var/models")))
 *     .manifestLoader(new MlModelManifestLoader())
 *     .schemaRegistry(new SchemaRegistry(connProvider, store))
 *     .transactionManager(new TransactionManager(connProvider))
 *     .modelStore(store)
 *     .build();
 *
 * DeployedModelRecord row = orchestrator.deploy(
 *     DeploymentRequest.builder("models:/fraud-detector/3")
 *         .principal(42)
 *         .flavor("onnx")
 *         .tableName("prod_models")
 *         .build());
 * }</pre>
 *
 * @see modeldeploy.DeploymentOrchestrator
 * @see modeldeploy.DeploymentRequest
 * @see modeldeploy.DeploymentException
 */
package modeldeploy;
