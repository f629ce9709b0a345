/**
 * MLflow collaborators for the deployment pipeline.
 *
 * <ul>
 *   <li>{@link modeldeploy.mlflow.MlModelManifestLoader} reads {@code MLmodel} files.</li>
 *   <li>{@link modeldeploy.mlflow.LocalArtifactResolver} serves artifacts from a local directory.</li>
 *   <li>{@link modeldeploy.mlflow.MlflowRegistryClient} fetches version metadata over REST and
 *       backs {@link modeldeploy.mlflow.RegistryArtifactResolver}.</li>
 * </ul>
 */
package modeldeploy.mlflow;
