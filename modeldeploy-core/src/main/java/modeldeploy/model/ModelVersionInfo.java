package modeldeploy.model;

/**
 * Registry metadata of one model version.
 *
 * @param name                    registered model name
 * @param version                 registry version number
 * @param creationTimestampMillis creation time in milliseconds since the epoch, or {@code null}
 * @param description             free-text description, or {@code null}
 * @param runId                   training run that produced the version, or {@code null}
 * @param source                  artifact location recorded by the registry, or {@code null}
 */
public record ModelVersionInfo(
    String name,
    String version,
    Long creationTimestampMillis,
    String description,
    String runId,
    String source
) {}
