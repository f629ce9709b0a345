/**
 * Value types flowing through a deployment: model references, manifests, registry
 * metadata, row drafts and committed rows.
 */
package modeldeploy.model;
