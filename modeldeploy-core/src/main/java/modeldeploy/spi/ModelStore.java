package modeldeploy.spi;

import modeldeploy.model.ModelRecordDraft;
import modeldeploy.schema.TableSchema;

import java.sql.Connection;
import java.time.Instant;

/**
 * Persistence backend for deployed-model rows. Implementations translate a
 * {@link TableSchema} into their database's DDL and perform the insert.
 *
 * <p>All methods use the caller's connection and never commit, roll back or close it.
 *
 * @see modeldeploy.jdbc.store.AbstractJdbcModelStore
 */
public interface ModelStore {

  /**
   * Returns {@code true} if a table with the given name exists, whatever its structure.
   */
  boolean tableExists(Connection conn, String tableName);

  /**
   * Issues the create-if-absent statement for the given schema.
   *
   * @throws java.sql.SQLException wrapped in an unchecked exception if the database rejects it
   */
  void createTable(Connection conn, TableSchema schema);

  /**
   * Inserts one row and returns the store-assigned {@code model_id}.
   *
   * @param conn           the transaction's connection
   * @param schema         target table
   * @param draft          row values
   * @param deploymentTime value for {@code model_deployment_time}
   * @return the generated model id
   */
  long insert(Connection conn, TableSchema schema, ModelRecordDraft draft, Instant deploymentTime);
}
