/**
 * Scoped JDBC transactions for the deployment insert.
 *
 * @see modeldeploy.tx.TransactionManager
 */
package modeldeploy.tx;
