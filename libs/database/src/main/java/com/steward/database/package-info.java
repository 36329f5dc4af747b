/**
 * Relational persistence for Steward access control.
 *
 * <ul>
 *   <li>{@link com.steward.database.AccessStoreProperties}: externalized {@code steward.access.*}
 *       configuration
 *   <li>{@link com.steward.database.AccessControlConfiguration}: Spring {@code @Configuration}
 *       creating the DataSource, the Flyway instance and the engines
 *   <li>{@link com.steward.database.jdbc}: JDBC implementations of the grant, entity and
 *       transaction seams
 * </ul>
 *
 * <p>The schema lives in {@code db/migration/steward}.
 */
package com.steward.database;
