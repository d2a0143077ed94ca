/**
 * Storage boundary package.
 *
 * <p>
 * Holds the {@link io.github.yok.flexrecords.db.QueryRunner} capability the engine writes through,
 * its JDBC implementation, and the database dialects that differ in identifier quoting and
 * replace/upsert syntax.
 * </p>
 */
package io.github.yok.flexrecords.db;
