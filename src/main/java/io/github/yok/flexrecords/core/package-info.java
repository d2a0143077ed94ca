/**
 * Insertion engine of FlexRecords.
 *
 * <p>
 * {@link io.github.yok.flexrecords.core.RecordInserter} resolves the references of each record,
 * checks for existing rows and writes the records in declaration order, keeping the assigned
 * identifiers in an {@link io.github.yok.flexrecords.core.IdentifierRegistry}.
 * {@link io.github.yok.flexrecords.core.ContentLoader} drives it from the command line.
 * </p>
 */
package io.github.yok.flexrecords.core;
