package io.github.yok.flexrecords.core;

/**
 * Kinds of failures reported by {@link RecordInsertException}.
 *
 * <ul>
 * <li>UNRESOLVED_LOCAL_REFERENCE: a local reference points at a record that is not registered.
 * Inside {@link RecordInserter#insert} this is recovered: the field becomes {@code null} and a
 * {@link ResolutionDiagnostic} is recorded.</li>
 * <li>REFERENCE_NOT_FOUND: a database reference used as a field value matched no row.</li>
 * <li>REFERENCE_LOOKUP_FAILED: the lookup of a reference or an existing-record check failed in
 * the store.</li>
 * <li>WRITE_FAILED: an insert, update, replace or delete statement failed.</li>
 * <li>DUPLICATE_LOCAL_ID: a record would register a different identifier for a (table, local id)
 * pair that is already registered; detected before anything is written.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ErrorKind {
    UNRESOLVED_LOCAL_REFERENCE,
    REFERENCE_NOT_FOUND,
    REFERENCE_LOOKUP_FAILED,
    WRITE_FAILED,
    DUPLICATE_LOCAL_ID
}
