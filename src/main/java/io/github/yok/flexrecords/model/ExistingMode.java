package io.github.yok.flexrecords.model;

/**
 * What the engine does when existing-record matching finds a row.
 *
 * <ul>
 * <li>INSERT_ONLY - leave the row as it is and reuse its identifier</li>
 * <li>UPDATE - update all supplied columns of the row</li>
 * <li>REPLACE - overwrite the row with the supplied columns plus its identifier</li>
 * </ul>
 *
 * <p>
 * When no row is found a new one is always inserted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ExistingMode {
    // Insert when missing, otherwise keep the existing row
    INSERT_ONLY,
    // Insert when missing, otherwise UPDATE ... WHERE id = ?
    UPDATE,
    // Insert when missing, otherwise a dialect specific replace/upsert keyed by id
    REPLACE
}
