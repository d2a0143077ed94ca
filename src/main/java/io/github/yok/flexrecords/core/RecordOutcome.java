package io.github.yok.flexrecords.core;

/**
 * What happened to one record of a content batch.
 *
 * @author Yasuharu.Okawauchi
 */
public enum RecordOutcome {
    // A new row was inserted
    INSERTED,
    // An existing row was updated
    UPDATED,
    // An existing row was replaced
    REPLACED,
    // An existing row was kept as it is
    KEPT
}
