package io.github.yok.flexrecords.core;

import lombok.Getter;

/**
 * Signals the first failure of an insert call or an auxiliary reference operation.
 *
 * <p>
 * Everything written before the failure stays written; the identifiers registered so far can be
 * read from {@link RecordInserter#getRegistry()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RecordInsertException extends Exception {

    private static final long serialVersionUID = 1L;

    // What went wrong
    private final ErrorKind kind;

    // Table of the failing record or reference
    private final String table;

    // Local id of the failing record, or the rendered reference
    private final String identifier;

    /**
     * Creates an exception without a cause.
     *
     * @param kind failure kind
     * @param table table name
     * @param identifier local id or rendered reference
     * @param message detail message
     */
    public RecordInsertException(ErrorKind kind, String table, String identifier, String message) {
        this(kind, table, identifier, message, null);
    }

    /**
     * Creates an exception.
     *
     * @param kind failure kind
     * @param table table name
     * @param identifier local id or rendered reference
     * @param message detail message
     * @param cause underlying failure, typically a {@link java.sql.SQLException}
     */
    public RecordInsertException(ErrorKind kind, String table, String identifier, String message,
            Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
        this.table = table;
        this.identifier = identifier;
    }
}
