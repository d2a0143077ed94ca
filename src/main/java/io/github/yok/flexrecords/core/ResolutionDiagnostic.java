package io.github.yok.flexrecords.core;

import io.github.yok.flexrecords.model.LocalReference;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Records a local reference that could not be resolved and was written as {@code null}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ResolutionDiagnostic {

    // Table of the record holding the reference; null outside insert
    private final String table;

    // Local id of the record holding the reference; null outside insert
    private final String localId;

    // Field path, e.g. "contextId", "settings.owner" or "tags[1]"
    private final String field;

    // The unresolved reference
    private final LocalReference reference;
}
