/**
 * Content batch and reference model package.
 *
 * <p>
 * Pure value types describing what must be written: tables, records, fields, and the two kinds of
 * forward references ({@link io.github.yok.flexrecords.model.LocalReference} and
 * {@link io.github.yok.flexrecords.model.DbReference}). No I/O happens here; resolution and writing
 * are implemented in {@code core}.
 * </p>
 */
package io.github.yok.flexrecords.model;
