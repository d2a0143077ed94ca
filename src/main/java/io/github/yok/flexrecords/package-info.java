/**
 * Root package of FlexRecords, a loader that writes interrelated records into relational databases
 * while resolving references between them.
 *
 * <p>
 * {@link io.github.yok.flexrecords.Main} is the command-line entry point.
 * </p>
 */
package io.github.yok.flexrecords;
