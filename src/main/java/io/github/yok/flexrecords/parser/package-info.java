/**
 * Reads content batches from JSON files with Jackson.
 */
package io.github.yok.flexrecords.parser;
