/**
 * Configuration model package for FlexRecords.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: connection settings,
 * the data path, and loader settings. Execution logic is implemented in {@code core} and
 * {@code db}.
 * </p>
 */
package io.github.yok.flexrecords.config;
