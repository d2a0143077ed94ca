/**
 * Small shared helpers: fatal error reporting, JDBC driver loading, JSON bind values, and log path
 * rendering.
 */
package io.github.yok.flexrecords.util;
