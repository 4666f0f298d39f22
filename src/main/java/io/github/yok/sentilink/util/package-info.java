/**
 * Utility package for SentiLink.
 *
 * <p>
 * Provides CSV helpers, JDBC value conversions and fatal error reporting for the command-line
 * layer.
 * </p>
 */
package io.github.yok.sentilink.util;
