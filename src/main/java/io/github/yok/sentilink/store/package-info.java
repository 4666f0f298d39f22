/**
 * Data store package for SentiLink.
 *
 * <p>
 * Provides {@link io.github.yok.sentilink.store.DataSource} and
 * {@link io.github.yok.sentilink.store.DataSink} implementations for delimited files, JSON files
 * and JDBC databases, selected by {@link io.github.yok.sentilink.store.DataStoreFactory}.
 * </p>
 *
 * <p>
 * Database connections are opened and closed within a single load or save call.
 * </p>
 */
package io.github.yok.sentilink.store;
