package com.e2eq.pgraph.spi;

/**
 * A unit of writes against the store. Closing without {@link #commit()} rolls back.
 * Beginning a write while one is already open joins it; only the outermost transaction
 * commits or rolls back. A joined transaction closed without commit marks the outermost
 * one rollback-only: its {@code commit()} then fails and nothing is written.
 */
public interface WriteTransaction extends AutoCloseable {

    /**
     * @throws com.e2eq.pgraph.exceptions.GraphStorageException if this is the outermost
     *         transaction and it was marked rollback-only
     */
    void commit();

    @Override
    void close();
}
