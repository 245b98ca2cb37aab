package io.cronstore.spi;

import java.time.Duration;

/**
 * A connection to a cron store.
 *
 * {@link #open()} must be called once before any other operation. Operations
 * on a connection that is not open throw {@link IllegalStateException}.
 */
public interface CronConnection
    extends CronStore, AutoCloseable
{
    /**
     * Creates the connection pool, checks that the database responds and
     * provisions the schema.
     *
     * @throws CronConnectionException if the database can't be reached
     * @throws IllegalStateException if this connection was opened before
     */
    void open();

    boolean isOpen();

    /**
     * Returns a view of this connection whose operations give up once
     * {@code timeout} elapses on a database statement. The timeout is applied
     * to each statement of an operation and rounded up to whole seconds.
     * A statement cancelled by it throws {@link CronTimeoutException}.
     *
     * The view shares the state of this connection and stops working when
     * this connection is closed.
     *
     * @throws IllegalArgumentException if {@code timeout} is zero or negative
     * @throws IllegalStateException if this connection is not open
     */
    CronStore withTimeout(Duration timeout);

    /**
     * Releases the connection pool. Does nothing if the connection is not open.
     */
    @Override
    void close();
}
