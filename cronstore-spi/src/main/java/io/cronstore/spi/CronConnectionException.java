package io.cronstore.spi;

/**
 * An exception thrown when a connection pool can't be created or the database
 * doesn't respond while opening a connection.
 */
public class CronConnectionException
        extends CronStoreException
{
    public CronConnectionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
