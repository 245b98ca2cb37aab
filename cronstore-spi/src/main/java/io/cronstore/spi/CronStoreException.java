package io.cronstore.spi;

/**
 * Base class of errors thrown by cron stores.
 */
public class CronStoreException
        extends RuntimeException
{
    public CronStoreException(String message)
    {
        super(message);
    }

    public CronStoreException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
