package io.cronstore.spi;

/**
 * An exception thrown when a statement is cancelled by its query timeout or
 * when a connection can't be taken from the pool in time.
 */
public class CronTimeoutException
        extends CronQueryException
{
    public CronTimeoutException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
