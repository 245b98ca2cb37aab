package io.cronstore.spi;

public class CronQueryException
        extends CronStoreException
{
    public CronQueryException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
