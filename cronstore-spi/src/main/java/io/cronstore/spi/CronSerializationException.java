package io.cronstore.spi;

public class CronSerializationException
        extends CronStoreException
{
    public CronSerializationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
