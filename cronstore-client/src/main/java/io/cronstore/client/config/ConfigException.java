package io.cronstore.client.config;

/**
 * Thrown when settings or job definitions carry a missing, null or mistyped value.
 */
public class ConfigException
        extends RuntimeException
{
    public ConfigException(String message)
    {
        super(message);
    }

    public ConfigException(Throwable cause)
    {
        super(cause);
    }

    public ConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
