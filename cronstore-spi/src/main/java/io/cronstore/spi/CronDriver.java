package io.cronstore.spi;

import io.cronstore.client.config.Config;

public interface CronDriver
{
    String getType();

    /**
     * Builds a connection from the given settings. The returned connection is not opened yet.
     */
    CronConnection connection(Config settings);
}
