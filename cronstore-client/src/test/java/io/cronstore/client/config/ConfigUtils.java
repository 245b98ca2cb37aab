package io.cronstore.client.config;

import static io.cronstore.client.CronStoreJson.objectMapper;

public class ConfigUtils
{
    private ConfigUtils()
    { }

    public static final ConfigFactory configFactory = new ConfigFactory(objectMapper());

    public static Config newConfig()
    {
        return configFactory.create();
    }
}
