package io.cronstore.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.InjectableValues;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import io.cronstore.client.api.JacksonTimeModule;
import io.cronstore.client.config.ConfigFactory;

public final class CronStoreJson
{
    private CronStoreJson()
    { }

    public static ObjectMapper objectMapper()
    {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new GuavaModule());
        mapper.registerModule(new JacksonTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        // InjectableValues makes @JacksonInject work which is used at io.cronstore.client.config.Config
        InjectableValues.Std injects = new InjectableValues.Std();
        injects.addValue(ObjectMapper.class, mapper);
        mapper.setInjectableValues(injects);

        return mapper;
    }

    public static ConfigFactory configFactory()
    {
        return new ConfigFactory(objectMapper());
    }
}
