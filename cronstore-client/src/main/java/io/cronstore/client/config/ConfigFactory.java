package io.cronstore.client.config;

import java.io.IOException;
import java.util.Locale;
import javax.inject.Inject;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    public Config create(Object other)
    {
        return create().set("_", other).getNested("_");
    }

    public Config fromJsonString(String json)
    {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
        if (node == null || !node.isObject()) {
            throw new ConfigException("Expected a JSON object but got " + (node == null ? "empty text" : node.getNodeType().toString().toLowerCase(Locale.ENGLISH)));
        }
        return new Config(objectMapper, node);
    }
}
