package io.cronstore.core.database;

import java.io.IOException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronstore.client.config.Config;
import io.cronstore.client.config.ConfigFactory;
import io.cronstore.spi.CronSerializationException;

/**
 * Converts documents from and to the JSON text stored in document columns.
 */
class ConfigMapper
{
    private final ObjectMapper jsonTreeMapper;
    private final ConfigFactory cf;

    public ConfigMapper(ConfigFactory cf)
    {
        this.jsonTreeMapper = new ObjectMapper();
        this.cf = cf;
    }

    public Config fromText(String text)
    {
        if (text == null) {
            throw new CronSerializationException("Stored document is null", null);
        }
        JsonNode node;
        try {
            node = jsonTreeMapper.readTree(text);
        }
        catch (IOException ex) {
            throw new CronSerializationException("Stored document is not valid JSON", ex);
        }
        if (node == null || !node.isObject()) {
            throw new CronSerializationException("Stored document must be a JSON object but got " +
                    (node == null ? "nothing" : node.getNodeType()), null);
        }
        return cf.create(node);
    }

    public String toText(Config config)
    {
        try {
            return jsonTreeMapper.writeValueAsString(config);
        }
        catch (JsonProcessingException | RuntimeException ex) {
            throw new CronSerializationException("Failed to serialize document", ex);
        }
    }
}
