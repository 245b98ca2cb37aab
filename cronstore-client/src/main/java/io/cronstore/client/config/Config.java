package io.cronstore.client.config;

import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static java.util.Locale.ENGLISH;

/**
 * A mutable JSON object with typed accessors.
 *
 * Used for both connection settings and job definitions. Job definitions are
 * opaque to the store except for the {@code disabled} flag.
 */
public class Config
{
    protected final ObjectMapper mapper;
    protected final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    protected Config(Config config)
    {
        this.mapper = config.mapper;
        this.object = config.object.deepCopy();
    }

    // JsonNode instead of ObjectNode works around https://github.com/FasterXML/jackson-databind/issues/941
    @JsonCreator
    public static Config deserializeFromJackson(@JacksonInject ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new RuntimeJsonMappingException("Expected object but got " + object.getNodeType());
        }
        return new Config(mapper, object);
    }

    @JsonValue
    public ObjectNode getInternalObjectNode()
    {
        return object;
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            remove(key);
        }
        else {
            object.set(key, writeObject(v));
        }
        return this;
    }

    public Config setOptional(String key, Optional<?> v)
    {
        if (v.isPresent()) {
            set(key, v.get());
        }
        return this;
    }

    public Config setNested(String key, Config v)
    {
        object.set(key, v.object);
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public Config deepCopy()
    {
        return new Config(this);
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean isEmpty()
    {
        return object.size() == 0;
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    public <E> E get(String key, Class<E> type)
    {
        return readObject(type, getRequiredNode(key), key);
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readObject(type, value, key);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        return Optional.fromNullable(get(key, type, null));
    }

    @SuppressWarnings("unchecked")
    public <K, V> Map<K, V> getMapOrEmpty(String key, Class<K> keyType, Class<V> valueType)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return ImmutableMap.of();
        }
        JavaType type = mapper.getTypeFactory().constructMapType(Map.class, keyType, valueType);
        return (Map<K, V>) readObject(type, value, key);
    }

    public Config getNested(String key)
    {
        JsonNode value = getRequiredNode(key);
        if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, value);
    }

    public Config getNestedOrGetEmpty(String key)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return new Config(mapper);
        }
        else if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, value);
    }

    private JsonNode getRequiredNode(String key)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        else if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return value;
    }

    private JsonNode writeObject(Object obj)
    {
        if (obj instanceof Config) {
            return ((Config) obj).object.deepCopy();
        }
        try {
            return mapper.valueToTree(obj);
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException("Value of type " + obj.getClass().getName() + " can't be converted to JSON", ex);
        }
    }

    private <E> E readObject(Class<E> type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(value.traverse(mapper), type);
        }
        catch (Exception ex) {
            throw convertException(ex, typeNameOf(type), value, key);
        }
    }

    private Object readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(value.traverse(mapper), type);
        }
        catch (Exception ex) {
            throw convertException(ex, type.getRawClass().getSimpleName(), value, key);
        }
    }

    private static ConfigException convertException(Exception ex, String typeName, JsonNode value, String key)
    {
        if (ex instanceof ConfigException) {
            return (ConfigException) ex;
        }
        String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                typeName, key, jsonSample(value), value.getNodeType().toString().toLowerCase(ENGLISH));
        return new ConfigException(message, ex);
    }

    private static String typeNameOf(Class<?> type)
    {
        if (type.equals(String.class)) {
            return "string type";
        }
        else if (type.equals(int.class) || type.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (type.equals(long.class) || type.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (type.equals(boolean.class) || type.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        return type.getSimpleName();
    }

    private static String jsonSample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        return json.substring(0, 97) + "...";
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
