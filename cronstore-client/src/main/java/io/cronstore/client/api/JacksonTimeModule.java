package io.cronstore.client.api;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Writes {@link Instant} as UTC ISO-8601 text with millisecond precision and reads
 * any ISO-8601 date-time that carries an offset.
 */
public class JacksonTimeModule
    extends SimpleModule
{
    public JacksonTimeModule()
    {
        super();
        addSerializer(Instant.class, new InstantSerializer());
        addDeserializer(Instant.class, new InstantDeserializer());
    }

    public static class InstantSerializer
            extends JsonSerializer<Instant>
    {
        private final DateTimeFormatter formatter;

        public InstantSerializer()
        {
            this.formatter =
                DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ENGLISH)
                .withZone(ZoneOffset.UTC);
        }

        @Override
        public void serialize(Instant value, JsonGenerator jgen, SerializerProvider provider)
                throws IOException
        {
            jgen.writeString(formatter.format(value));
        }
    }

    public static class InstantDeserializer
            extends FromStringDeserializer<Instant>
    {
        public InstantDeserializer()
        {
            super(Instant.class);
        }

        @Override
        protected Instant _deserialize(String value, DeserializationContext context)
                throws JsonMappingException
        {
            try {
                return Instant.from(DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(value));
            }
            catch (DateTimeParseException ex) {
                throw JsonMappingException.from(context, "Invalid ISO time format: " + value, ex);
            }
        }
    }
}
