package io.cronstore.spi;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableStoredExecutionLog.class)
public interface StoredExecutionLog
    extends ExecutionLog
{
    long getId();

    Instant getCreatedAt();

    static ImmutableStoredExecutionLog.Builder builder()
    {
        return ImmutableStoredExecutionLog.builder();
    }
}
