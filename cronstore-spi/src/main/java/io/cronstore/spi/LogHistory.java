package io.cronstore.spi;

import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableLogHistory.class)
public interface LogHistory
{
    /**
     * Number of all logs of the job regardless of offset and limit.
     */
    long getTotal();

    List<StoredExecutionLog> getLogs();

    static ImmutableLogHistory.Builder builder()
    {
        return ImmutableLogHistory.builder();
    }

    static LogHistory empty()
    {
        return builder()
            .total(0)
            .logs(ImmutableList.of())
            .build();
    }
}
