package io.cronstore.spi;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Preconditions;
import io.cronstore.client.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableExecutionLog.class)
public interface ExecutionLog
{
    String getJob();

    Config getData();

    @Value.Check
    default void check()
    {
        Preconditions.checkState(!getJob().isEmpty(), "job of an execution log must not be empty");
    }

    static ImmutableExecutionLog.Builder builder()
    {
        return ImmutableExecutionLog.builder();
    }

    static ExecutionLog of(String job, Config data)
    {
        return builder()
            .job(job)
            .data(data)
            .build();
    }
}
