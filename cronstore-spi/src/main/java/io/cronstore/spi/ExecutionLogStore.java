package io.cronstore.spi;

public interface ExecutionLogStore
{
    void appendLog(ExecutionLog log);

    /**
     * Returns logs of a job, newest first.
     *
     * @param offset number of logs to skip. Negative values are treated as 0.
     * @param limit maximum number of logs to return. 0 or negative means no limit.
     */
    LogHistory history(String job, long offset, long limit);
}
