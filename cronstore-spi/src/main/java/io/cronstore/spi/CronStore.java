package io.cronstore.spi;

/**
 * Job registry, execution log and lock operations of a cron store.
 */
public interface CronStore
    extends JobStore, ExecutionLogStore, DistributedLock
{
}
