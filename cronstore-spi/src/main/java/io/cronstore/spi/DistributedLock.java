package io.cronstore.spi;

import java.time.Duration;

public interface DistributedLock
{
    /**
     * Tries to take the lock named {@code key}.
     *
     * A lock is never released once taken. {@code ttl} is accepted for callers that
     * pass one but it doesn't expire the lock; use a key unique to each attempt
     * (a job name plus its scheduled time, for example).
     *
     * @return true if this call took the lock, false if it was taken before
     */
    boolean lock(String key, Duration ttl);
}
