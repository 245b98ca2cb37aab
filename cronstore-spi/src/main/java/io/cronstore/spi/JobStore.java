package io.cronstore.spi;

import java.util.Map;
import io.cronstore.client.config.Config;

public interface JobStore
{
    /**
     * Inserts or replaces the job definition stored under {@code name}. The
     * {@code name} field of the stored document is set to {@code name}.
     */
    void add(String name, Config job);

    /**
     * Sets {@code disabled} to false. Other fields are kept as is.
     * Nothing happens if the job doesn't exist.
     */
    void enable(String name);

    /**
     * Sets {@code disabled} to true. Other fields are kept as is.
     * Nothing happens if the job doesn't exist.
     */
    void disable(String name);

    /**
     * Deletes the job and all of its execution logs atomically.
     */
    void remove(String name);

    /**
     * Returns all jobs keyed by name. Rows that can't be decoded are skipped.
     */
    Map<String, Config> list();
}
