package io.cronstore.core.database;

import java.time.Duration;

import io.cronstore.spi.DistributedLock;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Insert-once locks. A lock row is never updated or deleted, so a key can be
 * taken only once.
 */
class DatabaseLockStoreManager
        extends BasicDatabaseStoreManager<DatabaseLockStoreManager.Dao>
        implements DistributedLock
{
    DatabaseLockStoreManager(DatabaseConfig config, Jdbi jdbi, ConfigMapper cfm, int queryTimeout)
    {
        super(config.getType(), dao(config.getType()), jdbi, cfm, queryTimeout);
    }

    private static Class<? extends Dao> dao(String type)
    {
        switch (type) {
            case "postgresql":
                return PgDao.class;
            case "h2":
                return H2Dao.class;
            default:
                throw new IllegalArgumentException("Unknown database type: " + type);
        }
    }

    @Override
    public boolean lock(String key, Duration ttl)
    {
        // ttl doesn't expire the lock. See DistributedLock.lock.
        boolean acquired = catchConflict((handle, dao) -> dao.insertLock(key) > 0, false);
        if (!acquired) {
            logger.debug("Lock {} is already taken", key);
        }
        return acquired;
    }

    interface Dao
    {
        int insertLock(String name);
    }

    interface PgDao
            extends Dao
    {
        @Override
        @SqlUpdate("insert into <locksTable>" +
                " (name, expired_at, updated_at)" +
                " values (:name, now(), now())" +
                " on conflict (name) do nothing")
        int insertLock(@Bind("name") String name);
    }

    interface H2Dao
            extends Dao
    {
        @Override
        @SqlUpdate("insert into <locksTable>" +
                " (name, expired_at, updated_at)" +
                " values (:name, now(), now())")
        int insertLock(@Bind("name") String name);
    }
}
