package io.cronstore.core.database;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.cronstore.core.database.DatabaseTestingUtils.createConfigFactory;
import static org.junit.Assert.assertEquals;

public class JdbiHelperTest
{
    private DataSourceProvider dsp;
    private DatabaseConfig config;

    @Before
    public void setUp()
    {
        config = DatabaseConfig.convertFrom(createConfigFactory().create(), "h2");
        dsp = new DataSourceProvider(config);
    }

    @After
    public void destroy()
    {
        dsp.close();
    }

    @Test
    public void h2HandlesCanBeOpened()
    {
        Jdbi jdbi = JdbiHelper.createJdbi(dsp.get(), config);
        try (Handle handle = jdbi.open()) {
            int one = handle.createQuery("select 1")
                .mapTo(Integer.class)
                .one();
            assertEquals(1, one);
        }
    }

    @Test
    public void tableNamesAreDefined()
    {
        Jdbi jdbi = JdbiHelper.createJdbi(dsp.get(), config);
        try (Handle handle = jdbi.open()) {
            handle.execute("create schema if not exists \"public\"");
            handle.execute("create table <jobsTable> (name varchar primary key)");
            handle.execute("insert into <jobsTable> (name) values ('backup')");
            String name = handle.createQuery("select name from \"public\".\"cron_jobs\"")
                .mapTo(String.class)
                .one();
            assertEquals("backup", name);
        }
    }
}
