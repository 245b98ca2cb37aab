package io.cronstore.core.database.schema;

import io.cronstore.core.database.CronTables;

public class SchemaContext
{
    private final boolean postgres;
    private final CronTables tables;

    public SchemaContext(boolean postgres, CronTables tables)
    {
        this.postgres = postgres;
        this.tables = tables;
    }

    public boolean isPostgres()
    {
        return postgres;
    }

    public CronTables getTables()
    {
        return tables;
    }

    public CreateTableBuilder newCreateTableBuilder(String quotedTableName)
    {
        return new CreateTableBuilder(postgres, quotedTableName);
    }

    public String createSchemaSql()
    {
        return "CREATE SCHEMA IF NOT EXISTS " + tables.quotedSchema();
    }

    public String createIndexSql(String indexName, String quotedTableName, String columns)
    {
        // postgresql creates an index in the schema of its table and rejects a qualified name.
        // h2 takes the current schema unless the name is qualified.
        String name = postgres
            ? CronTables.quoteIdentifier(indexName)
            : tables.qualify(indexName);
        return "CREATE INDEX IF NOT EXISTS " + name + " ON " + quotedTableName + " (" + columns + ")";
    }
}
