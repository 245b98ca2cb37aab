package io.cronstore.core.database.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@code CREATE TABLE IF NOT EXISTS} statement with column types of
 * the target database.
 */
public class CreateTableBuilder
{
    private final boolean postgres;
    private final String name;
    private final List<String> columns = new ArrayList<>();

    CreateTableBuilder(boolean postgres, String name)
    {
        this.postgres = postgres;
        this.name = name;
    }

    public CreateTableBuilder add(String column, String typeAndOptions)
    {
        columns.add(column + " " + typeAndOptions);
        return this;
    }

    public CreateTableBuilder addLongId(String column)
    {
        if (postgres) {
            return add(column, "bigserial primary key");
        }
        else {
            return add(column, "bigint generated by default as identity primary key");
        }
    }

    public CreateTableBuilder addString(String column, String options)
    {
        if (postgres) {
            return add(column, "text " + options);
        }
        else {
            return add(column, "varchar " + options);
        }
    }

    public CreateTableBuilder addJson(String column, String options)
    {
        if (postgres) {
            return add(column, "jsonb " + options);
        }
        else {
            return add(column, "text " + options);
        }
    }

    public CreateTableBuilder addTimestamp(String column, String options)
    {
        if (postgres) {
            return add(column, "timestamp with time zone " + options);
        }
        else {
            return add(column, "timestamp " + options);
        }
    }

    public String build()
    {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE IF NOT EXISTS " + name + " (\n");
        for (int i=0; i < columns.size(); i++) {
            sb.append("  ");
            sb.append(columns.get(i).trim());
            if (i + 1 < columns.size()) {
                sb.append(",\n");
            } else {
                sb.append("\n");
            }
        }
        sb.append(")");
        return sb.toString();
    }
}
