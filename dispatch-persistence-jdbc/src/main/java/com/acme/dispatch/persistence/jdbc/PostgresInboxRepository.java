package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresInboxRepository extends JdbcInboxRepository {

    public PostgresInboxRepository(DataSource dataSource) {
        super(dataSource);
    }

    /** A violated key would abort the surrounding transaction, so conflicts are skipped instead. */
    @Override
    protected String getRecordSql() {
        return """
                INSERT INTO inbox (message_id, handler, processed_at)
                VALUES (?, ?, ?)
                ON CONFLICT (message_id, handler) DO NOTHING
                """;
    }
}
