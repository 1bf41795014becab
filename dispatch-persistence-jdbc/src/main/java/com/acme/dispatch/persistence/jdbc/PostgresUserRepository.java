package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of UserRepository. Metadata is stored as JSONB.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresUserRepository extends JdbcUserRepository {

    public PostgresUserRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO users (user_id, name, email, age, metadata, created_at, updated_at)
                VALUES (?, ?, ?, ?, CAST(? AS JSONB), ?, ?)
                """;
    }

    @Override
    protected String getUpdateSql() {
        return """
                UPDATE users
                SET name = ?, email = ?, age = ?, metadata = CAST(? AS JSONB), updated_at = ?
                WHERE user_id = ?
                """;
    }

    @Override
    protected String getFindByIdSql() {
        return "SELECT user_id, name, email, age, metadata::text AS metadata, created_at, updated_at"
                + " FROM users WHERE user_id = ?";
    }

    @Override
    protected String getFindByEmailSql() {
        return "SELECT user_id, name, email, age, metadata::text AS metadata, created_at, updated_at"
                + " FROM users WHERE email = ?";
    }
}
