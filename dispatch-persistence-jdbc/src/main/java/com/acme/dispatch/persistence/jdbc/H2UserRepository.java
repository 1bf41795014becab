package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific implementation of UserRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2UserRepository extends JdbcUserRepository {

  public H2UserRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO users (user_id, name, email, age, metadata, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE users
        SET name = ?, email = ?, age = ?, metadata = ?, updated_at = ?
        WHERE user_id = ?
        """;
  }
}
