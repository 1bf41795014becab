package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2 keeps the transaction usable after a key violation, so the plain insert is enough. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2InboxRepository extends JdbcInboxRepository {

  public H2InboxRepository(DataSource dataSource) {
    super(dataSource);
  }
}
