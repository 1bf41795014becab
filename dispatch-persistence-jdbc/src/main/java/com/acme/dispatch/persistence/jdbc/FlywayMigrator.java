package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the Flyway scripts of the configured dialect when the context starts, before any
 * repository is used.
 */
@Context
@Requires(property = "db.dialect")
public class FlywayMigrator {

  private static final Logger LOG = LoggerFactory.getLogger(FlywayMigrator.class);

  static final String H2 = "H2";
  static final String POSTGRESQL = "PostgreSQL";

  private final DataSource dataSource;
  private final String dialect;

  public FlywayMigrator(DataSource dataSource, @Value("${db.dialect}") String dialect) {
    this.dataSource = dataSource;
    this.dialect = dialect;
  }

  @PostConstruct
  void migrate() {
    String location = locationFor(dialect);
    MigrateResult result =
        Flyway.configure().dataSource(dataSource).locations(location).load().migrate();
    LOG.info(
        "Applied {} migration(s) from {} (schema version {})",
        result.migrationsExecuted,
        location,
        result.targetSchemaVersion);
  }

  static String locationFor(String dialect) {
    if (H2.equalsIgnoreCase(dialect)) {
      return "classpath:db/migration/h2";
    }
    if (POSTGRESQL.equalsIgnoreCase(dialect)) {
      return "classpath:db/migration/postgres";
    }
    throw new IllegalStateException("Unsupported db.dialect: " + dialect);
  }
}
