package com.example.poscore.config;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfigureBefore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Starts a PostgreSQL instance owned by the application when
 * {@code app.db.embedded=true}, so a single till can run without an external
 * database server. Liquibase runs against it afterwards.
 */
@Configuration
@AutoConfigureBefore(LiquibaseAutoConfiguration.class)
@ConditionalOnProperty(prefix = "app.db", name = "embedded", havingValue = "true")
public class PostgresEmbeddedConfig {

    private static final Logger log = LoggerFactory.getLogger(PostgresEmbeddedConfig.class);
    private static final String POSTGRES_USER = "postgres";
    private static final String POSTGRES_DB = "postgres";

    @Value("${app.db.data-dir:data/pg}")
    private String dataDir;

    @Value("${app.db.persist:true}")
    private boolean persist;

    @Value("${app.db.port:0}")
    private int port;

    @Bean(destroyMethod = "close")
    public EmbeddedPostgres embeddedPostgres() throws IOException {
        Path dir = Paths.get(dataDir).toAbsolutePath();
        Files.createDirectories(dir);
        log.info("Embedded Postgres data directory: {} (persist={})", dir, persist);

        EmbeddedPostgres.Builder builder = EmbeddedPostgres.builder()
                .setDataDirectory(dir)
                .setCleanDataDirectory(!persist)
                .setPGStartupWait(Duration.ofSeconds(60))
                .setServerConfig("max_connections", "20")
                .setServerConfig("log_min_messages", "warning");
        if (port > 0) {
            builder.setPort(port);
        }
        EmbeddedPostgres pg = builder.start();
        log.info("Embedded Postgres started on port {}", pg.getPort());
        return pg;
    }

    @Bean
    public DataSource dataSource(EmbeddedPostgres pg) {
        String url = pg.getJdbcUrl(POSTGRES_USER, POSTGRES_DB);
        return new SimpleDriverDataSource(new org.postgresql.Driver(), url, POSTGRES_USER, "");
    }
}
