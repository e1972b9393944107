package com.snowman.balance.config;

import com.snowman.balance.repository.TimestampFormat;
import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Creates {@code current_balance} and {@code past_balance} from the DDL matching the configured
 * timestamp format when they are missing. Enable with {@code BALANCE_DB_BOOTSTRAP_ENABLED=true}.
 */
@Component
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    private final DataSource dataSource;
    private final TimestampFormat timestampFormat;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource,
                             BalanceProperties properties,
                             @Value("${balance.db.bootstrap-enabled:false}") boolean enabled) {
        this.dataSource = dataSource;
        this.timestampFormat = properties.store().timestampFormat();
        this.enabled = enabled;
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (balance.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (balanceTableExists(conn)) {
                log.info("DB bootstrap skipped: schema already present (current_balance table exists)");
                return;
            }
            String resource = timestampFormat.schemaResource();
            log.warn("DB bootstrap starting: applying {} ({} timestamps)", resource, timestampFormat);
            int applied = 0;
            for (String stmt : splitStatements(loadSql(resource))) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (SQLException ex) {
            throw new IllegalStateException("DB bootstrap failed", ex);
        }
    }

    private boolean balanceTableExists(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "select 1 from information_schema.tables where table_name = 'current_balance' and table_schema = current_schema()")) {
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private String loadSql(String resource) {
        ClassPathResource res = new ClassPathResource(resource);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + resource, ex);
        }
    }

    static List<String> splitStatements(String sql) {
        // DDL files hold no procedural blocks
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(stmt -> !stmt.isEmpty())
                .toList();
    }
}
