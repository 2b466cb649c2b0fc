package com.baskettecase.sqlgate.store;

import com.baskettecase.sqlgate.db.Technology;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Databases registered by administrators, on top of the configured servers
 */
@Slf4j
@Repository
public class DatabaseCatalogRepository {

    private final JdbcTemplate jdbcTemplate;

    public DatabaseCatalogRepository(@Qualifier("appJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<RegisteredDatabase> ROW_MAPPER = (rs, rowNum) -> new RegisteredDatabase(
        rs.getLong("id"),
        rs.getString("server_name"),
        rs.getString("database_name"),
        Technology.fromName(rs.getString("technology")),
        rs.getTimestamp("created_at").toInstant()
    );

    public List<RegisteredDatabase> findAll() {
        String sql = "SELECT * FROM databases ORDER BY server_name, database_name";
        return jdbcTemplate.query(sql, ROW_MAPPER);
    }

    public boolean exists(String serverName, String databaseName) {
        String sql = """
            SELECT COUNT(*) FROM databases
            WHERE LOWER(server_name) = LOWER(?) AND LOWER(database_name) = LOWER(?)
            """;
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, serverName, databaseName);
        return count != null && count > 0;
    }

    public RegisteredDatabase save(RegisteredDatabase database) {
        Instant createdAt = database.createdAt() != null ? database.createdAt() : Instant.now();
        String sql = """
            INSERT INTO databases (server_name, database_name, technology, created_at)
            VALUES (?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"});
            ps.setString(1, database.serverName());
            ps.setString(2, database.databaseName());
            ps.setString(3, database.technology().name());
            ps.setTimestamp(4, Timestamp.from(createdAt));
            return ps;
        }, keyHolder);

        long id = keyHolder.getKey().longValue();
        log.info("✅ Saved database registration {}/{}", database.serverName(), database.databaseName());
        return new RegisteredDatabase(id, database.serverName(), database.databaseName(),
            database.technology(), createdAt);
    }

    public void initializeTable() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS databases (
                id BIGSERIAL PRIMARY KEY,
                server_name VARCHAR(255) NOT NULL,
                database_name VARCHAR(255) NOT NULL,
                technology VARCHAR(32) NOT NULL,
                created_at TIMESTAMP NOT NULL,
                UNIQUE (server_name, database_name)
            )
            """);
    }
}
