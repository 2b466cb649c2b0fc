package com.baskettecase.sqlgate.store;

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
import java.util.Optional;

/**
 * Repository for application users
 */
@Slf4j
@Repository
public class AppUserRepository {

    private final JdbcTemplate jdbcTemplate;

    public AppUserRepository(@Qualifier("appJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<AppUser> ROW_MAPPER = (rs, rowNum) -> new AppUser(
        rs.getLong("id"),
        rs.getString("username"),
        rs.getString("email"),
        rs.getBoolean("is_admin"),
        rs.getBoolean("active"),
        rs.getTimestamp("created_at").toInstant()
    );

    public Optional<AppUser> findById(long id) {
        String sql = "SELECT * FROM app_users WHERE id = ?";
        List<AppUser> results = jdbcTemplate.query(sql, ROW_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<AppUser> findByUsername(String username) {
        String sql = "SELECT * FROM app_users WHERE LOWER(username) = LOWER(?)";
        List<AppUser> results = jdbcTemplate.query(sql, ROW_MAPPER, username);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<AppUser> findAll() {
        return jdbcTemplate.query("SELECT * FROM app_users ORDER BY username", ROW_MAPPER);
    }

    public AppUser save(AppUser user) {
        Instant createdAt = user.createdAt() != null ? user.createdAt() : Instant.now();
        String sql = """
            INSERT INTO app_users (username, email, is_admin, active, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"});
            ps.setString(1, user.username());
            ps.setString(2, user.email());
            ps.setBoolean(3, user.admin());
            ps.setBoolean(4, user.active());
            ps.setTimestamp(5, Timestamp.from(createdAt));
            return ps;
        }, keyHolder);

        long id = keyHolder.getKey().longValue();
        log.info("✅ Saved user: {} (admin: {})", user.username(), user.admin());
        return new AppUser(id, user.username(), user.email(), user.admin(), user.active(), createdAt);
    }

    public void initializeTable() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS app_users (
                id BIGSERIAL PRIMARY KEY,
                username VARCHAR(255) NOT NULL UNIQUE,
                email VARCHAR(255),
                is_admin BOOLEAN NOT NULL DEFAULT false,
                active BOOLEAN NOT NULL DEFAULT true,
                created_at TIMESTAMP NOT NULL
            )
            """);
    }
}
