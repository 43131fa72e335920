package org.arenaclient.match.resources.results;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

import org.arenaclient.match.api.results.IResultLog;
import org.arenaclient.match.api.results.ResultLogException;
import org.arenaclient.match.api.results.ResultRecord;
import org.arenaclient.match.model.MatchResult;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.resources.AbstractResource;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Append-only result log in an H2 table, accessed through a HikariCP pool.
 * <p>
 * One row per completed match in {@code match_results}. Rows are never updated or deleted.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * results {
 *   jdbcUrl = "jdbc:h2:./data/results;DB_CLOSE_DELAY=-1"
 *   username = "sa"
 *   password = ""
 *   maxPoolSize = 4
 * }
 * </pre>
 */
public class H2ResultLog extends AbstractResource implements IResultLog {

    private static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS match_results (
          id BIGINT AUTO_INCREMENT PRIMARY KEY,
          recorded_at TIMESTAMP NOT NULL,
          match_id VARCHAR(255) NOT NULL,
          map_name VARCHAR(255) NOT NULL,
          player1 VARCHAR(255) NOT NULL,
          player2 VARCHAR(255) NOT NULL,
          outcome VARCHAR(32) NOT NULL,
          reason VARCHAR(64) NOT NULL,
          loser VARCHAR(255),
          steps BIGINT NOT NULL,
          duration_ms BIGINT NOT NULL,
          player1_strikes INT NOT NULL,
          player2_strikes INT NOT NULL,
          replay_path VARCHAR(4096) NOT NULL
        )""";

    private static final String INSERT = """
        INSERT INTO match_results (recorded_at, match_id, map_name, player1, player2, outcome, reason, loser,
          steps, duration_ms, player1_strikes, player2_strikes, replay_path)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String SELECT_RECENT = """
        SELECT id, recorded_at, match_id, map_name, player1, player2, outcome, reason, loser, steps, duration_ms,
          player1_strikes, player2_strikes, replay_path
        FROM match_results ORDER BY id DESC LIMIT ?""";

    private final HikariDataSource dataSource;
    private volatile boolean failed;

    public H2ResultLog(String name, Config options) {
        super(name, options);
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for H2ResultLog.");
        }
        final String jdbcUrl = options.getString("jdbcUrl");

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 4);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 1);
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            String errorMsg = String.format("Failed to open result log '%s' at %s: %s", name, jdbcUrl, e.getMessage());
            log.error(errorMsg);
            throw new ResultLogException(errorMsg, e);
        }

        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        } catch (SQLException e) {
            dataSource.close();
            String errorMsg = String.format("Failed to create result table in '%s': %s", name, e.getMessage());
            log.error(errorMsg);
            throw new ResultLogException(errorMsg, e);
        }
        log.debug("Result log '{}' ready at {}", name, jdbcUrl);
    }

    @Override
    public void append(MatchResult result) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(INSERT)) {
            stmt.setTimestamp(1, Timestamp.from(result.endedAt()));
            stmt.setString(2, result.matchId());
            stmt.setString(3, result.mapName());
            stmt.setString(4, result.players().getOrDefault(PlayerSlot.PLAYER_1, ""));
            stmt.setString(5, result.players().getOrDefault(PlayerSlot.PLAYER_2, ""));
            stmt.setString(6, result.outcome().wireName());
            stmt.setString(7, result.reason().wireName());
            stmt.setString(8, result.loserId().orElse(null));
            stmt.setLong(9, result.steps());
            stmt.setLong(10, result.elapsed().toMillis());
            stmt.setInt(11, result.strikesOf(PlayerSlot.PLAYER_1));
            stmt.setInt(12, result.strikesOf(PlayerSlot.PLAYER_2));
            stmt.setString(13, result.replayPath());
            stmt.executeUpdate();
            failed = false;
        } catch (SQLException e) {
            failed = true;
            throw new ResultLogException("Failed to append result of match '" + result.matchId() + "'", e);
        }
    }

    @Override
    public List<ResultRecord> recent(int limit) {
        List<ResultRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(new ResultRecord(
                        rs.getLong("id"),
                        rs.getTimestamp("recorded_at").toInstant(),
                        rs.getString("match_id"),
                        rs.getString("map_name"),
                        rs.getString("player1"),
                        rs.getString("player2"),
                        rs.getString("outcome"),
                        rs.getString("reason"),
                        rs.getString("loser"),
                        rs.getLong("steps"),
                        rs.getLong("duration_ms"),
                        rs.getInt("player1_strikes"),
                        rs.getInt("player2_strikes"),
                        rs.getString("replay_path")));
                }
            }
        } catch (SQLException e) {
            throw new ResultLogException("Failed to read result log '" + getResourceName() + "'", e);
        }
        return records;
    }

    @Override
    public UsageState getUsageState() {
        if (dataSource.isClosed() || failed) {
            return UsageState.FAILED;
        }
        return UsageState.ACTIVE;
    }

    @Override
    public void close() {
        if (dataSource.isClosed()) {
            return;
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
        } catch (SQLException e) {
            // 90121: database already closed
            if (e.getErrorCode() != 90121) {
                log.warn("Result log '{}' shutdown command failed: {}", getResourceName(), e.getMessage());
            }
        }
        dataSource.close();
        log.debug("Result log '{}' closed", getResourceName());
    }
}
