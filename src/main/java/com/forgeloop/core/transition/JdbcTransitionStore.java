package com.forgeloop.core.transition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.model.StateSnapshot;
import com.forgeloop.core.model.TransitionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * JDBC-backed {@link TransitionStore}.
 * <p>
 * States and transitions go to two tables. Both are keyed by content hashes, so
 * inserting a state or transition that already exists is silently skipped. The SQL
 * sticks to statements that H2 and PostgreSQL both accept.
 */
public class JdbcTransitionStore implements TransitionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransitionStore.class);

    private static final String STATES_TABLE = "forgeloop_states";
    private static final String TRANSITIONS_TABLE = "forgeloop_transitions";

    private static final String CREATE_STATES_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                state_id   VARCHAR(64) PRIMARY KEY,
                domain     VARCHAR(64) NOT NULL,
                job_type   VARCHAR(64) NOT NULL,
                policy_key VARCHAR(255),
                data_json  TEXT NOT NULL
            )
            """.formatted(STATES_TABLE);

    private static final String CREATE_TRANSITIONS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                transition_id     VARCHAR(64) PRIMARY KEY,
                transition_kind   VARCHAR(64) NOT NULL,
                from_state_id     VARCHAR(64) NOT NULL,
                to_state_id       VARCHAR(64) NOT NULL,
                action_json       TEXT NOT NULL,
                context_json      TEXT NOT NULL,
                observations_json TEXT NOT NULL,
                verified          BOOLEAN NOT NULL,
                created_at        TIMESTAMP NOT NULL
            )
            """.formatted(TRANSITIONS_TABLE);

    private static final String STATE_EXISTS_SQL = """
            SELECT 1 FROM %s WHERE state_id = ?
            """.formatted(STATES_TABLE);

    private static final String INSERT_STATE_SQL = """
            INSERT INTO %s (state_id, domain, job_type, policy_key, data_json)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(STATES_TABLE);

    private static final String INSERT_TRANSITION_SQL = """
            INSERT INTO %s (transition_id, transition_kind, from_state_id, to_state_id,
                            action_json, context_json, observations_json, verified, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TRANSITIONS_TABLE);

    private static final String RECENT_VERIFIED_SQL = """
            SELECT verified FROM %s ORDER BY created_at DESC LIMIT ?
            """.formatted(TRANSITIONS_TABLE);

    private static final String COUNT_SQL = """
            SELECT COUNT(*) FROM %s
            """.formatted(TRANSITIONS_TABLE);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcTransitionStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the tables if they do not already exist. Called once at startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_STATES_SQL);
            stmt.execute(CREATE_TRANSITIONS_SQL);
            log.info("Transition tables '{}' and '{}' ensured", STATES_TABLE, TRANSITIONS_TABLE);
        }
    }

    @Override
    public void insert(TransitionRecord record) {
        try (Connection conn = dataSource.getConnection()) {
            insertState(conn, record.fromState());
            insertState(conn, record.toState());
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_TRANSITION_SQL)) {
                stmt.setString(1, record.transitionId());
                stmt.setString(2, record.transitionKind());
                stmt.setString(3, record.fromState().stateId());
                stmt.setString(4, record.toState().stateId());
                stmt.setString(5, toJson(record.actionLabel()));
                stmt.setString(6, toJson(record.context()));
                stmt.setString(7, toJson(record.observations()));
                stmt.setBoolean(8, record.verified());
                stmt.setTimestamp(9, Timestamp.from(record.timestamp()));
                stmt.executeUpdate();
                log.debug("Stored transition '{}'", record.transitionId());
            } catch (SQLException e) {
                if (!isDuplicateKey(e)) {
                    throw e;
                }
                log.debug("Transition '{}' already stored", record.transitionId());
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to store transition " + record.transitionId(), e);
        }
    }

    @Override
    public OptionalDouble verifiedRate(int window) {
        if (window <= 0) {
            return OptionalDouble.empty();
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(RECENT_VERIFIED_SQL)) {
            stmt.setInt(1, window);
            int total = 0;
            int verified = 0;
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    total++;
                    if (rs.getBoolean(1)) {
                        verified++;
                    }
                }
            }
            return total == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) verified / total);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read verified rate", e);
        }
    }

    /** Number of stored transitions. */
    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to count transitions", e);
        }
    }

    private void insertState(Connection conn, StateSnapshot state) throws SQLException {
        try (PreparedStatement exists = conn.prepareStatement(STATE_EXISTS_SQL)) {
            exists.setString(1, state.stateId());
            try (ResultSet rs = exists.executeQuery()) {
                if (rs.next()) {
                    return;
                }
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_STATE_SQL)) {
            stmt.setString(1, state.stateId());
            stmt.setString(2, state.domain());
            stmt.setString(3, state.jobType());
            stmt.setString(4, state.policyKey());
            stmt.setString(5, toJson(state.features()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            // a concurrent writer may have inserted the same state between the check and the insert
            if (!isDuplicateKey(e)) {
                throw e;
            }
        }
    }

    private static boolean isDuplicateKey(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("23");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transition payload", e);
        }
    }
}
