package com.lexikids.typing.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexikids.typing.analysis.AnalysisModels.CachedAnalysis;
import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.session.SessionModels.SessionHeader;
import com.lexikids.typing.session.SessionModels.SessionKey;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class SessionJdbcRepository {
    private static final String HEADER_COLUMNS =
            "session_id, therapist_code, username, started_at, assigned_themes, preferred_game, preferred_story";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void insertSession(SessionHeader header) {
        jdbcTemplate.update(
                "INSERT INTO sessions(" + HEADER_COLUMNS + ") VALUES (?,?,?,?,?,?,?)",
                header.sessionId(), header.therapistCode(), header.username(), header.startedAt().toString(),
                ListColumns.join(header.assignedThemes()), header.preferredGame(), header.preferredStory());
    }

    public Optional<SessionHeader> findSession(SessionKey key) {
        return jdbcTemplate.query(
                "SELECT " + HEADER_COLUMNS + " FROM sessions WHERE therapist_code=? AND username=? AND session_id=?",
                headerMapper(),
                key.therapistCode(), key.username(), key.sessionId()).stream().findFirst();
    }

    public List<SessionHeader> listSessions(String therapistCode, String username) {
        return jdbcTemplate.query(
                "SELECT " + HEADER_COLUMNS + " FROM sessions WHERE therapist_code=? AND username=? ORDER BY seq",
                headerMapper(),
                therapistCode, username);
    }

    public void updatePreferredGame(String sessionId, String preferredGame) {
        jdbcTemplate.update("UPDATE sessions SET preferred_game=? WHERE session_id=?", preferredGame, sessionId);
    }

    public void appendAttempts(String sessionId, List<Attempt> attempts) {
        attempts.forEach(a -> jdbcTemplate.update(
                "INSERT INTO typing_attempts(session_id, word, input, correct, time_spent_ms, hesitations, completed_at) VALUES (?,?,?,?,?,?,?)",
                sessionId, a.word(), a.input(), a.correct(), a.timeSpentMs(), a.hesitations(),
                (a.completedAt() == null ? Instant.now() : a.completedAt()).toString()));
    }

    public List<Attempt> loadAttempts(String sessionId) {
        return jdbcTemplate.query(
                "SELECT word, input, correct, time_spent_ms, hesitations, completed_at FROM typing_attempts WHERE session_id=? ORDER BY seq",
                (rs, n) -> new Attempt(rs.getString(1), rs.getString(2), rs.getBoolean(3), rs.getInt(4), rs.getInt(5),
                        Instant.parse(rs.getString(6))),
                sessionId);
    }

    public void putLatestInput(String sessionId, String word, String input) {
        jdbcTemplate.update(
                "MERGE INTO typing_results_map(session_id, word, input) KEY(session_id, word) VALUES (?,?,?)",
                sessionId, word, input);
    }

    public Map<String, String> loadLatestInputs(String sessionId) {
        Map<String, String> out = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT word, input FROM typing_results_map WHERE session_id=? ORDER BY word",
                (RowCallbackHandler) rs -> out.put(rs.getString(1), rs.getString(2)),
                sessionId);
        return out;
    }

    public void saveAnalysis(String sessionId, CachedAnalysis analysis) {
        jdbcTemplate.update("UPDATE sessions SET typing_analysis=? WHERE session_id=?", toJson(analysis), sessionId);
    }

    public Optional<CachedAnalysis> loadAnalysis(String sessionId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT typing_analysis FROM sessions WHERE session_id=?",
                (rs, n) -> rs.getString(1),
                sessionId);
        return rows.stream().filter(json -> json != null && !json.isBlank()).findFirst().map(this::fromJson);
    }

    private RowMapper<SessionHeader> headerMapper() {
        return (rs, n) -> new SessionHeader(rs.getString(1), rs.getString(2), rs.getString(3),
                Instant.parse(rs.getString(4)), ListColumns.split(rs.getString(5)), rs.getString(6), rs.getString(7));
    }

    private String toJson(CachedAnalysis analysis) {
        try {
            return objectMapper.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize typing analysis", e);
        }
    }

    private CachedAnalysis fromJson(String json) {
        try {
            return objectMapper.readValue(json, CachedAnalysis.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored typing analysis is unreadable", e);
        }
    }
}
