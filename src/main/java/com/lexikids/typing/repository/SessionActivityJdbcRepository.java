package com.lexikids.typing.repository;

import com.lexikids.typing.session.SessionModels.PuzzleCompletion;
import com.lexikids.typing.session.SessionModels.Recording;
import com.lexikids.typing.session.SessionModels.TracingAttempt;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class SessionActivityJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SessionActivityJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void appendThemeChange(String sessionId, String theme) {
        jdbcTemplate.update("INSERT INTO session_theme_changes(session_id, theme) VALUES (?,?)", sessionId, theme);
    }

    public List<String> loadThemeChanges(String sessionId) {
        return jdbcTemplate.query("SELECT theme FROM session_theme_changes WHERE session_id=? ORDER BY seq",
                (rs, n) -> rs.getString(1), sessionId);
    }

    public void appendEmotion(String sessionId, String emotion) {
        jdbcTemplate.update("INSERT INTO session_emotions(session_id, emotion) VALUES (?,?)", sessionId, emotion);
    }

    public List<String> loadEmotions(String sessionId) {
        return jdbcTemplate.query("SELECT emotion FROM session_emotions WHERE session_id=? ORDER BY seq",
                (rs, n) -> rs.getString(1), sessionId);
    }

    public void appendEmotionReading(String sessionId, String emotion) {
        jdbcTemplate.update("INSERT INTO pending_emotion_readings(session_id, emotion) VALUES (?,?)", sessionId, emotion);
    }

    public List<String> loadEmotionReadings(String sessionId) {
        return jdbcTemplate.query("SELECT emotion FROM pending_emotion_readings WHERE session_id=? ORDER BY seq",
                (rs, n) -> rs.getString(1), sessionId);
    }

    public void clearEmotionReadings(String sessionId) {
        jdbcTemplate.update("DELETE FROM pending_emotion_readings WHERE session_id=?", sessionId);
    }

    public void appendPuzzle(String sessionId, PuzzleCompletion puzzle) {
        jdbcTemplate.update(
                "INSERT INTO played_puzzles(session_id, theme, level, puzzle_id, completed_at, emotions_during) VALUES (?,?,?,?,?,?)",
                sessionId, puzzle.theme(), puzzle.level(), puzzle.puzzleId(), puzzle.completedAt().toString(),
                ListColumns.join(puzzle.emotionsDuring()));
    }

    public List<PuzzleCompletion> loadPuzzles(String sessionId) {
        return jdbcTemplate.query(
                "SELECT theme, level, puzzle_id, completed_at, emotions_during FROM played_puzzles WHERE session_id=? ORDER BY seq",
                (rs, n) -> new PuzzleCompletion(rs.getString(1), rs.getInt(2), rs.getString(3),
                        Instant.parse(rs.getString(4)), ListColumns.split(rs.getString(5))),
                sessionId);
    }

    public void appendTracing(String sessionId, TracingAttempt tracing) {
        jdbcTemplate.update(
                "INSERT INTO tracing_results(session_id, letter, image_data, traced_at) VALUES (?,?,?,?)",
                sessionId, tracing.letter(), tracing.imageData(), tracing.tracedAt().toString());
    }

    public List<TracingAttempt> loadTracings(String sessionId) {
        return jdbcTemplate.query(
                "SELECT letter, image_data, traced_at FROM tracing_results WHERE session_id=? ORDER BY seq",
                (rs, n) -> new TracingAttempt(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3))),
                sessionId);
    }

    public void appendRecording(String sessionId, Recording recording) {
        jdbcTemplate.update(
                "INSERT INTO reading_recordings(session_id, story_title, audio_ref, recorded_at) VALUES (?,?,?,?)",
                sessionId, recording.storyTitle(), recording.audioRef(), recording.recordedAt().toString());
    }

    public List<Recording> loadRecordings(String sessionId) {
        return jdbcTemplate.query(
                "SELECT story_title, audio_ref, recorded_at FROM reading_recordings WHERE session_id=? ORDER BY seq",
                (rs, n) -> new Recording(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3))),
                sessionId);
    }
}
