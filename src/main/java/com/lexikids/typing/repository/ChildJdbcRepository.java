package com.lexikids.typing.repository;

import com.lexikids.typing.session.SessionModels.Child;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ChildJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ChildJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Child> findChild(String therapistCode, String username) {
        List<Child> rows = jdbcTemplate.query(
                "SELECT therapist_code, username, current_assigned_themes, assigned_games, completed_games, preferred_game, preferred_story, joined_at FROM children WHERE therapist_code=? AND username=?",
                (rs, n) -> new Child(rs.getString(1), rs.getString(2),
                        ListColumns.split(rs.getString(3)), ListColumns.split(rs.getString(4)), ListColumns.split(rs.getString(5)),
                        rs.getString(6), rs.getString(7), Instant.parse(rs.getString(8))),
                therapistCode, username);
        return rows.stream().findFirst();
    }

    public void updateCompletedGames(String therapistCode, String username, List<String> completedGames) {
        jdbcTemplate.update(
                "UPDATE children SET completed_games=? WHERE therapist_code=? AND username=?",
                ListColumns.join(completedGames), therapistCode, username);
    }
}
