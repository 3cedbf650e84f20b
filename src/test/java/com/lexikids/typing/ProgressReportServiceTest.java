package com.lexikids.typing;

import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.progress.ProgressModels.ChildProgressReport;
import com.lexikids.typing.progress.ProgressReportService;
import com.lexikids.typing.session.NotFoundException;
import com.lexikids.typing.session.SessionModels.SessionKey;
import com.lexikids.typing.session.SessionProgressService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ProgressReportServiceTest {
    @Autowired
    private ProgressReportService progressService;
    @Autowired
    private SessionProgressService sessionService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void aggregatesTypingAcrossSessions() {
        String therapist = TestRoster.therapistCode();
        TestRoster.addChild(jdbcTemplate, therapist, "mia", "underwater", "typing");

        SessionKey first = new SessionKey(therapist, "mia", sessionService.startSession(therapist, "mia").sessionId());
        sessionService.saveTypingResults(first, List.of(
                Attempt.of("bed", "ded", false, 3000, 1),
                Attempt.of("bad", "dad", false, 3000, 1)));

        sessionService.startSession(therapist, "mia");

        SessionKey third = new SessionKey(therapist, "mia", sessionService.startSession(therapist, "mia").sessionId());
        sessionService.saveTypingResults(third, List.of(
                Attempt.of("bib", "bib", true, 2000, 0),
                Attempt.of("bat", "bat", true, 2000, 0),
                Attempt.of("bee", "dee", false, 2000, 0),
                Attempt.of("bell", "bell", true, 2000, 0),
                Attempt.of("bill", "bill", true, 2000, 0),
                Attempt.of("bale", "bale", true, 2000, 0),
                Attempt.of("bail", "bail", true, 2000, 0)));

        ChildProgressReport report = progressService.childReport(therapist, "mia");

        assertTrue(report.hasData());
        assertEquals(9, report.overallStats().totalWords());
        assertEquals(6, report.overallStats().correctWords());
        assertEquals(66.67, report.overallStats().overallAccuracy());
        assertEquals(2, report.overallStats().totalSessions());

        assertEquals(List.of(first.sessionId(), third.sessionId()),
                report.sessionAnalyses().stream().map(a -> a.sessionId()).toList());
        assertTrue(report.sessionAnalyses().stream().allMatch(a -> a.cached()));
        assertEquals(List.of(0, 86), report.progressTimeline().stream().map(p -> p.accuracy()).toList());
        assertEquals(List.of(2, 7), report.progressTimeline().stream().map(p -> p.wordsCompleted()).toList());

        assertEquals(List.of("b"), report.aggregateInsights().topProblemLetters());
        assertEquals("b", report.aggregateInsights().confusionPatterns().get(0).target());
        assertEquals("d", report.aggregateInsights().confusionPatterns().get(0).typedAs());
        assertEquals(3, report.aggregateInsights().confusionPatterns().get(0).frequency());
        assertTrue(report.aggregateInsights().strengths().size() <= 5);
    }

    @Test
    void childWithoutTypingHasEmptyReport() {
        String therapist = TestRoster.therapistCode();
        TestRoster.addChild(jdbcTemplate, therapist, "leo", "forest", null);
        sessionService.startSession(therapist, "leo");

        ChildProgressReport report = progressService.childReport(therapist, "leo");

        assertFalse(report.hasData());
        assertEquals(0, report.overallStats().totalWords());
        assertEquals(0.0, report.overallStats().overallAccuracy());
        assertTrue(report.sessionAnalyses().isEmpty());
        assertTrue(report.aggregateInsights().topProblemLetters().isEmpty());
    }

    @Test
    void unknownChildIsNotFound() {
        assertThrows(NotFoundException.class, () -> progressService.childReport(TestRoster.therapistCode(), "ghost"));
    }
}
