package com.lexikids.typing.progress;

import com.lexikids.typing.analysis.AnalysisModels.AnalysisResult;
import com.lexikids.typing.analysis.AnalysisModels.CachedAnalysis;
import com.lexikids.typing.analysis.PerformanceAnalyzer;
import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.progress.ProgressModels.*;
import com.lexikids.typing.session.SessionModels.Session;
import com.lexikids.typing.session.SessionProgressService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class ProgressReportService {
    private static final Logger log = LoggerFactory.getLogger(ProgressReportService.class);
    static final int TOP_ITEMS = 5;

    private final SessionProgressService sessionService;
    private final PerformanceAnalyzer analyzer;

    public ProgressReportService(SessionProgressService sessionService, PerformanceAnalyzer analyzer) {
        this.sessionService = sessionService;
        this.analyzer = analyzer;
    }

    public ChildProgressReport childReport(String therapistCode, String username) {
        List<Attempt> allAttempts = new ArrayList<>();
        List<SessionAnalysis> sessionAnalyses = new ArrayList<>();
        List<TimelinePoint> timeline = new ArrayList<>();

        for (Session session : sessionService.sessions(therapistCode, username)) {
            List<Attempt> attempts = session.typingResults();
            if (attempts.isEmpty()) continue;
            allAttempts.addAll(attempts);

            CachedAnalysis cached = session.typingAnalysis();
            AnalysisResult analysis = cached != null ? cached.analysis() : analyzer.analyze(attempts);
            sessionAnalyses.add(new SessionAnalysis(session.sessionId(), analysis,
                    cached != null ? cached.analyzedAt() : session.startedAt(), cached != null));
            timeline.add(new TimelinePoint(session.startedAt(), analysis.overallAccuracy(), attempts.size()));
        }
        timeline.sort(Comparator.comparing(TimelinePoint::date));

        int totalWords = allAttempts.size();
        int correctWords = (int) allAttempts.stream().filter(Attempt::correct).count();
        double accuracy = totalWords == 0 ? 0.0
                : BigDecimal.valueOf(correctWords * 100.0 / totalWords).setScale(2, RoundingMode.HALF_UP).doubleValue();

        AnalysisResult aggregate = analyzer.analyze(allAttempts);
        AggregateInsights insights = new AggregateInsights(
                aggregate.problematicLetters().stream().limit(TOP_ITEMS).toList(),
                aggregate.strengths().stream().limit(TOP_ITEMS).toList(),
                aggregate.confusionPatterns().stream().limit(TOP_ITEMS).toList(),
                aggregate.recommendations(),
                aggregate.emotionalState(),
                aggregate.encouragement());

        log.debug("Progress report for {} of therapist {}: {} words over {} sessions",
                username, therapistCode, totalWords, sessionAnalyses.size());
        return new ChildProgressReport(username,
                new OverallStats(totalWords, correctWords, accuracy, sessionAnalyses.size()),
                insights, sessionAnalyses, timeline, totalWords > 0);
    }
}
