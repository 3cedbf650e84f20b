package com.lexikids.typing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class TypingApiTest {
    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void childPlaysTypingSessionEndToEnd() throws Exception {
        String therapist = TestRoster.therapistCode();
        TestRoster.addChild(jdbcTemplate, therapist, "mia", "underwater", "typing");

        String startBody = mockMvc.perform(post("/api/sessions/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"therapistCode\":\"" + therapist + "\",\"username\":\"mia\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignedThemes[0]").value("underwater"))
                .andReturn().getResponse().getContentAsString();
        JsonNode start = objectMapper.readTree(startBody);
        String sessionId = start.get("sessionId").asText();

        mockMvc.perform(post("/api/typing/initial-word")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"" + sessionId + "\",\"username\":\"mia\",\"therapistCode\":\"" + therapist + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.difficulty").value("medium"))
                .andExpect(jsonPath("$.initial").value(true));

        String results = """
                {"therapistCode":"%s","username":"mia","sessionId":"%s","results":[
                  {"word":"cat","input":"cat","correct":true,"timeSpent":2000,"hesitations":0},
                  {"word":"cat","input":"bat","correct":false,"timeSpent":2000},
                  {"word":"cat","input":"cat","correct":true,"timeSpent":2000,"hesitations":0},
                  {"word":"cat","input":"kat","correct":false},
                  {"word":"cat","input":"cat","correct":true,"timeSpent":2000,"hesitations":0}
                ]}
                """.formatted(therapist, sessionId);
        mockMvc.perform(post("/api/typing/results").contentType(MediaType.APPLICATION_JSON).content(results))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalWords").value(5))
                .andExpect(jsonPath("$.analysis.overallAccuracy").value(60))
                .andExpect(jsonPath("$.analysis.severity").value("moderate"))
                .andExpect(jsonPath("$.analysis.problematicLetters", contains("c")))
                .andExpect(jsonPath("$.analysis.confusionPatterns[*].typedAs", contains("b", "k")));

        mockMvc.perform(get("/api/sessions/" + sessionId).param("therapistCode", therapist).param("username", "mia"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.typingResults", hasSize(5)))
                .andExpect(jsonPath("$.typingResultsMap.cat").value("cat"))
                .andExpect(jsonPath("$.typingAnalysis.totalWords").value(5))
                .andExpect(jsonPath("$.typingAnalysis.correctWords").value(3))
                .andExpect(jsonPath("$.typingAnalysis.analysis.emotionalState").value("challenged"));

        mockMvc.perform(post("/api/typing/analyze-session")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"" + sessionId + "\",\"username\":\"mia\",\"therapistCode\":\"" + therapist + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysis.overallAccuracy").value(60));

        mockMvc.perform(get("/api/typing/child-analysis").param("therapistCode", therapist).param("username", "mia"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallStats.totalWords").value(5))
                .andExpect(jsonPath("$.hasData").value(true));
    }

    @Test
    void nextWordHonoursDifficultyLevel() throws Exception {
        String body = """
                {"sessionId":"s-1","username":"mia","therapistCode":"T-1","difficultyLevel":"hard",
                 "typingHistory":[{"word":"cat","input":"cat","correct":true,"timeSpent":1500,"hesitations":0}]}
                """;
        mockMvc.perform(post("/api/typing/next-word").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.difficulty").value("hard"))
                .andExpect(jsonPath("$.recentAccuracy").value(100))
                .andExpect(jsonPath("$.word", not(emptyOrNullString())));
    }

    @Test
    void realTimeFeedbackAndStatelessAnalysis() throws Exception {
        String attempts = "[{\"word\":\"ship\",\"input\":\"sip\",\"correct\":false,\"timeSpent\":3000,\"hesitations\":3}]";
        mockMvc.perform(post("/api/typing/real-time-feedback").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentResults\":" + attempts + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.emotionalState").value("frustrated"))
                .andExpect(jsonPath("$.needsSupport").value(true))
                .andExpect(jsonPath("$.suggestedDifficulty").value("medium"));

        mockMvc.perform(post("/api/typing/analyze").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"typingHistory\":" + attempts + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallAccuracy").value(0))
                .andExpect(jsonPath("$.problematicLetters", contains("h", "i", "p")));

        mockMvc.perform(post("/api/typing/real-time-feedback").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentResults\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No results provided"));
    }

    @Test
    void statelessAnalysisDegradesOnMalformedHistory() throws Exception {
        for (String body : List.of("{\"typingHistory\":\"oops\"}", "{\"typingHistory\":42}", "{}")) {
            mockMvc.perform(post("/api/typing/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.overallAccuracy").value(0))
                    .andExpect(jsonPath("$.problematicLetters", empty()))
                    .andExpect(jsonPath("$.emotionalState").value("struggling"))
                    .andExpect(jsonPath("$.performanceMetrics.totalHesitations").value(0));
        }

        String mixed = "{\"typingHistory\":[\"junk\",{\"word\":\"cat\",\"input\":\"cat\",\"correct\":true,\"timeSpent\":\"slow\"},"
                + "{\"word\":\"dog\",\"input\":\"dog\",\"correct\":true,\"timeSpent\":2000}]}";
        mockMvc.perform(post("/api/typing/analyze").contentType(MediaType.APPLICATION_JSON).content(mixed))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallAccuracy").value(100))
                .andExpect(jsonPath("$.performanceMetrics.avgTimeSpent").value(2000));
    }

    @Test
    void listsWordsByTier() throws Exception {
        mockMvc.perform(get("/api/typing/words"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tiers.easy", hasSize(36)))
                .andExpect(jsonPath("$.tiers.medium", not(empty())))
                .andExpect(jsonPath("$.tiers.hard", not(empty())))
                .andExpect(jsonPath("$.totalWords").value(113));
    }

    @Test
    void mapsMissingFieldsAndUnknownSessions() throws Exception {
        mockMvc.perform(post("/api/typing/next-word").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s-1\",\"username\":\"mia\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));

        mockMvc.perform(post("/api/typing/results").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"therapistCode\":\"T-none\",\"username\":\"mia\",\"sessionId\":\"nope\",\"results\":[]}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));

        mockMvc.perform(get("/api/sessions").param("therapistCode", "T-none"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void emotionReadingsThroughSessionEndpoints() throws Exception {
        String therapist = TestRoster.therapistCode();
        TestRoster.addChild(jdbcTemplate, therapist, "kai", "space", null);
        String startBody = mockMvc.perform(post("/api/sessions/start").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"therapistCode\":\"" + therapist + "\",\"username\":\"kai\"}"))
                .andReturn().getResponse().getContentAsString();
        String sessionId = objectMapper.readTree(startBody).get("sessionId").asText();
        String reading = "{\"therapistCode\":\"" + therapist + "\",\"username\":\"kai\",\"emotion\":\"%s\"}";

        mockMvc.perform(post("/api/sessions/" + sessionId + "/emotion-readings/dominant").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"therapistCode\":\"" + therapist + "\",\"username\":\"kai\"}"))
                .andExpect(status().isNotFound());

        for (String emotion : new String[]{"happy", "sad", "happy"}) {
            mockMvc.perform(post("/api/sessions/" + sessionId + "/emotion-readings").contentType(MediaType.APPLICATION_JSON)
                            .content(reading.formatted(emotion)))
                    .andExpect(status().isNoContent());
        }

        mockMvc.perform(post("/api/sessions/" + sessionId + "/emotion-readings/dominant").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"therapistCode\":\"" + therapist + "\",\"username\":\"kai\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.emotion").value("happy"));

        mockMvc.perform(post("/api/sessions/" + sessionId + "/themes").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"therapistCode\":\"" + therapist + "\",\"username\":\"kai\",\"theme\":\"jungle\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentTheme").value("jungle"));

        mockMvc.perform(post("/api/sessions/" + sessionId + "/puzzles").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"therapistCode\":\"" + therapist + "\",\"username\":\"kai\",\"theme\":\"jungle\",\"level\":0,\"puzzleId\":\"j-1\"}"))
                .andExpect(status().isBadRequest());
    }
}
