package com.lexikids.typing.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexikids.typing.domain.DomainModels.Attempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class ApiModels {
    private static final Logger log = LoggerFactory.getLogger(ApiModels.class);

    public record AttemptIn(String word, String input, Boolean correct, Integer timeSpent, Integer hesitations) {
        public Attempt toAttempt() {
            return Attempt.of(word, input, Boolean.TRUE.equals(correct),
                    timeSpent == null ? 0 : timeSpent,
                    hesitations == null ? 0 : hesitations);
        }
    }

    public record ErrorResponse(String error, String message) {}

    static List<Attempt> toAttempts(List<AttemptIn> in) {
        if (in == null) return null;
        return in.stream().filter(Objects::nonNull).map(AttemptIn::toAttempt).toList();
    }

    /** Keeps the readable attempts of a loosely shaped history; anything but an array reads as empty. */
    static List<Attempt> toAttemptsLenient(JsonNode history, ObjectMapper objectMapper) {
        List<Attempt> out = new ArrayList<>();
        if (history == null || !history.isArray()) return out;
        for (JsonNode item : history) {
            if (!item.isObject()) continue;
            try {
                out.add(objectMapper.treeToValue(item, AttemptIn.class).toAttempt());
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable attempt {}: {}", item, e.getOriginalMessage());
            }
        }
        return out;
    }
}
