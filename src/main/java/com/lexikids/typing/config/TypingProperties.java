package com.lexikids.typing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "typing")
public record TypingProperties(@DefaultValue Session session) {

    public record Session(@DefaultValue("true") boolean enforcePreferredGame) {}
}
