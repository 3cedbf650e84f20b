package com.lexikids.typing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AdaptiveTypingApplication {
    public static void main(String[] args) {
        SpringApplication.run(AdaptiveTypingApplication.class, args);
    }
}
