package com.shinobi.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
        @NotBlank String name,
        String version,
        String description,
        String apiPrefix,
        Cors cors
) {

    public String safeVersion() {
        return notBlank(version) ? version : "1.0.0";
    }

    public String safeApiPrefix() {
        return notBlank(apiPrefix) ? apiPrefix : "";
    }

    public List<String> allowedOrigins() {
        if (cors == null || cors.allowedOrigins() == null || cors.allowedOrigins().isEmpty()) {
            return List.of("*");
        }
        return cors.allowedOrigins();
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    public record Cors(List<String> allowedOrigins) {
    }
}
