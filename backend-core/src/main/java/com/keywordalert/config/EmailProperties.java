package com.keywordalert.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.email")
public record EmailProperties(
        boolean enabled,
        String from,
        String subjectPrefix
) {
    public String safeSubjectPrefix() {
        return subjectPrefix != null && !subjectPrefix.isBlank() ? subjectPrefix : "[Keyword Alert]";
    }

    public boolean hasFrom() {
        return from != null && !from.isBlank();
    }
}
