package com.polyglot.playground.dto;

import com.polyglot.playground.language.Language;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AnalysisRequest(
    @NotNull(message = "Source code cannot be null")
    @Size(max = 1_048_576, message = "Source code cannot exceed 1,048,576 characters")
    String code,

    String language
) {

    /**
     * Normalizes line endings only, so reported positions match what the caller submitted.
     */
    public String sanitizedCode() {
        if (code == null) {
            return "";
        }

        return code
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }

    public Language resolvedLanguage() {
        return Language.fromTag(language);
    }
}
