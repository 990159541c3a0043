package com.globalnewsbrief.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.core.validation.Violations;

/**
 * Token accounting reported by the text-generation API. The total is never corrected: a total
 * that differs from prompt plus completion is rejected.
 */
public record TokenUsage(
        @JsonProperty("prompt_tokens") long promptTokens,
        @JsonProperty("completion_tokens") long completionTokens,
        @JsonProperty("total_tokens") long totalTokens
) {
    public TokenUsage {
        Violations violations = new Violations();
        violations.range("prompt_tokens", promptTokens, 0, Long.MAX_VALUE);
        violations.range("completion_tokens", completionTokens, 0, Long.MAX_VALUE);
        violations.range("total_tokens", totalTokens, 0, Long.MAX_VALUE);
        if (promptTokens >= 0 && completionTokens >= 0 && promptTokens + completionTokens != totalTokens) {
            violations.add("total_tokens", Violation.Rule.CONSISTENCY,
                    "must equal prompt_tokens + completion_tokens (" + promptTokens + " + " + completionTokens
                            + " != " + totalTokens + ")");
        }
        violations.throwIfAny("TokenUsage");
    }

    public static TokenUsage empty() {
        return new TokenUsage(0, 0, 0);
    }
}
