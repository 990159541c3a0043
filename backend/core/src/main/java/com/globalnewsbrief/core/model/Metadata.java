package com.globalnewsbrief.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.globalnewsbrief.core.validation.Violation;
import com.globalnewsbrief.core.validation.Violations;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Metadata(
        @JsonProperty("article_count") int articleCount,
        @JsonProperty("categories_distribution") Map<String, Integer> categoriesDistribution,
        @JsonProperty("llm_usage") TokenUsage llmUsage,
        @JsonProperty("processing_time_seconds") double processingTimeSeconds,
        @JsonProperty("llm_model") String llmModel,
        @JsonProperty("workflow_run_id") String workflowRunId
) {
    public static final String DEFAULT_LLM_MODEL = "sonar";
    public static final int MIN_ARTICLE_COUNT = 1;
    public static final int MAX_ARTICLE_COUNT = 10;

    public Metadata {
        if (llmModel == null || llmModel.isBlank()) {
            llmModel = DEFAULT_LLM_MODEL;
        }
        if (categoriesDistribution == null) {
            categoriesDistribution = Map.of();
        }

        Violations violations = new Violations();
        violations.range("article_count", articleCount, MIN_ARTICLE_COUNT, MAX_ARTICLE_COUNT);
        violations.required("llm_usage", llmUsage);
        violations.nonNegative("processing_time_seconds", processingTimeSeconds);

        long total = 0;
        for (Map.Entry<String, Integer> entry : categoriesDistribution.entrySet()) {
            String field = "categories_distribution." + entry.getKey();
            if (Category.lookup(entry.getKey()).isEmpty()) {
                violations.add(field, Violation.Rule.ENUM, "is not a known category");
            }
            if (entry.getValue() == null || entry.getValue() < 0) {
                violations.add(field, Violation.Rule.RANGE, "count must be a non-negative integer");
            } else {
                total += entry.getValue();
            }
        }
        if (!categoriesDistribution.isEmpty() && total != articleCount) {
            violations.add("categories_distribution", Violation.Rule.CONSISTENCY,
                    "counts must sum to article_count " + articleCount + " (was " + total + ")");
        }
        violations.throwIfAny("Metadata");

        categoriesDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(categoriesDistribution));
    }
}
