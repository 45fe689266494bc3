package com.armada.core.plan;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Wire shape of a plan document as produced by the external planner.
 *
 * <p>Accepts both the issue-level layout ({@code waves} / {@code issues} / {@code issue_details})
 * and the project-level layout ({@code epic_waves} / {@code epics} or {@code epic_ids} /
 * {@code epic_details}). Item identifiers may be JSON numbers or strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanDocument(
    @JsonProperty("waves") @JsonAlias("epic_waves") List<WaveEntry> waves,
    @JsonProperty("issue_details") @JsonAlias("epic_details") Map<String, ItemDetail> details,
    @JsonProperty("success_criteria") List<String> successCriteria,
    @JsonProperty("estimated_time") @JsonAlias("estimated_total_time") String estimatedTime
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record WaveEntry(
        @JsonProperty("wave") Integer wave,
        @JsonProperty("issues") @JsonAlias({"epics", "epic_ids"}) List<JsonNode> items,
        @JsonProperty("description") String description,
        @JsonProperty("depends_on_wave") JsonNode dependsOnWave
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ItemDetail(
        @JsonProperty("title") String title,
        @JsonProperty("depends_on") List<JsonNode> dependsOn
    ) {}
}
