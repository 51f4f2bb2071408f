package com.sporewriter.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for checking a match without rewriting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchValidationRequest {

    @Valid
    @NotNull(message = "Input graph is required")
    @JsonProperty("input")
    @JsonAlias("graph_input")
    private NodeLinkGraph input;

    @Valid
    @NotNull(message = "LHS graph is required")
    @JsonProperty("lhs")
    @JsonAlias("graph_lhs")
    private NodeLinkGraph lhs;

    @Builder.Default
    @JsonProperty("lhs_to_input")
    @JsonAlias("mapping_lhs_to_input")
    private Map<Integer, Integer> lhsToInput = new HashMap<>();
}
