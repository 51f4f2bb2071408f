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
 * Request DTO for applying a rule to an input graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculateRequest {

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

    @Valid
    @NotNull(message = "RHS graph is required")
    @JsonProperty("rhs")
    @JsonAlias("graph_rhs")
    private NodeLinkGraph rhs;

    @Builder.Default
    @JsonProperty("lhs_to_input")
    @JsonAlias("mapping_lhs_to_input")
    private Map<Integer, Integer> lhsToInput = new HashMap<>();

    @Builder.Default
    @JsonProperty("rhs_to_lhs")
    @JsonAlias("mapping_rhs_to_lhs")
    private Map<Integer, Integer> rhsToLhs = new HashMap<>();
}
