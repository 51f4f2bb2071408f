package com.sporewriter.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Node entry of a node-link document. Ids may arrive as numbers or numeric strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeDto {

    @NotNull(message = "Node id is required")
    @Positive(message = "Node id must be positive")
    private Integer id;

    private Double x;

    private Double y;
}
