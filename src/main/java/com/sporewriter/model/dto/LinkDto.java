package com.sporewriter.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Undirected link of a node-link document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkDto {

    @NotNull(message = "Link source is required")
    private Integer source;

    @NotNull(message = "Link target is required")
    private Integer target;
}
