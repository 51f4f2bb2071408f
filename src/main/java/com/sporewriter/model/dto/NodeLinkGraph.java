package com.sporewriter.model.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph as exchanged with the editor: a node list and a link list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeLinkGraph {

    @Valid
    @Builder.Default
    private List<NodeDto> nodes = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<LinkDto> links = new ArrayList<>();
}
