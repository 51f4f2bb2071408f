package com.sporewriter.controller;

import com.sporewriter.model.dto.CalculateRequest;
import com.sporewriter.model.dto.MatchValidationRequest;
import com.sporewriter.model.dto.MatchValidationResponse;
import com.sporewriter.model.dto.NodeLinkGraph;
import com.sporewriter.service.RewriteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Controller for match checks and rule application.
 */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class RewriteController {

    private final RewriteService rewriteService;

    @PostMapping("/calculate")
    public Mono<NodeLinkGraph> calculate(@Valid @RequestBody CalculateRequest request) {
        return rewriteService.calculate(request);
    }

    @PostMapping("/v1/match/validate")
    public Mono<MatchValidationResponse> validateMatch(@Valid @RequestBody MatchValidationRequest request) {
        return rewriteService.validateMatch(request);
    }
}
