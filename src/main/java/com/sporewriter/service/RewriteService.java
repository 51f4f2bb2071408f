package com.sporewriter.service;

import com.sporewriter.engine.MatchValidator;
import com.sporewriter.engine.RewriteEngine;
import com.sporewriter.engine.RewriteResult;
import com.sporewriter.engine.ValidatedMatch;
import com.sporewriter.exception.MatchException;
import com.sporewriter.model.dto.CalculateRequest;
import com.sporewriter.model.dto.MatchValidationRequest;
import com.sporewriter.model.dto.MatchValidationResponse;
import com.sporewriter.model.dto.NodeLinkGraph;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.mapping.Correspondence;
import com.sporewriter.util.NodeLinkConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Service for validating matches and applying rewrite rules.
 * Each call decodes its own graphs, so requests share no mutable state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewriteService {

    private final MatchValidator matchValidator;
    private final RewriteEngine rewriteEngine;

    /**
     * Apply the rule in the request to its input graph.
     *
     * @param request Graphs and mappings
     * @return Output graph, or an error signal naming the failed check
     */
    public Mono<NodeLinkGraph> calculate(CalculateRequest request) {
        return Mono.fromCallable(() -> {
            Graph input = NodeLinkConverter.toGraph("input", request.getInput());
            Graph lhs = NodeLinkConverter.toGraph("lhs", request.getLhs());
            Graph rhs = NodeLinkConverter.toGraph("rhs", request.getRhs());
            Correspondence lhsToInput = NodeLinkConverter.toCorrespondence(request.getLhsToInput());
            Correspondence rhsToLhs = NodeLinkConverter.toCorrespondence(request.getRhsToLhs());

            log.info("Request: input nodes={} edges={} | lhs nodes={} edges={} | rhs nodes={} edges={}",
                    input.nodeCount(), input.edgeCount(), lhs.nodeCount(), lhs.edgeCount(),
                    rhs.nodeCount(), rhs.edgeCount());
            log.info("Mappings: lhs->input={} rhs->lhs={}", lhsToInput.size(), rhsToLhs.size());
            log.debug("lhs->input: {}", lhsToInput.assignments());
            log.debug("rhs->lhs: {}", rhsToLhs.assignments());

            ValidatedMatch match = matchValidator.validate(lhs, input, lhsToInput);
            RewriteResult result = rewriteEngine.rewrite(input, lhs, rhs, match, rhsToLhs);
            return NodeLinkConverter.fromGraph(result.getOutput());
        });
    }

    /**
     * Check a match without rewriting. Match failures are reported in the
     * response body; malformed graphs still fail the call.
     */
    public Mono<MatchValidationResponse> validateMatch(MatchValidationRequest request) {
        return Mono.fromCallable(() -> {
            Graph input = NodeLinkConverter.toGraph("input", request.getInput());
            Graph lhs = NodeLinkConverter.toGraph("lhs", request.getLhs());
            matchValidator.validate(lhs, input, NodeLinkConverter.toCorrespondence(request.getLhsToInput()));
            return MatchValidationResponse.builder()
                    .valid(true)
                    .build();
        }).onErrorResume(MatchException.class, ex -> {
            log.debug("Match rejected: {} {}", ex.getError(), ex.getMessage());
            return Mono.just(MatchValidationResponse.builder()
                    .valid(false)
                    .error(ex.getError().name())
                    .detail(ex.getMessage())
                    .build());
        });
    }
}
