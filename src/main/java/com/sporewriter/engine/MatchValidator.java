package com.sporewriter.engine;

import com.sporewriter.exception.MatchError;
import com.sporewriter.exception.MatchException;
import com.sporewriter.model.graph.Edge;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.mapping.Correspondence;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Checks that a map from LHS nodes to input nodes is a match: total over the
 * LHS, injective, pointing at existing input nodes, and edge preserving.
 * Checks run in that order and the first failure is reported.
 */
@Slf4j
public class MatchValidator {

    private final boolean requireInduced;

    public MatchValidator() {
        this(false);
    }

    /**
     * @param requireInduced also reject matches whose images are adjacent in the
     *                       input while their LHS preimages are not
     */
    public MatchValidator(boolean requireInduced) {
        this.requireInduced = requireInduced;
    }

    /**
     * Validate {@code match} against the given graphs. Assignments for ids that
     * are not LHS nodes are ignored.
     *
     * @throws MatchException describing the first failed check
     */
    public ValidatedMatch validate(Graph lhs, Graph input, Correspondence match) {
        List<Integer> lhsNodes = lhs.nodeIds();
        Correspondence restricted = match.restrictTo(lhsNodes);
        if (restricted.size() < match.size()) {
            log.debug("Ignoring {} assignment(s) for ids outside the LHS", match.size() - restricted.size());
        }
        Map<Integer, Integer> m = restricted.assignments();

        for (int lhsId : lhsNodes) {
            if (!m.containsKey(lhsId)) {
                throw new MatchException(MatchError.INCOMPLETE_MATCH,
                        String.format("LHS node %d is not mapped to the input (%d of %d mapped)",
                                lhsId, m.size(), lhsNodes.size()));
            }
        }

        restricted.firstSharedTarget().ifPresent(target -> {
            throw new MatchException(MatchError.NON_INJECTIVE_MATCH,
                    "Input node " + target + " is the image of more than one LHS node");
        });

        m.forEach((lhsId, inputId) -> {
            if (!input.hasNode(inputId)) {
                throw new MatchException(MatchError.DANGLING_MATCH_TARGET,
                        String.format("LHS node %d is mapped to input node %d, which does not exist", lhsId, inputId));
            }
        });

        for (Edge edge : lhs.edges()) {
            int source = m.get(edge.getSource());
            int target = m.get(edge.getTarget());
            if (!input.hasEdge(source, target)) {
                throw new MatchException(MatchError.STRUCTURE_NOT_PRESERVED,
                        String.format("LHS edge %d -- %d maps to %d -- %d, which is not an input edge",
                                edge.getSource(), edge.getTarget(), source, target));
            }
        }

        if (requireInduced) {
            checkInduced(lhs, input, lhsNodes, m);
        }

        log.debug("Match validated: {}", m);
        return new ValidatedMatch(restricted);
    }

    private void checkInduced(Graph lhs, Graph input, List<Integer> lhsNodes, Map<Integer, Integer> m) {
        for (int i = 0; i < lhsNodes.size(); i++) {
            for (int j = i + 1; j < lhsNodes.size(); j++) {
                int a = lhsNodes.get(i);
                int b = lhsNodes.get(j);
                if (!lhs.hasEdge(a, b) && input.hasEdge(m.get(a), m.get(b))) {
                    throw new MatchException(MatchError.EXTRA_INPUT_EDGE,
                            String.format("Input edge %d -- %d has no LHS counterpart between %d and %d",
                                    m.get(a), m.get(b), a, b));
                }
            }
        }
    }
}
