package io.surfworks.tsetlin.core.model;

import io.surfworks.tsetlin.core.tensor.SparseClauseState;
import io.surfworks.tsetlin.core.tensor.WeightTensor;

/**
 * Read-only copy of a sparse machine: header, weights and per-clause active automata.
 */
public record SparseModelSnapshot(
        ModelParameters parameters,
        WeightTensor weights,
        SparseClauseState states
) {

    public SparseModelSnapshot {
        if (weights.numClauses() != parameters.numClauses() || weights.numClasses() != parameters.numClasses()) {
            throw new IllegalArgumentException(String.format(
                    "Weights %s disagree with parameters (clauses=%d, classes=%d)",
                    weights, parameters.numClauses(), parameters.numClasses()));
        }
        if (states.numClauses() != parameters.numClauses() || states.numLiterals() != parameters.numLiterals()) {
            throw new IllegalArgumentException(String.format(
                    "Sparse states (%d clauses, %d literals) disagree with parameters (%d, %d)",
                    states.numClauses(), states.numLiterals(), parameters.numClauses(), parameters.numLiterals()));
        }
    }

    /**
     * Expands to a dense snapshot, filling inactive automata with the minimum state.
     */
    public ModelSnapshot toDense() {
        return new ModelSnapshot(parameters, weights, states.toDense(parameters.minState()));
    }
}
