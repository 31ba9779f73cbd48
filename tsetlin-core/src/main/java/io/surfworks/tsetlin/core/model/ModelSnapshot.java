package io.surfworks.tsetlin.core.model;

import io.surfworks.tsetlin.core.tensor.ClauseTensor;
import io.surfworks.tsetlin.core.tensor.WeightTensor;

import java.util.List;

/**
 * Read-only copy of a dense machine: header, weights and canonical automaton states.
 *
 * @param parameters   header scalars
 * @param weights      (clauses, classes) weights
 * @param states       (clauses, literals, 2) states in canonical order
 * @param literalNames one name per literal, or empty when none are known
 */
public record ModelSnapshot(
        ModelParameters parameters,
        WeightTensor weights,
        ClauseTensor states,
        List<String> literalNames
) {

    public ModelSnapshot {
        if (weights.numClauses() != parameters.numClauses() || weights.numClasses() != parameters.numClasses()) {
            throw new IllegalArgumentException(String.format(
                    "Weights %s disagree with parameters (clauses=%d, classes=%d)",
                    weights, parameters.numClauses(), parameters.numClasses()));
        }
        if (states.numClauses() != parameters.numClauses() || states.numLiterals() != parameters.numLiterals()) {
            throw new IllegalArgumentException(String.format(
                    "States %s disagree with parameters (clauses=%d, literals=%d)",
                    states, parameters.numClauses(), parameters.numLiterals()));
        }
        literalNames = literalNames == null ? List.of() : List.copyOf(literalNames);
        if (!literalNames.isEmpty() && literalNames.size() != parameters.numLiterals()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d literal names, got %d", parameters.numLiterals(), literalNames.size()));
        }
    }

    public ModelSnapshot(ModelParameters parameters, WeightTensor weights, ClauseTensor states) {
        this(parameters, weights, states, List.of());
    }

    public ModelSnapshot withLiteralNames(List<String> names) {
        return new ModelSnapshot(parameters, weights, states, names);
    }

    public boolean hasLiteralNames() {
        return !literalNames.isEmpty();
    }
}
