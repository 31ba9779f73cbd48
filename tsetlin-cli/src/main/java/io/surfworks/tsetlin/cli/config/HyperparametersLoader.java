package io.surfworks.tsetlin.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.tsetlin.core.model.Hyperparameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves {@link Hyperparameters} as JSON.
 *
 * <pre>
 * {
 *   "numClauses": 1000, "threshold": 1000, "maxState": 127, "minState": -127,
 *   "boostTruePositiveFeedback": false, "sensitivity": 3.0, "epochs": 10, "randomState": 42
 * }
 * </pre>
 *
 * <p>Missing keys keep their defaults. {@code "randomState": null} or an absent key draws fresh seeds.
 */
public final class HyperparametersLoader {

    private static final ObjectMapper JSON = new ObjectMapper();

    private HyperparametersLoader() {
    }

    /**
     * Loads hyperparameters from {@code file}, or returns the defaults when it does not exist.
     *
     * @throws IOException if the file is not valid JSON
     * @throws io.surfworks.tsetlin.core.classifier.ClassifierException if a value is out of range
     */
    public static Hyperparameters load(Path file) throws IOException {
        Hyperparameters defaults = Hyperparameters.defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        JsonNode root = JSON.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object in " + file);
        }

        Hyperparameters.Builder builder = defaults.toBuilder()
                .numClauses(getInt(root, "numClauses", defaults.numClauses()))
                .threshold(getInt(root, "threshold", defaults.threshold()))
                .maxState(getInt(root, "maxState", defaults.maxState()))
                .minState(getInt(root, "minState", defaults.minState()))
                .boostTruePositiveFeedback(root.has("boostTruePositiveFeedback")
                        ? root.get("boostTruePositiveFeedback").asBoolean()
                        : defaults.boostTruePositiveFeedback())
                .sensitivity((float) (root.has("sensitivity")
                        ? root.get("sensitivity").asDouble()
                        : defaults.sensitivity()))
                .epochs(getInt(root, "epochs", defaults.epochs()));

        JsonNode seed = root.get("randomState");
        builder.randomState(seed == null || seed.isNull() ? null : seed.asLong());
        return builder.build();
    }

    /**
     * Writes hyperparameters to {@code file}, creating parent directories as needed.
     */
    public static void save(Hyperparameters hp, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("numClauses", hp.numClauses());
        root.put("threshold", hp.threshold());
        root.put("maxState", hp.maxState());
        root.put("minState", hp.minState());
        root.put("boostTruePositiveFeedback", hp.boostTruePositiveFeedback());
        root.put("sensitivity", hp.sensitivity());
        root.put("epochs", hp.epochs());
        if (hp.randomState() != null) {
            root.put("randomState", hp.randomState());
        } else {
            root.putNull("randomState");
        }

        JSON.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
    }

    private static int getInt(JsonNode node, String field, int defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer, got " + value);
        }
        return value.asInt();
    }
}
