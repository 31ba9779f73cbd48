package io.surfworks.tsetlin.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.surfworks.tsetlin.cli.config.HyperparametersLoader;
import io.surfworks.tsetlin.core.classifier.ClassifierException;
import io.surfworks.tsetlin.core.classifier.DenseTsetlinClassifier;
import io.surfworks.tsetlin.core.classifier.SparseTsetlinClassifier;
import io.surfworks.tsetlin.core.classifier.TsetlinClassifier;
import io.surfworks.tsetlin.core.dataset.NoisyXor;
import io.surfworks.tsetlin.core.engine.EngineBinding;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineException;
import io.surfworks.tsetlin.core.engine.EngineProvider;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.engine.Engines;
import io.surfworks.tsetlin.core.estimate.ModelSizeEstimator;
import io.surfworks.tsetlin.core.estimate.SizeBreakdown;
import io.surfworks.tsetlin.core.model.Hyperparameters;
import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.model.ModelSnapshot;
import io.surfworks.tsetlin.core.model.SparseModelSnapshot;
import io.surfworks.tsetlin.data.format.HeaderLayout;
import io.surfworks.tsetlin.data.format.ModelFormat;
import io.surfworks.tsetlin.data.format.RawBinaryFormat;
import io.surfworks.tsetlin.data.format.SelfDescribingFormat;
import io.surfworks.tsetlin.data.format.SensitivityEncoding;
import io.surfworks.tsetlin.data.format.SparseBinaryFormat;
import io.surfworks.tsetlin.data.store.ModelStore;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tsetlin CLI - model inspection, conversion and sizing.
 *
 * <p>Commands:
 * <ul>
 *   <li>inspect - Print the header of a model file</li>
 *   <li>convert - Rewrite a model file in another format</li>
 *   <li>estimate-size - Estimate the in-memory size of a machine</li>
 *   <li>engine-info - Show engine providers and capabilities</li>
 *   <li>noisy-xor - Train on a generated noisy XOR dataset</li>
 *   <li>init-config - Write a hyperparameter file with the defaults</li>
 * </ul>
 */
public class TsetlinCli {

    private static final String VERSION = "0.1.0";
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final PrintStream out;
    private final PrintStream err;

    TsetlinCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new TsetlinCli(System.out, System.err).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one command and returns the process exit status.
     */
    int run(String[] args) {
        if (hasFlag(args, "--verbose")) {
            enableVerboseLogging();
            args = Arrays.stream(args).filter(a -> !a.equals("--verbose")).toArray(String[]::new);
        }
        if (args.length == 0) {
            printHelp();
            return 0;
        }

        String command = args[0];

        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return 0;
        }
        if (command.equals("--version") || command.equals("-v")) {
            out.println("tsetlin " + VERSION);
            return 0;
        }
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        try {
            switch (command) {
                case "inspect" -> handleInspect(commandArgs);
                case "convert" -> handleConvert(commandArgs);
                case "estimate-size" -> handleEstimateSize(commandArgs);
                case "engine-info" -> handleEngineInfo(commandArgs);
                case "noisy-xor" -> handleNoisyXor(commandArgs);
                case "init-config" -> handleInitConfig(commandArgs);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'tsetlin --help' for usage.");
                    return 1;
                }
            }
            return 0;
        } catch (EngineException e) {
            err.println("Engine error (" + e.errorCode() + "): " + e.getMessage());
            return 1;
        } catch (ClassifierException e) {
            err.println("Classifier error (" + e.errorCode() + "): " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    // ===== inspect =====

    private void handleInspect(String[] args) throws IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            out.println("Usage: tsetlin inspect <model> [--format raw|sparse-raw|fbs] [--layout aligned|packed]"
                    + " [--engine-saved] [--json]");
            return;
        }
        Path model = Path.of(args[0]);
        ModelFormat format = formatOf(args, "--format", model);
        ModelStore store = store(args);
        boolean json = hasFlag(args, "--json");

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("file", model.toString());
        report.put("format", format.name());
        SizeBreakdown size;
        List<String> names = List.of();
        if (format == ModelFormat.SPARSE_RAW) {
            SparseModelSnapshot sparse = sparseFormat(args).read(model);
            putParameters(report, sparse.parameters());
            report.put("activeAutomata", sparse.states().totalNodes());
            size = ModelSizeEstimator.sparse(sparse.states().literalCounts(), sparse.parameters().numClasses());
        } else {
            ModelSnapshot snapshot = store.readSnapshot(model, format);
            ModelParameters p = snapshot.parameters();
            putParameters(report, p);
            names = snapshot.literalNames();
            size = ModelSizeEstimator.dense(p.numClauses(), p.numLiterals(), p.numClasses());
        }
        report.put("literalNames", names);
        report.put("estimatedBytes", size.totalBytes());

        if (json) {
            out.println(JSON.writeValueAsString(report));
        } else {
            report.forEach((key, value) -> out.printf("%-22s %s%n", key + ":", value));
        }
    }

    private static void putParameters(Map<String, Object> report, ModelParameters p) {
        report.put("threshold", p.threshold());
        report.put("numLiterals", p.numLiterals());
        report.put("numClauses", p.numClauses());
        report.put("numClasses", p.numClasses());
        report.put("maxState", p.maxState());
        report.put("minState", p.minState());
        report.put("boostTruePositiveFeedback", p.boostTruePositive());
        report.put("sensitivity", p.sensitivity());
    }

    // ===== convert =====

    private void handleConvert(String[] args) throws IOException {
        if (args.length < 2 || hasFlag(args, "--help")) {
            out.println("Usage: tsetlin convert <in> <out> [--from <format>] [--to <format>]"
                    + " [--layout aligned|packed] [--engine-saved] [--literal-names]");
            return;
        }
        Path source = Path.of(args[0]);
        Path target = Path.of(args[1]);
        ModelFormat from = formatOf(args, "--from", source);
        ModelFormat to = formatOf(args, "--to", target);

        if (from == ModelFormat.SPARSE_RAW) {
            ModelSnapshot dense = sparseFormat(args).read(source).toDense();
            store(args).write(dense, target, to);
        } else {
            store(args).convert(source, from, target, to);
        }
        out.println("Converted " + source + " (" + from + ") -> " + target + " (" + to + ")");
    }

    // ===== estimate-size =====

    private void handleEstimateSize(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: tsetlin estimate-size --clauses <n> --literals <n> --classes <n> [--json]");
            out.println("       tsetlin estimate-size --clause-sizes <a,b,...> --classes <n> [--pointer-bytes <n>] [--json]");
            out.println("       tsetlin estimate-size --model <file> [--format <format>] [--json]");
            return;
        }
        SizeBreakdown size;
        String modelArg = getFlagValue(args, "--model");
        String clauseSizes = getFlagValue(args, "--clause-sizes");
        if (modelArg != null) {
            Path model = Path.of(modelArg);
            ModelFormat format = formatOf(args, "--format", model);
            if (format == ModelFormat.SPARSE_RAW) {
                SparseModelSnapshot sparse = sparseFormat(args).read(model);
                size = ModelSizeEstimator.sparse(sparse.states().literalCounts(), sparse.parameters().numClasses());
            } else {
                ModelParameters p = store(args).readParameters(model, format);
                size = ModelSizeEstimator.dense(p.numClauses(), p.numLiterals(), p.numClasses());
            }
        } else if (clauseSizes != null) {
            int[] sizes = Arrays.stream(clauseSizes.split(","))
                    .map(String::trim)
                    .mapToInt(Integer::parseInt)
                    .toArray();
            size = ModelSizeEstimator.sparse(sizes, requiredInt(args, "--classes"),
                    optionalInt(args, "--pointer-bytes", ModelSizeEstimator.DEFAULT_POINTER_BYTES));
        } else {
            size = ModelSizeEstimator.dense(requiredInt(args, "--clauses"), requiredInt(args, "--literals"),
                    requiredInt(args, "--classes"));
        }

        if (hasFlag(args, "--json")) {
            out.println(JSON.writeValueAsString(new SizeResponse(size.entries(), size.totalBytes())));
        } else {
            for (SizeBreakdown.Entry entry : size.entries()) {
                out.printf("%-26s %,14d bytes%n", entry.name(), entry.bytes());
            }
            out.printf("%-26s %,14d bytes%n", "total", size.totalBytes());
        }
    }

    // ===== engine-info =====

    private void handleEngineInfo(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: tsetlin engine-info [--lib-dir <dir>] [--mock] [--json]");
            return;
        }
        EngineConfig config = engineConfig(args);

        List<String> providers = new ArrayList<>();
        for (EngineProvider provider : Engines.providers()) {
            providers.add(provider.name());
        }
        List<VariantInfo> variants = new ArrayList<>();
        for (EngineVariant variant : EngineVariant.values()) {
            try {
                EngineBinding binding = Engines.load(config, variant);
                List<String> caps = binding.capabilities().stream().map(EngineCapability::name).sorted().toList();
                variants.add(new VariantInfo(variant.name(), true, binding.backendName(), caps, null));
            } catch (EngineException e) {
                variants.add(new VariantInfo(variant.name(), false, null, List.of(), e.getMessage()));
            }
        }

        if (hasFlag(args, "--json")) {
            out.println(JSON.writeValueAsString(new EngineInfoResponse(config.mode(),
                    config.libraryDirectory(), providers, variants)));
        } else {
            out.println("Mode:              " + config.mode());
            out.println("Library directory: " + (config.libraryDirectory() != null ? config.libraryDirectory() : "(default search path)"));
            out.println("Providers:         " + (providers.isEmpty() ? "(none)" : String.join(", ", providers)));
            for (VariantInfo info : variants) {
                if (info.available()) {
                    out.println(info.variant() + ": available via " + info.backend() + " " + info.capabilities());
                } else {
                    out.println(info.variant() + ": unavailable (" + info.error() + ")");
                }
            }
        }
    }

    // ===== noisy-xor =====

    private void handleNoisyXor(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: tsetlin noisy-xor [--config <hp.json>] [--samples <n>] [--noise <p>] [--seed <n>]");
            out.println("                         [--train-rows <n>] [--sparse] [--lib-dir <dir>] [--mock]");
            out.println("                         [--save <file>] [--json]");
            return;
        }
        String configArg = getFlagValue(args, "--config");
        Hyperparameters hp = configArg != null
                ? HyperparametersLoader.load(Path.of(configArg))
                : Hyperparameters.builder().numClauses(10).threshold(15).sensitivity(3.9f).epochs(50).build();

        NoisyXor generator = NoisyXor.defaults()
                .withSamples(optionalInt(args, "--samples", NoisyXor.DEFAULT_SAMPLES))
                .withNoise(optionalDouble(args, "--noise", NoisyXor.DEFAULT_NOISE))
                .withSeed(optionalInt(args, "--seed", (int) NoisyXor.DEFAULT_SEED));
        NoisyXor.Dataset data = generator.generate();
        NoisyXor.Split split = data.split(optionalInt(args, "--train-rows", data.x().rows() / 2));

        EngineConfig config = engineConfig(args);
        boolean sparse = hasFlag(args, "--sparse");
        String save = getFlagValue(args, "--save");
        ModelStore store = store(args);

        try (TsetlinClassifier<Integer> clf = sparse
                ? new SparseTsetlinClassifier<>(hp, config)
                : new DenseTsetlinClassifier<>(hp, config)) {
            long start = System.nanoTime();
            clf.fit(split.train().x(), split.train().y());
            long trainMillis = (System.nanoTime() - start) / 1_000_000;
            double accuracy = clf.score(split.test().x(), split.test().cleanY());

            if (save != null) {
                Path target = Path.of(save);
                if (clf instanceof DenseTsetlinClassifier<Integer> dense) {
                    store.save(dense, target, formatOf(args, "--format", target));
                } else {
                    store.save((SparseTsetlinClassifier<Integer>) clf, target);
                }
            }

            if (hasFlag(args, "--json")) {
                out.println(JSON.writeValueAsString(new NoisyXorResponse(clf.variant().name(),
                        split.train().x().rows(), split.test().x().rows(), accuracy, trainMillis,
                        clf.estimateModelSize().totalBytes())));
            } else {
                out.printf("Variant:        %s%n", clf.variant());
                out.printf("Train rows:     %d (%d ms)%n", split.train().x().rows(), trainMillis);
                out.printf("Test accuracy:  %.4f%n", accuracy);
                out.printf("Model size:     %,d bytes%n", clf.estimateModelSize().totalBytes());
                if (save != null) {
                    out.println("Saved to:       " + save);
                }
            }
        }
    }

    // ===== init-config =====

    private void handleInitConfig(String[] args) throws IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            out.println("Usage: tsetlin init-config <file>");
            return;
        }
        Path file = Path.of(args[0]);
        HyperparametersLoader.save(Hyperparameters.defaults(), file);
        out.println("Wrote " + file);
    }

    // ===== Option helpers =====

    private static ModelStore store(String[] args) {
        return new ModelStore(rawFormat(args), sparseFormat(args),
                hasFlag(args, "--literal-names") ? SelfDescribingFormat.withLiteralNames()
                        : SelfDescribingFormat.standard());
    }

    private static RawBinaryFormat rawFormat(String[] args) {
        String layout = getFlagValue(args, "--layout");
        HeaderLayout headerLayout = layout == null ? HeaderLayout.ALIGNED
                : HeaderLayout.valueOf(layout.toUpperCase(Locale.ROOT));
        if (hasFlag(args, "--engine-saved")) {
            return new RawBinaryFormat(HeaderLayout.PACKED, SensitivityEncoding.FLOAT32_LOW_WORD);
        }
        return new RawBinaryFormat(headerLayout, SensitivityEncoding.FLOAT64);
    }

    private static SparseBinaryFormat sparseFormat(String[] args) {
        return hasFlag(args, "--engine-saved") ? SparseBinaryFormat.engineSaved() : SparseBinaryFormat.standard();
    }

    private static ModelFormat formatOf(String[] args, String flag, Path file) {
        String value = getFlagValue(args, flag);
        return value != null ? ModelFormat.parse(value) : ModelFormat.fromPath(file);
    }

    private static EngineConfig engineConfig(String[] args) {
        EngineConfig config = hasFlag(args, "--mock") ? EngineConfig.mock() : EngineConfig.fromSystemProperties();
        String libDir = getFlagValue(args, "--lib-dir");
        if (libDir != null) {
            config = config.withLibraryDirectory(Path.of(libDir));
        }
        return config;
    }

    private static int requiredInt(String[] args, String flag) {
        String value = getFlagValue(args, flag);
        if (value == null) {
            throw new IllegalArgumentException(flag + " is required");
        }
        return parseInt(flag, value);
    }

    private static int optionalInt(String[] args, String flag, int defaultValue) {
        String value = getFlagValue(args, flag);
        return value != null ? parseInt(flag, value) : defaultValue;
    }

    private static double optionalDouble(String[] args, String flag, double defaultValue) {
        String value = getFlagValue(args, flag);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " must be a number, got " + value);
        }
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " must be an integer, got " + value);
        }
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    // ===== Help output =====

    private void printHelp() {
        out.println("Tsetlin CLI - Tsetlin Machine model tool");
        out.println();
        out.println("Usage: tsetlin <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  inspect        Print the header of a model file");
        out.println("  convert        Rewrite a model file in another format");
        out.println("  estimate-size  Estimate the in-memory size of a machine");
        out.println("  engine-info    Show engine providers and capabilities");
        out.println("  noisy-xor      Train on a generated noisy XOR dataset");
        out.println("  init-config    Write a hyperparameter file with the defaults");
        out.println();
        out.println("Global options:");
        out.println("  --help, -h     Show this help");
        out.println("  --version, -v  Show version");
        out.println("  --verbose      Log engine and file activity");
        out.println();
        out.println("Model formats: raw (.bin), sparse-raw (.sbin), fbs (.fbs)");
    }

    record SizeResponse(List<SizeBreakdown.Entry> entries, long totalBytes) {}

    record VariantInfo(String variant, boolean available, String backend, List<String> capabilities, String error) {}

    record EngineInfoResponse(String mode, String libraryDirectory, List<String> providers,
                              List<VariantInfo> variants) {}

    record NoisyXorResponse(String variant, int trainRows, int testRows, double accuracy, long trainMillis,
                            long estimatedBytes) {}
}
