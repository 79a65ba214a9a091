package com.tpgsweep.orchestrator.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.materialize.ConfigDocuments;
import com.tpgsweep.orchestrator.reconcile.InferenceArtifacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Summarises simulator latency results across seeds.
 *
 * Result documents are grouped by canonical TPG (directory name with its seed
 * token removed), then by microarchitecture and ISA. Two tables come out:
 * one row per seed, and one row per group with the mean of the seed means and
 * the mean of the seed standard deviations.
 */
@Component
public class InferenceResultsAggregator {

    private static final Logger log = LoggerFactory.getLogger(InferenceResultsAggregator.class);

    public static final String PER_SEED_FILE = "aggregated_tpg_results.csv";
    public static final String AVERAGED_FILE = "aggregated_averaged_tpg_results.csv";

    static final String PULP_EXTENSIONS = "_xcvalu_xcvbi_xcvbitmanip_xcvhwlp_xcvmac_xcvmem_xcvsimd";
    static final String PULP_ALIAS      = "_xpulp";

    static final List<String> PER_SEED_COLUMNS = List.of(
            "tpg_nickname", "uarch", "isa", "abi", "dtype", "seed", "tpg_mean_latency", "tpg_stddev_latency");
    static final List<String> AVERAGED_COLUMNS = List.of(
            "tpg_nickname", "uarch", "isa", "abi", "dtype", "mean_latency_avg", "mean_latency_stddev");

    private static final List<String> REQUIRED = List.of(
            "simulator", "isa", "abi", "dtype", "tpg_mean_latency", "tpg_stddev_latency");

    private static final Pattern SEED_TOKEN  = Pattern.compile("_seed-(\\d+)_");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    private static final Pattern DATA_TYPE   = Pattern.compile("instrType-(double|float|fixedpt)");

    private static final Comparator<GroupKey> GROUP_ORDER = Comparator
            .comparing(GroupKey::canonicalTpg)
            .thenComparing(GroupKey::uarch)
            .thenComparing(GroupKey::isa);

    private final SweepLayout        layout;
    private final ConfigDocuments    documents;
    private final InferenceArtifacts artifacts;

    public InferenceResultsAggregator(SweepLayout layout, ConfigDocuments documents, InferenceArtifacts artifacts) {
        this.layout    = layout;
        this.documents = documents;
        this.artifacts = artifacts;
    }

    /** Both summary tables plus the number of documents that were skipped. */
    public record Summary(ResultTable perSeed, ResultTable averaged, int skipped) {}

    /**
     * @throws IllegalStateException if the root has no training results directory
     */
    public Summary aggregate(Path root) {
        List<Path> files = artifacts.resultFiles(root);
        Map<GroupKey, List<InferenceResult>> groups = new TreeMap<>(GROUP_ORDER);
        int skipped = 0;

        for (Path file : files) {
            Optional<InferenceResult> result = load(file);
            if (result.isEmpty()) {
                skipped++;
                continue;
            }
            InferenceResult r = result.get();
            groups.computeIfAbsent(new GroupKey(r.canonicalTpg(), r.simulator(), r.isa()), k -> new ArrayList<>())
                  .add(r);
        }

        ResultTable perSeed  = new ResultTable(PER_SEED_COLUMNS);
        ResultTable averaged = new ResultTable(AVERAGED_COLUMNS);
        groups.forEach((key, results) -> {
            InferenceResult first = results.get(0);
            String nickname = nickname(key.canonicalTpg());

            double meanSum = 0;
            double stddevSum = 0;
            for (InferenceResult r : results) {
                Map<String, String> row = labels(nickname, first);
                row.put("seed", r.seed() == null ? "" : String.valueOf(r.seed()));
                row.put("tpg_mean_latency", plain(r.meanLatency()));
                row.put("tpg_stddev_latency", plain(r.stddevLatency()));
                perSeed.addRow(row);
                meanSum   += r.meanLatency();
                stddevSum += r.stddevLatency();
            }

            Map<String, String> row = labels(nickname, first);
            row.put("mean_latency_avg", plain(round2(meanSum / results.size())));
            row.put("mean_latency_stddev", plain(round2(stddevSum / results.size())));
            averaged.addRow(row);
        });

        if (skipped > 0) {
            log.info("Skipped {} of {} result documents", skipped, files.size());
        }
        if (perSeed.isEmpty()) {
            log.warn("No inference results aggregated under {}", root);
        }
        return new Summary(perSeed, averaged, skipped);
    }

    /**
     * Aggregate and write both tables into {@code outDir}.
     */
    public Summary aggregateTo(Path root, Path outDir) {
        Summary summary = aggregate(root);
        try {
            summary.perSeed().writeCsv(outDir.resolve(PER_SEED_FILE));
            summary.averaged().writeCsv(outDir.resolve(AVERAGED_FILE));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write inference summary to " + outDir, e);
        }
        log.info("Inference summary written to {} ({} rows, {} groups)",
                outDir, summary.perSeed().size(), summary.averaged().size());
        return summary;
    }

    // -------------------------------------------------------------------------
    // Parsing
    // -------------------------------------------------------------------------

    Optional<InferenceResult> load(Path file) {
        JsonNode node;
        try {
            node = documents.readTree(file);
        } catch (UncheckedIOException e) {
            log.warn("Failed to load result {}: {}", file, e.getCause().getMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("Result {} is not a JSON object", file);
            return Optional.empty();
        }
        List<String> missing = REQUIRED.stream().filter(k -> !node.has(k)).toList();
        if (!missing.isEmpty()) {
            log.warn("Result {} missing required keys {}", file, missing);
            return Optional.empty();
        }
        double mean;
        double stddev;
        try {
            mean   = Double.parseDouble(node.get("tpg_mean_latency").asText());
            stddev = Double.parseDouble(node.get("tpg_stddev_latency").asText());
        } catch (NumberFormatException e) {
            log.warn("Cannot parse latency numbers in {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        if (!Double.isFinite(mean) || !Double.isFinite(stddev)) {
            log.warn("Result {} has non-finite latency (mean={}, stddev={}), skipping", file, mean, stddev);
            return Optional.empty();
        }

        Path tpgDir;
        try {
            tpgDir = layout.tpgDirOfInferenceArtifact(file);
        } catch (IllegalArgumentException e) {
            log.warn("Unexpected path structure for {}, skipping", file);
            return Optional.empty();
        }
        String dirName = tpgDir.getFileName().toString();
        Matcher seed = SEED_TOKEN.matcher(dirName);

        return Optional.of(new InferenceResult(
                file,
                dirName,
                canonicalize(dirName),
                seed.find() ? Integer.valueOf(seed.group(1)) : null,
                node.get("simulator").asText(),
                foldPulpExtensions(node.get("isa").asText()),
                node.get("abi").asText(),
                node.get("dtype").asText(),
                mean,
                stddev));
    }

    static String foldPulpExtensions(String isa) {
        return isa.replace(PULP_EXTENSIONS, PULP_ALIAS);
    }

    /** Drop every {@code _seed-<n>_} token, collapse and trim underscores. */
    static String canonicalize(String tpgDirName) {
        String withoutSeed = SEED_TOKEN.matcher(tpgDirName).replaceAll("_");
        String collapsed = UNDERSCORES.matcher(withoutSeed).replaceAll("_");
        int start = 0;
        int end = collapsed.length();
        while (start < end && collapsed.charAt(start) == '_') start++;
        while (end > start && collapsed.charAt(end - 1) == '_') end--;
        return collapsed.substring(start, end);
    }

    /**
     * Compact label for plots and tables, built from the instruction flags
     * encoded in the canonical name. The Log2Exp2/Zmmul family gets its own
     * form.
     */
    static String nickname(String canonicalTpg) {
        Matcher dtypeMatch = DATA_TYPE.matcher(canonicalTpg);
        String dtype = dtypeMatch.find() ? dtypeMatch.group(1) : "unk";

        int expari = flag(canonicalTpg, "useInstrExpensiveArithmetic");
        if (hasFlag(canonicalTpg, "useInstrLog2Exp2") || hasFlag(canonicalTpg, "useInstrZmmul")) {
            return "l2e2" + flag(canonicalTpg, "useInstrLog2Exp2")
                    + "_zmu" + flag(canonicalTpg, "useInstrZmmul")
                    + "_expari" + expari + "-" + dtype;
        }
        return "trig" + flag(canonicalTpg, "useInstrTrig")
                + "_logexp" + flag(canonicalTpg, "useInstrLogExp")
                + "_expari" + expari + "-" + dtype;
    }

    private static boolean hasFlag(String name, String flag) {
        return flagPattern(flag).matcher(name).find();
    }

    private static int flag(String name, String flag) {
        Matcher m = flagPattern(flag).matcher(name);
        return m.find() && m.group(1).equals("True") ? 1 : 0;
    }

    private static Pattern flagPattern(String flag) {
        return Pattern.compile(Pattern.quote(flag) + "-(True|False)");
    }

    private static Map<String, String> labels(String nickname, InferenceResult r) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("tpg_nickname", nickname);
        row.put("uarch", r.simulator());
        row.put("isa", r.isa());
        row.put("abi", r.abi());
        row.put("dtype", r.dtype());
        return row;
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    private record GroupKey(String canonicalTpg, String uarch, String isa) {}
}
