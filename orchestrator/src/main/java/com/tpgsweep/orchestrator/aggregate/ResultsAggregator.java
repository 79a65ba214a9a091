package com.tpgsweep.orchestrator.aggregate;

import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.materialize.ConfigDocument;
import com.tpgsweep.orchestrator.materialize.ConfigDocuments;
import com.tpgsweep.orchestrator.model.ExperimentUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the trainer metrics of completed units into one table.
 *
 * Units are visited in id order, never in completion order, so the same set
 * of units always gives the same table. A unit without a metrics file is
 * skipped; so is one whose file cannot be parsed.
 */
@Component
public class ResultsAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultsAggregator.class);

    public static final String SEED_COLUMN            = "seed";
    public static final String DATA_TYPE_COLUMN       = "dataType";
    public static final String INSTRUCTION_SET_COLUMN = "instructionSetName";

    static final List<String> TAG_COLUMNS = List.of(SEED_COLUMN, DATA_TYPE_COLUMN, INSTRUCTION_SET_COLUMN);

    private final SweepLayout     layout;
    private final ConfigDocuments configs;

    public ResultsAggregator(SweepLayout layout, ConfigDocuments configs) {
        this.layout  = layout;
        this.configs = configs;
    }

    /**
     * Build the table from every COMPLETED unit. FAILED units contribute nothing.
     */
    public ResultTable aggregate(List<ExperimentUnit> units) {
        ResultTable table = new ResultTable(TAG_COLUMNS);
        int skipped = 0;

        List<ExperimentUnit> completed = units.stream()
                .filter(ExperimentUnit::isCompleted)
                .sorted(Comparator.comparing(ExperimentUnit::getId))
                .toList();

        for (ExperimentUnit unit : completed) {
            Path metrics = layout.metricsFile(unit.getWorkDir());
            if (!Files.isRegularFile(metrics)) {
                log.warn("No metrics file for unit {} ({}), skipping", unit.getId(), metrics);
                skipped++;
                continue;
            }
            MetricsTable parsed;
            try {
                parsed = MetricsTable.read(metrics);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Unreadable metrics file for unit {}: {}", unit.getId(), e.getMessage());
                skipped++;
                continue;
            }
            Map<String, String> tags = tags(unit);
            for (Map<String, String> row : parsed.rows()) {
                Map<String, String> tagged = new LinkedHashMap<>(row);
                tagged.putAll(tags);
                table.addRow(tagged);
            }
        }

        log.info("Aggregated {} rows from {} completed units ({} skipped, {} not completed)",
                table.size(), completed.size() - skipped, skipped, units.size() - completed.size());
        return table;
    }

    /**
     * Aggregate and write the table as CSV.
     *
     * @throws UncheckedIOException if the output cannot be written
     */
    public ResultTable aggregateTo(List<ExperimentUnit> units, Path csv) {
        ResultTable table = aggregate(units);
        try {
            table.writeCsv(csv);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write results table " + csv, e);
        }
        log.info("Results table written to {}", csv);
        return table;
    }

    /**
     * seed / dataType / instructionSetName as recorded in the unit's
     * trainParams.json, falling back to the tuple when the file is unreadable.
     */
    private Map<String, String> tags(ExperimentUnit unit) {
        Map<String, String> tags = new LinkedHashMap<>();
        try {
            ConfigDocument doc = configs.read(layout.trainParams(unit.getWorkDir()));
            tags.put(SEED_COLUMN, doc.seed().map(String::valueOf).orElse(""));
            tags.put(DATA_TYPE_COLUMN, doc.dataTypeTag().orElse(""));
            tags.put(INSTRUCTION_SET_COLUMN, doc.instructionSetName().orElse(""));
        } catch (UncheckedIOException | IllegalArgumentException e) {
            log.warn("Cannot read config of unit {}, tagging from its tuple: {}", unit.getId(), e.getMessage());
            tags.put(SEED_COLUMN, String.valueOf(unit.getTuple().seed()));
            tags.put(DATA_TYPE_COLUMN, unit.getTuple().dataType().tag());
            tags.put(INSTRUCTION_SET_COLUMN, unit.getTuple().instructionSetName());
        }
        return tags;
    }
}
