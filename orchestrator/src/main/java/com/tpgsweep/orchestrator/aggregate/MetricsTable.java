package com.tpgsweep.orchestrator.aggregate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A trainer metrics file: whitespace-delimited, first line ignored, second
 * line holds the column names, every further non-blank line is a row.
 *
 * Rows shorter than the header leave their trailing cells empty; cells
 * beyond the header are dropped.
 */
public record MetricsTable(List<String> columns, List<Map<String, String>> rows) {

    private static final String WHITESPACE = "\\s+";

    public MetricsTable {
        columns = List.copyOf(columns);
        rows    = List.copyOf(rows);
    }

    /**
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file has no header line
     */
    public static MetricsTable read(Path file) throws IOException {
        return parse(Files.readAllLines(file), file.toString());
    }

    static MetricsTable parse(List<String> lines, String source) {
        if (lines.size() < 2 || lines.get(1).isBlank()) {
            throw new IllegalArgumentException("No header line in metrics file " + source);
        }
        List<String> columns = Arrays.asList(lines.get(1).strip().split(WHITESPACE));

        List<Map<String, String>> rows = new ArrayList<>();
        for (String line : lines.subList(2, lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            String[] cells = line.strip().split(WHITESPACE);
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < cells.length ? cells[i] : "");
            }
            rows.add(row);
        }
        return new MetricsTable(columns, rows);
    }
}
