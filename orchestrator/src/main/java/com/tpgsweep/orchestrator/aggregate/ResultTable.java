package com.tpgsweep.orchestrator.aggregate;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A table merged from many sources with column-union semantics.
 *
 * Data columns keep the order they were first seen in; the trailing columns
 * given at construction always come last. A row missing a column leaves that
 * cell empty.
 */
public class ResultTable {

    private static final CsvMapper CSV = new CsvMapper();

    private final List<String>              trailingColumns;
    private final Set<String>               dataColumns = new LinkedHashSet<>();
    private final List<Map<String, String>> rows        = new ArrayList<>();

    public ResultTable(List<String> trailingColumns) {
        this.trailingColumns = List.copyOf(trailingColumns);
    }

    public void addRow(Map<String, String> row) {
        for (String column : row.keySet()) {
            if (!trailingColumns.contains(column)) {
                dataColumns.add(column);
            }
        }
        rows.add(new LinkedHashMap<>(row));
    }

    public List<String> columns() {
        List<String> all = new ArrayList<>(dataColumns);
        all.addAll(trailingColumns);
        return all;
    }

    public List<Map<String, String>> rows() {
        return List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Cell value, empty if the row lacks the column. */
    public String value(int row, String column) {
        return rows.get(row).getOrDefault(column, "");
    }

    /** Comma-separated, header row first. */
    public void writeCsv(Path file) throws IOException {
        List<String> columns = columns();
        CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);

        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (SequenceWriter out = CSV.writer(schema.build().withHeader()).writeValues(file.toFile())) {
            for (Map<String, String> row : rows) {
                String[] cells = new String[columns.size()];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = row.getOrDefault(columns.get(i), "");
                }
                out.write(cells);
            }
        }
    }
}
