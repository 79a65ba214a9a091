package com.tpgsweep.orchestrator.materialize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.model.ParameterTuple;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A loaded trainParams.json / params.json.
 *
 * The handful of keys the orchestrator reads have typed accessors; every
 * other key is reachable through {@link #extensions()} and is written back
 * untouched. Key order is preserved.
 */
public class ConfigDocument {

    static final String SEED           = ParameterTuple.SEED;
    static final String INSTR_TYPE     = ParameterTuple.DATA_TYPE;
    static final String INSTR_SET_NAME = ParameterTuple.INSTRUCTION_SET_NAME;

    private final Path       source;
    private final ObjectNode root;

    ConfigDocument(Path source, ObjectNode root) {
        this.source = source;
        this.root   = root;
    }

    public Path source() { return source; }

    ObjectNode node() { return root; }

    // ------------------------------------------------------------------
    // Typed accessors
    // ------------------------------------------------------------------

    public Optional<Integer> seed() {
        JsonNode n = root.get(SEED);
        return n != null && n.canConvertToInt() ? Optional.of(n.asInt()) : Optional.empty();
    }

    /** Raw {@code instrType} tag as written in the document. */
    public Optional<String> dataTypeTag() {
        return text(INSTR_TYPE);
    }

    /**
     * @throws com.tpgsweep.orchestrator.model.UnknownDataTypeException if the tag is unrecognised
     */
    public Optional<DataType> dataType() {
        return dataTypeTag().map(DataType::fromTag);
    }

    public Optional<String> instructionSetName() {
        return text(INSTR_SET_NAME);
    }

    /** All keys other than the typed ones, as plain Java values. */
    public Map<String, Object> extensions() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> e : root.properties()) {
            String k = e.getKey();
            if (!k.equals(SEED) && !k.equals(INSTR_TYPE) && !k.equals(INSTR_SET_NAME)) {
                out.put(k, ConfigDocuments.toPlain(e.getValue()));
            }
        }
        return out;
    }

    public boolean has(String key) {
        return root.has(key);
    }

    // ------------------------------------------------------------------
    // Mutation
    // ------------------------------------------------------------------

    /**
     * Overwrite {@code key} only if the document already declares it.
     *
     * @return false when the key is absent (the document is left unchanged)
     */
    public boolean overrideExisting(String key, Object value) {
        if (!root.has(key)) {
            return false;
        }
        put(key, value);
        return true;
    }

    /** Set {@code key}, adding it if absent. */
    public void put(String key, Object value) {
        if (value instanceof Integer i)      root.put(key, i);
        else if (value instanceof Long l)    root.put(key, l);
        else if (value instanceof Boolean b) root.put(key, b);
        else if (value instanceof Double d)  root.put(key, d);
        else                                 root.put(key, String.valueOf(value));
    }

    private Optional<String> text(String key) {
        JsonNode n = root.get(key);
        return n != null && !n.isNull() ? Optional.of(n.asText()) : Optional.empty();
    }
}
