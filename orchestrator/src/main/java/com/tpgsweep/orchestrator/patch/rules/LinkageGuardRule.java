package com.tpgsweep.orchestrator.patch.rules;

import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.patch.PatchRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Wraps a header's declarations in {@code extern "C"} so the inference
 * harness can be built as C++.
 *
 * The opening guard goes after the first {@code #define} (the include
 * guard), the closing one before the last {@code #endif}. A header that
 * already mentions {@code extern "C"}, or lacks either anchor, is left alone.
 */
public class LinkageGuardRule implements PatchRule {

    private static final Logger log = LoggerFactory.getLogger(LinkageGuardRule.class);

    static final String MARKER = "extern \"C\"";

    private static final List<String> OPENING = List.of(
            "", "#ifdef __cplusplus", MARKER + " {", "#endif");
    private static final List<String> CLOSING = List.of(
            "#ifdef __cplusplus", "}", "#endif", "");

    @Override
    public String name() { return "linkage-guard"; }

    @Override
    public String apply(String source, DataType target) {
        if (source.contains(MARKER)) {
            return source;
        }
        List<String> lines = new ArrayList<>(Arrays.asList(source.split("\n", -1)));

        int define = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith("#define ")) {
                define = i;
                break;
            }
        }
        int endif = -1;
        for (int i = lines.size() - 1; i > define; i--) {
            if (lines.get(i).startsWith("#endif")) {
                endif = i;
                break;
            }
        }
        if (define < 0 || endif < 0) {
            log.warn("Header has no #define ... #endif pair, linkage guard not inserted");
            return source;
        }
        lines.addAll(endif, CLOSING);
        lines.addAll(define + 1, OPENING);
        return String.join("\n", lines);
    }
}
