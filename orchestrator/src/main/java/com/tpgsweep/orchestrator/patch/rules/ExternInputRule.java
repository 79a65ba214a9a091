package com.tpgsweep.orchestrator.patch.rules;

import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.patch.PatchRule;

import java.util.regex.Pattern;

/**
 * Deletes the {@code extern ... in<n>;} input declarations from program
 * bodies. The inference harness defines the inputs itself.
 */
public class ExternInputRule implements PatchRule {

    private static final Pattern EXTERN_INPUT =
            Pattern.compile("(?m)^extern\\s+.*\\bin[0-9]+\\s*;.*(?:\\r?\\n|$)");

    @Override
    public String name() { return "extern-inputs"; }

    @Override
    public String apply(String source, DataType target) {
        return EXTERN_INPUT.matcher(source).replaceAll("");
    }
}
