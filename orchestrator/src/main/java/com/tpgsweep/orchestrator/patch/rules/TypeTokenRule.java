package com.tpgsweep.orchestrator.patch.rules;

import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.patch.PatchRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces every standalone {@code double} keyword. Used on program bodies,
 * where all arithmetic is in the generator's default type.
 */
public class TypeTokenRule implements PatchRule {

    private static final Pattern TOKEN =
            Pattern.compile("\\b" + DataType.GENERATOR_DEFAULT.tag() + "\\b");

    @Override
    public String name() { return "type-token"; }

    @Override
    public String apply(String source, DataType target) {
        return TOKEN.matcher(source).replaceAll(Matcher.quoteReplacement(target.tag()));
    }
}
