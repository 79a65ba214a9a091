package com.tpgsweep.orchestrator.patch.rules;

import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.patch.PatchRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The running-best locals of bestProgram():
 * <pre>
 *   double bestScore = (isnan(results[0]))? -INFINITY : results[0];
 * </pre>
 * Integer targets lose the NaN / -INFINITY seed and get a plain assignment;
 * every other target only has the local retyped.
 */
public class SentinelIdiomRule implements PatchRule {

    private final String  variable;
    private final String  index;
    private final Pattern sentinel;
    private final Pattern declaration;

    public SentinelIdiomRule(String variable, String index) {
        this.variable = variable;
        this.index    = index;
        String element = "results\\[" + Pattern.quote(index) + "\\]";
        this.sentinel = Pattern.compile(
                "double " + variable + " = \\(isnan\\(" + element + "\\)\\)\\? -INFINITY : " + element + ";");
        this.declaration = Pattern.compile("double (" + variable + " =)");
    }

    @Override
    public String name() { return "sentinel-" + variable; }

    @Override
    public String apply(String source, DataType target) {
        if (!target.keepsSentinelIdiom()) {
            String plain = target.tag() + " " + variable + " = results[" + index + "];";
            return sentinel.matcher(source).replaceAll(Matcher.quoteReplacement(plain));
        }
        return declaration.matcher(source).replaceAll(Matcher.quoteReplacement(target.tag()) + " $1");
    }

    public static SentinelIdiomRule bestScore() {
        return new SentinelIdiomRule("bestScore", "0");
    }

    public static SentinelIdiomRule challengerScore() {
        return new SentinelIdiomRule("challengerScore", "i");
    }
}
