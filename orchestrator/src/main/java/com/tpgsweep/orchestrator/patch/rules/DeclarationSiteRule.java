package com.tpgsweep.orchestrator.patch.rules;

import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.patch.PatchRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Retypes a declaration the generator always emits with the default type.
 *
 * The pattern must capture the type keyword in group 1; only that group is
 * replaced, the rest of every match is kept as is.
 */
public class DeclarationSiteRule implements PatchRule {

    private final String  name;
    private final Pattern site;

    public DeclarationSiteRule(String name, String regex) {
        this.name = name;
        this.site = Pattern.compile(regex);
    }

    @Override
    public String name() { return name; }

    @Override
    public String apply(String source, DataType target) {
        Matcher m = site.matcher(source);
        StringBuilder out = new StringBuilder(source.length());
        int last = 0;
        while (m.find()) {
            out.append(source, last, m.start(1)).append(target.tag());
            last = m.end(1);
        }
        if (last == 0) {
            return source;
        }
        return out.append(source, last, source.length()).toString();
    }

    // -------------------------------------------------------------------------
    // Sites in the generator's output
    // -------------------------------------------------------------------------

    public static DeclarationSiteRule bestProgram() {
        return new DeclarationSiteRule("best-program-signature",
                "int bestProgram\\((double) \\*results, int nb\\)");
    }

    public static DeclarationSiteRule inferenceDefinition() {
        return new DeclarationSiteRule("inference-definition",
                "void inferenceTPG\\((double)\\* actions\\) \\{");
    }

    public static DeclarationSiteRule inferenceDeclaration() {
        return new DeclarationSiteRule("inference-declaration",
                "void inferenceTPG\\((double)\\* actions\\);");
    }

    public static DeclarationSiteRule teamScores() {
        return new DeclarationSiteRule("team-scores", "(double) T\\d+Scores");
    }

    public static DeclarationSiteRule programDeclarations() {
        return new DeclarationSiteRule("program-declarations", "(double) P\\d+\\(\\);");
    }
}
