package com.layoutparser.generator.codegen.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.layoutparser.generator.codegen.ElementNames;
import com.layoutparser.generator.model.LinkMapping;

/**
 * Produces the ordered list of XPath expressions that may locate a link mapping's value
 * in the intermediate record. Pure: the same inputs always give the same list.
 *
 * Order: learned hint, each known line (exact element name, raw mapping name), each
 * known line case-insensitively, anywhere by exact and case-insensitive name, substring
 * containment, normalized name, and finally direct children of the document root.
 */
public class LookupCandidateRanker {

    public static final List<String> DEFAULT_LINES = List.of(
            "HEADER", "LINHA000", "LINHA001", "LINHA002", "LINHA003", "TRAILER",
            "A", "B", "C", "D", "E", "F", "G", "H", "chave");

    static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String LOWER = "abcdefghijklmnopqrstuvwxyz";

    private final int maxEmbedded;

    public LookupCandidateRanker(int maxEmbedded) {
        this.maxEmbedded = maxEmbedded;
    }

    public LookupPlan plan(LinkMapping link, List<String> inputLines, Map<String, String> learnedHints) {
        String rawName = stripTargetPrefix(link.getName());
        List<String> segments = Arrays.stream(rawName.split("/")).filter(s -> !s.isBlank()).toList();
        String lastSegment = segments.isEmpty() ? rawName : segments.get(segments.size() - 1);
        String elementName = ElementNames.sanitize(lastSegment);

        List<String> candidates = rank(elementName, lastSegment, rawName, knownLines(inputLines),
                learnedHints.get(elementName));

        LookupPlan.LookupPlanBuilder plan = LookupPlan.builder()
                .mappingName(link.getName())
                .elementName(elementName)
                .candidates(candidates)
                .defaultValue(link.getDefaultValue())
                .emitWhenUnmatched(link.hasDefaultValue() || !link.isAllowEmpty());
        segments.subList(0, Math.max(0, segments.size() - 1)).forEach(s -> plan.targetSegment(ElementNames.sanitize(s)));
        plan.targetSegment(elementName);
        candidates.stream().limit(maxEmbedded).forEach(plan::embedded);
        return plan.build();
    }

    List<String> rank(String elementName, String rawName, String mappingName, List<String> lines, String learnedHint) {
        Set<String> ranked = new LinkedHashSet<>();
        if (learnedHint != null && !learnedHint.isBlank()) {
            ranked.add(learnedHint);
        }

        boolean rawUsable = ElementNames.isValid(rawName) && !rawName.equals(elementName);
        String lower = elementName.toLowerCase(Locale.ROOT);

        for (String line : lines) {
            ranked.add("ROOT/" + line + "/" + elementName);
            if (rawUsable) {
                ranked.add("ROOT/" + line + "/" + rawName);
            }
        }
        for (String line : lines) {
            ranked.add("ROOT/" + line + "/*[" + lowerCaseName() + "='" + lower + "']");
        }

        ranked.add("//" + elementName);
        ranked.add("//*[" + lowerCaseName() + "='" + lower + "']");

        if (!mappingName.equals(elementName) && mappingName.contains(elementName)) {
            ranked.add("//*[contains(local-name(), '" + elementName + "')]");
        }

        ranked.add("//*[translate(local-name(), '" + UPPER + "_', '" + LOWER + "')='"
                + ElementNames.normalizedKey(elementName) + "']");

        ranked.add("/*/" + elementName);

        return new ArrayList<>(ranked);
    }

    private static String lowerCaseName() {
        return "translate(local-name(), '" + UPPER + "', '" + LOWER + "')";
    }

    private static List<String> knownLines(List<String> inputLines) {
        Set<String> lines = new LinkedHashSet<>(DEFAULT_LINES);
        if (inputLines != null) {
            lines.addAll(inputLines);
        }
        return new ArrayList<>(lines);
    }

    static String stripTargetPrefix(String name) {
        if (name == null) {
            return "";
        }
        String trimmed = name.trim();
        return trimmed.startsWith("T.") ? trimmed.substring(2) : trimmed;
    }
}
