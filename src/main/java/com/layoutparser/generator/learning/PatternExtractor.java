package com.layoutparser.generator.learning;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.layoutparser.generator.codegen.GeneratedMap;

/**
 * Turns generated artifacts into patterns that can be compared with learned ones.
 * Freshly generated patterns carry frequency 1 and confidence 1.
 */
public class PatternExtractor {

    private static final Pattern TEMPLATE = Pattern.compile(
            "<xsl:template\\s+match=\"([^\"]*)\"[^>]*>(.*?)</xsl:template>", Pattern.DOTALL);
    private static final Pattern LITERAL_ELEMENT = Pattern.compile("<(?!/|xsl:|!)[A-Za-z_][^>]*>");

    public List<LearnedPattern> fromMap(GeneratedMap map) {
        List<LearnedPattern> patterns = new ArrayList<>();
        for (GeneratedMap.MapLine line : map.getLines()) {
            String fields = line.getFields().stream()
                    .map(f -> f.getName() + "(" + f.getLengthAttribute() + ")")
                    .collect(Collectors.joining(","));
            int width = line.getFields().stream().mapToInt(f -> f.getLength().getWidth()).sum();
            patterns.add(LearnedPattern.builder()
                    .type(LearnedPattern.TCL_LINE)
                    .name(line.getName())
                    .pattern(line.getIdentifier() + ":" + fields)
                    .frequency(1)
                    .confidence(1.0)
                    .metadataEntry("identifier", line.getIdentifier())
                    .metadataEntry("fieldCount", line.getFields().size())
                    .metadataEntry("totalWidth", width)
                    .build());
        }
        return patterns;
    }

    public List<LearnedPattern> fromStylesheet(String stylesheet) {
        List<LearnedPattern> patterns = new ArrayList<>();
        if (stylesheet == null) {
            return patterns;
        }
        Matcher m = TEMPLATE.matcher(stylesheet);
        while (m.find()) {
            String match = m.group(1);
            String body = m.group(2).replaceAll("\\s+", " ").trim();
            patterns.add(LearnedPattern.builder()
                    .type(LearnedPattern.XSL_TEMPLATE)
                    .name(match)
                    .pattern(body)
                    .frequency(1)
                    .confidence(1.0)
                    .metadataEntry("match", match)
                    .metadataEntry("valueOfCount", count(body, "<xsl:value-of"))
                    .metadataEntry("chooseCount", count(body, "<xsl:choose"))
                    .metadataEntry("elementCount", countMatches(LITERAL_ELEMENT, body))
                    .build());
        }
        return patterns;
    }

    private static int count(String text, String token) {
        int count = 0;
        int index = text.indexOf(token);
        while (index >= 0) {
            count++;
            index = text.indexOf(token, index + token.length());
        }
        return count;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
