package com.layoutparser.generator.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.FieldKind;

/**
 * Name based heuristics: which fields are monetary, how many decimal places they carry,
 * and which {@link FieldKind} a field name suggests.
 *
 * <p>The table is loaded from {@code field-heuristics.properties} so it can be tuned per
 * installation without touching the generators.</p>
 */
public class FieldHeuristics {

    private static final Logger log = LoggerFactory.getLogger(FieldHeuristics.class);

    public static final String DEFAULT_RESOURCE = "/field-heuristics.properties";

    private final List<String> monetaryTokens;
    private final Pattern monetaryPrefix;
    private final Pattern decimalPlacesPattern;
    private final int defaultDecimalPlaces;
    private final Map<FieldKind, List<String>> kindTokens;

    FieldHeuristics(Properties props) {
        this.monetaryTokens = splitList(props.getProperty("monetary.tokens", ""));
        this.monetaryPrefix = Pattern.compile(props.getProperty("monetary.prefix.pattern", "^v[A-Z]"));
        this.decimalPlacesPattern = Pattern.compile(props.getProperty("decimal.places.pattern", "(\\d+),(\\d+)"));
        this.defaultDecimalPlaces = Integer.parseInt(props.getProperty("decimal.places.default", "2").trim());

        Map<FieldKind, List<String>> tokens = new LinkedHashMap<>();
        for (String kindName : splitList(props.getProperty("kind.order", ""))) {
            FieldKind kind = FieldKind.valueOf(kindName.toUpperCase(Locale.ROOT));
            tokens.put(kind, splitList(props.getProperty("kind." + kind.name(), "")).stream()
                    .map(t -> t.toUpperCase(Locale.ROOT))
                    .toList());
        }
        this.kindTokens = tokens;
    }

    public static FieldHeuristics defaults() {
        try (InputStream in = FieldHeuristics.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new StructureException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            Properties props = new Properties();
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return new FieldHeuristics(props);
        } catch (IOException e) {
            throw new StructureException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public static FieldHeuristics load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(reader);
            log.debug("Loaded field heuristics from {}", file);
            return new FieldHeuristics(props);
        } catch (IOException e) {
            throw new StructureException("Cannot read field heuristics " + file, e);
        }
    }

    /**
     * True when the field name denotes a monetary amount and is emitted with decimal places.
     */
    public boolean isMonetary(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return false;
        }
        if (monetaryPrefix.matcher(fieldName).find()) {
            return true;
        }
        return monetaryTokens.stream().anyMatch(fieldName::contains);
    }

    public int decimalPlaces(String description) {
        if (description != null) {
            Matcher m = decimalPlacesPattern.matcher(description);
            if (m.find()) {
                return Integer.parseInt(m.group(2));
            }
        }
        return defaultDecimalPlaces;
    }

    public FieldKind inferKind(String fieldName) {
        if (fieldName == null) {
            return FieldKind.TEXT;
        }
        String upper = fieldName.toUpperCase(Locale.ROOT);
        for (Map.Entry<FieldKind, List<String>> entry : kindTokens.entrySet()) {
            if (entry.getValue().stream().anyMatch(upper::contains)) {
                return entry.getKey();
            }
        }
        if (isMonetary(fieldName)) {
            return FieldKind.DECIMAL;
        }
        return FieldKind.TEXT;
    }

    private static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
