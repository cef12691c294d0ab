package com.layoutparser.generator.validation;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;

/**
 * Finds the line definition a line of text belongs to.
 *
 * The longest matching initial value wins. Lines without a recognizable prefix fall back
 * to HEADER for the first line, then to the first definition without an initial value.
 */
public class LineResolver {

    private final Layout layout;
    private final List<LineDef> prefixed;

    public LineResolver(Layout layout) {
        this.layout = layout;
        this.prefixed = layout.getLines().stream()
                .filter(l -> l.getInitialValue() != null && !l.getInitialValue().isEmpty())
                .sorted(Comparator.comparingInt((LineDef l) -> l.getInitialValue().length()).reversed())
                .toList();
    }

    public Optional<LineDef> resolve(String text, int index) {
        if (text == null) {
            return Optional.empty();
        }
        for (LineDef def : prefixed) {
            if (text.startsWith(def.getInitialValue())) {
                return Optional.of(def);
            }
        }
        if (index == 0) {
            Optional<LineDef> header = layout.findLine(LineDef.HEADER);
            if (header.isPresent()) {
                return header;
            }
        }
        return layout.getLines().stream()
                .filter(l -> l.getInitialValue() == null || l.getInitialValue().isEmpty())
                .filter(l -> !l.isHeader())
                .findFirst();
    }
}
