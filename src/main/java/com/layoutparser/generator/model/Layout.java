package com.layoutparser.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named, ordered set of positional line definitions.
 */
@Value
@Builder(toBuilder = true)
public class Layout {

    public static final int DEFAULT_LINE_WIDTH = 600;

    @NonNull
    String id;
    @NonNull
    String name;
    String description;
    @Builder.Default
    LayoutType type = LayoutType.TEXT_POSITIONAL;
    @Builder.Default
    int lineWidth = DEFAULT_LINE_WIDTH;
    @Singular
    List<LineDef> lines;

    public Optional<LineDef> findLine(String lineName) {
        return lines.stream().filter(l -> l.getName().equalsIgnoreCase(lineName)).findFirst();
    }

    public List<LineDef> childLinesOf(String lineName) {
        return lines.stream().filter(l -> lineName.equalsIgnoreCase(l.getParentLine())).toList();
    }
}
