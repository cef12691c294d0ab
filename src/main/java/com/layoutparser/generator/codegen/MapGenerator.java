package com.layoutparser.generator.codegen;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.config.FieldHeuristics;
import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.FieldDef;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;

/**
 * Generates the positional parse map (TCL) for a layout.
 *
 * Lines are ordered by their sequence key (HEADER first, numbered lines by number,
 * TRAILER last) and each field is written with its width, monetary fields with
 * {@code width,decimals,0}.
 */
public class MapGenerator {

    private static final Logger log = LoggerFactory.getLogger(MapGenerator.class);

    static final String TEMPLATE = "map.tcl.ftl";

    private final FieldHeuristics heuristics;
    private final TemplateEngine templateEngine;

    public MapGenerator(FieldHeuristics heuristics, TemplateEngine templateEngine) {
        this.heuristics = heuristics;
        this.templateEngine = templateEngine;
    }

    public String generate(Layout layout) {
        return render(build(layout));
    }

    public GeneratedMap build(Layout layout) {
        if (layout.getLines().isEmpty()) {
            throw new StructureException("Layout " + layout.getName() + " has no lines");
        }

        List<LineDef> ordered = new ArrayList<>(layout.getLines());
        // List.sort is stable, so lines sharing a key keep their declared order
        ordered.sort(Comparator.comparingInt(l -> LineIdentifiers.sequenceKeyFor(l.getName())));

        GeneratedMap.GeneratedMapBuilder map = GeneratedMap.builder().layoutName(layout.getName());
        for (LineDef line : ordered) {
            map.line(buildLine(layout, line));
        }

        GeneratedMap result = map.build();
        log.debug("Built map for {} with {} lines", layout.getName(), result.getLines().size());
        return result;
    }

    public String render(GeneratedMap map) {
        return templateEngine.render(TEMPLATE, Map.of("map", map, "lines", map.getLines()));
    }

    private GeneratedMap.MapLine buildLine(Layout layout, LineDef line) {
        if (line.getFields().isEmpty() && !line.isHeader() && !line.isTrailer()) {
            throw new StructureException("Line " + line.getName() + " of layout " + layout.getName() + " has no fields");
        }

        GeneratedMap.MapLine.MapLineBuilder mapLine = GeneratedMap.MapLine.builder()
                .identifier(LineIdentifiers.identifierFor(line.getName()))
                .name(line.getName())
                .sequenceKey(LineIdentifiers.sequenceKeyFor(line.getName()));

        line.getFields().stream()
                .sorted(Comparator.comparingInt(FieldDef::getSequence))
                .forEach(field -> mapLine.field(new GeneratedMap.MapField(
                        ElementNames.toMapFieldName(field.getName()), lengthOf(field))));

        layout.childLinesOf(line.getName()).forEach(child -> mapLine.child(child.getName()));

        return mapLine.build();
    }

    FieldLength lengthOf(FieldDef field) {
        if (heuristics.isMonetary(field.getName())) {
            return FieldLength.decimal(field.getLength(), heuristics.decimalPlaces(field.getDescription()));
        }
        return FieldLength.plain(field.getLength());
    }
}
