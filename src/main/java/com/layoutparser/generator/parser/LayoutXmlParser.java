package com.layoutparser.generator.parser;

import static com.layoutparser.generator.parser.XmlDocuments.boolValue;
import static com.layoutparser.generator.parser.XmlDocuments.child;
import static com.layoutparser.generator.parser.XmlDocuments.children;
import static com.layoutparser.generator.parser.XmlDocuments.intValue;
import static com.layoutparser.generator.parser.XmlDocuments.text;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.layoutparser.generator.config.FieldHeuristics;
import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.Alignment;
import com.layoutparser.generator.model.FieldDef;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LayoutType;
import com.layoutparser.generator.model.LineDef;

/**
 * Reads a layout definition document ({@code LayoutVO}) into a {@link Layout}.
 *
 * Lines are {@code Elements/Element} entries typed {@code LineElementVO}; their own
 * {@code Elements} hold fields ({@code FieldElementVO}) and nested child lines.
 */
public class LayoutXmlParser {

    private static final Logger log = LoggerFactory.getLogger(LayoutXmlParser.class);

    private static final String LINE_TYPE = "LineElementVO";
    private static final String FIELD_TYPE = "FieldElementVO";

    private final FieldHeuristics heuristics;

    public LayoutXmlParser(FieldHeuristics heuristics) {
        this.heuristics = heuristics;
    }

    public Layout parse(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StructureException("Cannot read layout file " + file, e);
        }
    }

    public Layout parse(String xml) {
        Document doc = XmlDocuments.parse(xml);
        Element root = doc.getDocumentElement();

        String name = text(root, "Name");
        if (name == null || name.isEmpty()) {
            throw new StructureException("Layout has no <Name>");
        }
        String id = text(root, "LayoutGuid", name);

        int limit = intValue(root, "LimitOfCaracters", 0);
        int lineWidth = limit > 0 ? limit : Layout.DEFAULT_LINE_WIDTH;

        List<LineDef> lines = new ArrayList<>();
        child(root, "Elements").ifPresent(elements -> {
            for (Element element : children(elements, "Element")) {
                if (XmlDocuments.xsiType(element).endsWith(LINE_TYPE)) {
                    collectLine(element, null, lines);
                }
            }
        });

        Layout layout = Layout.builder()
                .id(id)
                .name(name)
                .description(text(root, "Description"))
                .type(LayoutType.fromValue(text(root, "LayoutType")))
                .lineWidth(lineWidth)
                .lines(lines)
                .build();

        log.debug("Parsed layout {} with {} lines (width {})", name, lines.size(), lineWidth);
        return layout;
    }

    private void collectLine(Element lineElement, String parentLine, List<LineDef> sink) {
        String lineName = text(lineElement, "Name");
        if (lineName == null || lineName.isEmpty()) {
            throw new StructureException("Line element without <Name>");
        }

        LineDef.LineDefBuilder line = LineDef.builder()
                .name(lineName)
                .initialValue(text(lineElement, "InitialValue", ""))
                .sequence(intValue(lineElement, "Sequence", sink.size() + 1))
                .minOccurs(intValue(lineElement, "MinimalOccurrence", 1))
                .maxOccurs(intValue(lineElement, "MaximumOccurrence", 1))
                .required(boolValue(lineElement, "IsRequired", false))
                .parentLine(text(lineElement, "ParentElement", parentLine));

        List<Element> nestedLines = new ArrayList<>();
        int relativeStart = 0;
        for (Element element : child(lineElement, "Elements").map(e -> children(e, "Element")).orElse(List.of())) {
            String type = XmlDocuments.xsiType(element);
            if (type.endsWith(FIELD_TYPE)) {
                FieldDef field = readField(element, relativeStart);
                relativeStart += field.getLength();
                line.field(field);
            } else if (type.endsWith(LINE_TYPE)) {
                nestedLines.add(element);
            } else {
                log.warn("Ignoring element of type '{}' in line {}", type, lineName);
            }
        }

        sink.add(line.build());
        for (Element nested : nestedLines) {
            collectLine(nested, lineName, sink);
        }
    }

    private FieldDef readField(Element element, int relativeStart) {
        String name = text(element, "Name");
        if (name == null || name.isEmpty()) {
            throw new StructureException("Field element without <Name>");
        }
        int length = intValue(element, "LengthField", 0);
        if (length <= 0) {
            throw new StructureException("Field " + name + " has no positive <LengthField>");
        }

        FieldDef.FieldDefBuilder field = FieldDef.builder()
                .name(name)
                .description(text(element, "Description"))
                .sequence(intValue(element, "Sequence", 0))
                .relativeStart(relativeStart)
                .length(length)
                .alignment(Alignment.fromValue(text(element, "AlignmentType")))
                .required(boolValue(element, "IsRequired", false))
                .sequential(boolValue(element, "IsSequential", false))
                .kind(heuristics.inferKind(name));

        String fixedValue = text(element, "FixedValue");
        if ((fixedValue == null || fixedValue.isEmpty()) && boolValue(element, "IsStaticValue", false)) {
            fixedValue = text(element, "StaticValue", text(element, "DefaultValue"));
        }
        field.fixedValue(fixedValue);
        child(element, "Domain").ifPresent(domain -> children(domain, "Value")
                .forEach(v -> field.domainValue(v.getTextContent().trim())));

        return field.build();
    }
}
