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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.LinkMapping;
import com.layoutparser.generator.model.Mapping;
import com.layoutparser.generator.model.Rule;

/**
 * Reads a mapper definition document ({@code MapperVO}) into a {@link Mapping}.
 */
public class MapperXmlParser {

    private static final Logger log = LoggerFactory.getLogger(MapperXmlParser.class);

    public Mapping parse(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StructureException("Cannot read mapper file " + file, e);
        }
    }

    public Mapping parse(String xml) {
        Element root = XmlDocuments.parse(xml).getDocumentElement();
        if (!"MapperVO".equals(XmlDocuments.localNameOf(root))) {
            root = child(root, "MapperVO").orElse(root);
        }

        Mapping.MappingBuilder mapping = Mapping.builder()
                .id(text(root, "MapperGuid"))
                .name(text(root, "Name"))
                .description(text(root, "Description"))
                .inputLayoutId(text(root, "InputLayoutGuid"))
                .targetLayoutId(text(root, "TargetLayoutGuid"));

        child(root, "Rules").ifPresent(rules -> children(rules, "Rule").forEach(r -> mapping.rule(readRule(r))));
        child(root, "LinkMappings").ifPresent(links -> children(links, "LinkMappingItem")
                .forEach(l -> mapping.linkMapping(readLinkMapping(l))));

        String xsl = text(root, "XslContent");
        if (xsl == null || xsl.isEmpty()) {
            xsl = text(root, "Xsl");
        }
        mapping.embeddedXsl(xsl);

        Mapping result = mapping.build();
        log.debug("Parsed mapper {}: {} rules, {} link mappings, embedded XSL: {}",
                result.getName(), result.getRules().size(), result.getLinkMappings().size(), result.hasEmbeddedXsl());
        return result;
    }

    private Rule readRule(Element element) {
        return Rule.builder()
                .name(text(element, "Name"))
                .description(text(element, "Description"))
                .sequence(intValue(element, "Sequence", 0))
                .required(boolValue(element, "IsRequired", false))
                .content(child(element, "ContentValue").map(Element::getTextContent).orElse(""))
                .createOnlyChildren(boolValue(element, "CreateOnlyChildren", false))
                .build();
    }

    private LinkMapping readLinkMapping(Element element) {
        return LinkMapping.builder()
                .name(text(element, "Name"))
                .description(text(element, "Description"))
                .sequence(intValue(element, "Sequence", 0))
                .inputLayoutId(text(element, "InputLayoutGuid"))
                .targetLayoutId(text(element, "TargetLayoutGuid"))
                .defaultValue(text(element, "DefaultValue"))
                .allowEmpty(boolValue(element, "AllowEmpty", false))
                .required(boolValue(element, "IsRequired", false))
                .build();
    }
}
