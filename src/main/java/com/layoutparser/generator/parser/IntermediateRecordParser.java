package com.layoutparser.generator.parser;

import java.io.StringWriter;
import java.util.List;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.layoutparser.generator.codegen.ElementNames;
import com.layoutparser.generator.exception.StructureException;
import com.layoutparser.generator.model.FieldDef;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;
import com.layoutparser.generator.validation.LineResolver;

/**
 * Parses fixed-width text into the intermediate record consumed by generated stylesheets:
 * {@code ROOT/<line name>/<map field name>} with trimmed values.
 */
public class IntermediateRecordParser {

    private static final Logger log = LoggerFactory.getLogger(IntermediateRecordParser.class);

    public static final String ROOT = "ROOT";

    public Document parse(List<String> lines, Layout layout) {
        Document doc = newDocument();
        Element root = doc.createElement(ROOT);
        doc.appendChild(root);

        LineResolver resolver = new LineResolver(layout);
        for (int i = 0; i < lines.size(); i++) {
            String text = lines.get(i);
            if (text == null || text.isEmpty()) {
                continue;
            }
            int lineIndex = i;
            LineDef def = resolver.resolve(text, i)
                    .orElseThrow(() -> new StructureException("No line definition matches line " + (lineIndex + 1)));

            Element lineElement = doc.createElement(ElementNames.sanitize(def.getName()));
            int position = def.prefixLength();
            for (FieldDef field : def.positionalFields()) {
                String value = slice(text, position, field.getLength());
                Element fieldElement = doc.createElement(ElementNames.sanitize(ElementNames.toMapFieldName(field.getName())));
                fieldElement.setTextContent(value.trim());
                lineElement.appendChild(fieldElement);
                position += field.getLength();
            }
            root.appendChild(lineElement);
        }

        log.debug("Parsed {} lines of layout {} into the intermediate record", lines.size(), layout.getName());
        return doc;
    }

    public String parseToXml(List<String> lines, Layout layout) {
        return serialize(parse(lines, layout));
    }

    private static String slice(String text, int start, int length) {
        if (start >= text.length()) {
            return "";
        }
        return text.substring(start, Math.min(text.length(), start + length));
    }

    private static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new StructureException("Cannot create XML document", e);
        }
    }

    public static String serialize(Document doc) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new StructureException("Cannot serialize intermediate record", e);
        }
    }
}
