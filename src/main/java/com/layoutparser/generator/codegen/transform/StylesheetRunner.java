package com.layoutparser.generator.codegen.transform;

import java.io.StringReader;
import java.io.StringWriter;

import javax.xml.XMLConstants;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.transform.stream.StreamSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import com.layoutparser.generator.exception.StructureException;

/**
 * Applies a generated (or embedded) stylesheet to an intermediate record.
 */
public class StylesheetRunner {

    private static final Logger log = LoggerFactory.getLogger(StylesheetRunner.class);

    public String apply(String stylesheet, Document intermediateRecord) {
        Transformer transformer = compile(stylesheet);
        StringWriter out = new StringWriter();
        try {
            transformer.transform(new DOMSource(intermediateRecord), new StreamResult(out));
        } catch (TransformerException e) {
            throw new StructureException("Stylesheet failed on the record: " + e.getMessage(), e);
        }
        log.debug("Stylesheet produced {} characters", out.getBuffer().length());
        return out.toString();
    }

    private static Transformer compile(String stylesheet) {
        TransformerFactory factory = TransformerFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            return factory.newTransformer(new StreamSource(new StringReader(stylesheet)));
        } catch (TransformerConfigurationException e) {
            throw new StructureException("Stylesheet does not compile: " + e.getMessage(), e);
        }
    }
}
