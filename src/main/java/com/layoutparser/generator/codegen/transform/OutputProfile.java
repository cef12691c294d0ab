package com.layoutparser.generator.codegen.transform;

import java.util.Set;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import com.layoutparser.generator.config.GeneratorConfig;
import com.layoutparser.generator.parser.XmlDocuments;

import lombok.Value;

/**
 * Shape of the output document: root element, its default namespace, and whether the
 * document sits inside a batch wrapper ({@code idLote}/{@code indSinc}).
 */
@Value
public class OutputProfile {

    public static final String FISCAL_NAMESPACE = "http://www.portalfiscal.inf.br/nfe";
    static final Set<String> BATCH_MARKERS = Set.of("idLote", "indSinc");

    String rootElement;
    String namespace;
    boolean batchWrapper;
    String documentElement;

    public static OutputProfile defaults(GeneratorConfig config) {
        return new OutputProfile(config.getDefaultRootElement(), config.getDefaultNamespace(), false, null);
    }

    /**
     * Detects the profile from an example output document, falling back to the configured
     * defaults when no example is supplied.
     */
    public static OutputProfile detect(String exampleXml, GeneratorConfig config) {
        if (exampleXml == null || exampleXml.isBlank()) {
            return defaults(config);
        }
        Element root = XmlDocuments.parse(exampleXml).getDocumentElement();
        String rootName = XmlDocuments.localNameOf(root);
        String namespace = root.getNamespaceURI() != null ? root.getNamespaceURI() : config.getDefaultNamespace();

        boolean batch = false;
        String documentElement = null;
        NodeList nodes = root.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element child) {
                String childName = XmlDocuments.localNameOf(child);
                if (BATCH_MARKERS.contains(childName)) {
                    batch = true;
                } else if (documentElement == null) {
                    documentElement = childName;
                }
            }
        }
        if (batch && documentElement == null) {
            documentElement = config.getDefaultRootElement();
        }
        return new OutputProfile(rootName, namespace, batch, batch ? documentElement : null);
    }

    public boolean isFiscalDocument() {
        return FISCAL_NAMESPACE.equals(namespace);
    }
}
