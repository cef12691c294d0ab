package com.layoutparser.generator.codegen.transform;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

/**
 * Element or attribute of the output document being assembled. Children keep insertion order.
 */
@Getter
public class OutputNode {

    private final String name;
    private final boolean attribute;
    private final Map<String, OutputNode> children = new LinkedHashMap<>();

    // XSL fragment producing the node's text
    @Setter
    private String valueXsl;
    @Setter
    private LookupPlan lookup;
    @Setter
    private String namespace;

    public OutputNode(String name, boolean attribute) {
        this.name = name;
        this.attribute = attribute;
    }

    public static OutputNode element(String name) {
        return new OutputNode(name, false);
    }

    public OutputNode child(String childName, boolean childIsAttribute) {
        String key = (childIsAttribute ? "@" : "") + childName;
        return children.computeIfAbsent(key, k -> new OutputNode(childName, childIsAttribute));
    }

    public Collection<OutputNode> childNodes() {
        return children.values();
    }

    public boolean hasValue() {
        return valueXsl != null || lookup != null;
    }
}
