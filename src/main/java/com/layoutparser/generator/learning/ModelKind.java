package com.layoutparser.generator.learning;

/**
 * Which artifact a learned model describes; decides the model file suffix.
 */
public enum ModelKind {
    TCL("_tcl.json"),
    XSL("_xsl.json");

    private final String fileSuffix;

    ModelKind(String fileSuffix) {
        this.fileSuffix = fileSuffix;
    }

    public String getFileSuffix() {
        return fileSuffix;
    }
}
