package com.codeontology.core.graph;

/**
 * XML Schema datatypes used for literal values.
 */
public enum XsdDatatype {
    /** xsd:string */
    STRING("string"),
    /** xsd:integer */
    INTEGER("integer"),
    /** xsd:nonNegativeInteger, used for arities and counts */
    NON_NEGATIVE_INTEGER("nonNegativeInteger"),
    /** xsd:positiveInteger, used for line numbers and ordinals */
    POSITIVE_INTEGER("positiveInteger"),
    /** xsd:double */
    DOUBLE("double"),
    /** xsd:boolean */
    BOOLEAN("boolean"),
    /** xsd:date */
    DATE("date"),
    /** xsd:dateTime */
    DATE_TIME("dateTime");

    public static final String NAMESPACE = "http://www.w3.org/2001/XMLSchema#";

    private final String localName;

    XsdDatatype(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    public Iri iri() {
        return new Iri(NAMESPACE + localName);
    }
}
