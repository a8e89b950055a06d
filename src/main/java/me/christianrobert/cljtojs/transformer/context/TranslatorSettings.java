package me.christianrobert.cljtojs.transformer.context;

import me.christianrobert.cljtojs.config.service.ConfigService;

/**
 * Immutable snapshot of the runtime names the translator emits.
 *
 * <p>The generated code targets a runtime library that provides persistent vectors,
 * interned keywords and a few helper functions. Their names are configurable so the
 * same translator can target differently packaged runtimes.</p>
 */
public class TranslatorSettings {

    private final String vectorClass;
    private final String vectorEmptyNode;
    private final int vectorShift;
    private final String keywordClass;
    private final String nullSymbol;
    private final String restParameter;
    private final String notFunction;
    private final String derefFunction;

    public TranslatorSettings(String vectorClass, String vectorEmptyNode, int vectorShift, String keywordClass,
                              String nullSymbol, String restParameter, String notFunction, String derefFunction) {
        this.vectorClass = require(vectorClass, "Vector class");
        this.vectorEmptyNode = require(vectorEmptyNode, "Vector empty node");
        if (vectorShift <= 0) {
            throw new IllegalArgumentException("Vector shift must be positive");
        }
        this.vectorShift = vectorShift;
        this.keywordClass = require(keywordClass, "Keyword class");
        this.nullSymbol = require(nullSymbol, "Null symbol");
        this.restParameter = require(restParameter, "Rest parameter");
        this.notFunction = require(notFunction, "Not function");
        this.derefFunction = require(derefFunction, "Deref function");
    }

    /**
     * Settings matching the ClojureScript runtime layout.
     */
    public static TranslatorSettings defaults() {
        return new TranslatorSettings("PersistentVector", "PersistentVector.EMPTY_NODE", 5, "Keyword",
                "js/null", "arguments", "not", "deref");
    }

    /**
     * Snapshots the translator keys of a configuration service.
     * Missing keys fall back to {@link #defaults()}.
     */
    public static TranslatorSettings fromConfig(ConfigService config) {
        TranslatorSettings d = defaults();
        Integer shift = config.getConfigValueAsInteger(ConfigService.VECTOR_SHIFT);
        return new TranslatorSettings(
                orDefault(config.getConfigValueAsString(ConfigService.VECTOR_CLASS), d.vectorClass),
                orDefault(config.getConfigValueAsString(ConfigService.VECTOR_EMPTY_NODE), d.vectorEmptyNode),
                shift != null ? shift : d.vectorShift,
                orDefault(config.getConfigValueAsString(ConfigService.KEYWORD_CLASS), d.keywordClass),
                orDefault(config.getConfigValueAsString(ConfigService.NULL_SYMBOL), d.nullSymbol),
                orDefault(config.getConfigValueAsString(ConfigService.REST_PARAMETER), d.restParameter),
                orDefault(config.getConfigValueAsString(ConfigService.NOT_FUNCTION), d.notFunction),
                orDefault(config.getConfigValueAsString(ConfigService.DEREF_FUNCTION), d.derefFunction));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value;
    }

    private static String require(String value, String role) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(role + " cannot be null or empty");
        }
        return value;
    }

    public String getVectorClass() {
        return vectorClass;
    }

    public String getVectorEmptyNode() {
        return vectorEmptyNode;
    }

    public int getVectorShift() {
        return vectorShift;
    }

    public String getKeywordClass() {
        return keywordClass;
    }

    public String getNullSymbol() {
        return nullSymbol;
    }

    public String getRestParameter() {
        return restParameter;
    }

    public String getNotFunction() {
        return notFunction;
    }

    public String getDerefFunction() {
        return derefFunction;
    }

    @Override
    public String toString() {
        return "TranslatorSettings{vectorClass='" + vectorClass + "', keywordClass='" + keywordClass
                + "', nullSymbol='" + nullSymbol + "', restParameter='" + restParameter + "'}";
    }
}
