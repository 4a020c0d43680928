package com.proseparser.json;

import com.proseparser.ast.Node;
import com.proseparser.ast.Program;

/**
 * Reads program trees written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * @param json a serialized {@link Program}
     * @return a tree equal to the one that was serialized
     * @throws AstJsonException if the JSON is malformed or describes no valid program
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Reads any node kind, e.g. a single {@code Statement} or {@code Expression}.
     *
     * @throws AstJsonException if the JSON is malformed or is not a {@code type} node
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
