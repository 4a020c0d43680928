package com.proseparser.json;

import com.proseparser.Token;
import com.proseparser.ast.Node;

import java.util.List;

/**
 * Writes program trees and token streams as JSON. Every node object carries a
 * {@code "type"} member naming its node class.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented for reading.
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Writes a token list as a JSON array of {@code {type, lexeme, line, column}} objects.
     *
     * @param tokens the tokenizer output, including the trailing EOF token
     * @param pretty whether to indent the output
     * @throws AstJsonException if the tokens cannot be written
     */
    String serializeTokens(List<Token> tokens, boolean pretty) throws AstJsonException;
}
