package com.codeontology.cli;

import com.codeontology.core.ast.SyntaxNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads syntax trees serialized as JSON by the external Elixir parser.
 *
 * <p>The file holds one root node; unknown tags become {@code UNRECOGNIZED}.
 */
public final class SyntaxTreeReader {

    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeReader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);

    private SyntaxTreeReader() {
        // Utility class - no instantiation
    }

    /**
     * Reads the syntax tree stored at {@code path}.
     *
     * @param path JSON file
     * @return root node
     * @throws IOException if the file is missing, unreadable or not a syntax tree
     */
    public static SyntaxNode read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Syntax tree file not found: " + path);
        }
        log.debug("Reading syntax tree from: {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    /**
     * Reads a syntax tree from a stream.
     *
     * @param in JSON input, not closed
     * @return root node
     * @throws IOException if the input is not a syntax tree
     */
    public static SyntaxNode read(InputStream in) throws IOException {
        SyntaxNode root = JSON_MAPPER.readValue(in, SyntaxNode.class);
        if (root == null) {
            throw new IOException("Syntax tree input is empty");
        }
        return root;
    }
}
