package dev.pekelund.genai.retriever;

import java.util.regex.Pattern;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Builds and checks corpus, document and chunk resource names.
 */
final class ResourceNames {

    static final String CORPORA = "corpora/";

    private static final Pattern CORPUS_NAME = Pattern.compile("^corpora/[^/]+$");
    private static final Pattern DOCUMENT_NAME = Pattern.compile("^corpora/[^/]+/documents/[^/]+$");
    private static final Pattern CHUNK_NAME = Pattern.compile("^corpora/[^/]+/documents/[^/]+/chunks/[^/]+$");
    // ASCII punctuation except '-'
    private static final Pattern PUNCTUATION = Pattern.compile("[!-,./:-@\\[-`{-~]");

    private ResourceNames() {
        // Utility class
    }

    static String corpus(String name) {
        Assert.hasText(name, "Corpus name must not be empty");
        if (CORPUS_NAME.matcher(name).matches()) {
            return name;
        }
        if (name.contains("/")) {
            throw new IllegalArgumentException("Corpus name must be formatted as corpora/<corpus_name>, got: " + name);
        }
        return CORPORA + sanitize(name);
    }

    /**
     * Resolves a document name for creation: full names are kept, bare ids are placed under the
     * corpus.
     */
    static String document(String corpusName, String name) {
        if (DOCUMENT_NAME.matcher(name).matches()) {
            return name;
        }
        if (name.contains("/")) {
            throw new IllegalArgumentException(
                "Document name must be formatted as " + corpusName + "/documents/<document_name>, got: " + name);
        }
        return corpusName + "/documents/" + sanitize(name);
    }

    static String chunk(String documentName, String name) {
        Assert.hasText(name, "Chunk name must be specified.");
        if (CHUNK_NAME.matcher(name).matches()) {
            return name;
        }
        if (name.contains("/")) {
            throw new IllegalArgumentException(
                "Chunk name must be formatted as " + documentName + "/chunks/<chunk_name>, got: " + name);
        }
        return documentName + "/chunks/" + sanitize(name);
    }

    static String requireDocument(String name) {
        if (!StringUtils.hasText(name) || !DOCUMENT_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Expected a document name (corpora/*/documents/*), got: " + name);
        }
        return name;
    }

    static String requireChunk(String name) {
        if (!StringUtils.hasText(name) || !CHUNK_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Expected a chunk name (corpora/*/documents/*/chunks/*), got: " + name);
        }
        return name;
    }

    static String sanitize(String id) {
        return PUNCTUATION.matcher(id).replaceAll("");
    }
}
