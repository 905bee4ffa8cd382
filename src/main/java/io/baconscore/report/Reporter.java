package io.baconscore.report;

import io.baconscore.query.QueryResult;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Interface for query result formatters.
 */
public interface Reporter {

    /**
     * Returns the format name (e.g., "console", "json").
     */
    String format();

    /**
     * Writes one query result to the given writer.
     */
    void write(QueryResult result, Writer writer) throws IOException;

    /**
     * Returns the formatted result as a string.
     */
    default String toString(QueryResult result) {
        try {
            StringWriter writer = new StringWriter();
            write(result, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to format result", e);
        }
    }
}
