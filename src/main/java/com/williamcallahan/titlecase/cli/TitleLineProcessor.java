package com.williamcallahan.titlecase.cli;

import com.williamcallahan.titlecase.service.casing.TitleCaser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;

/**
 * Feeds lines through a {@link TitleCaser}, one output line per input line.
 */
public class TitleLineProcessor {

    private final TitleCaser titleCaser;

    /**
     * Creates a line processor.
     *
     * @param titleCaser converter applied to each line
     */
    public TitleLineProcessor(TitleCaser titleCaser) {
        this.titleCaser = Objects.requireNonNull(titleCaser, "titleCaser");
    }

    /**
     * Title-cases every line of the reader. Lines are stripped of surrounding whitespace;
     * blank lines are written back as blank lines. Stops early once the writer reports an
     * error.
     *
     * @param reader source of lines
     * @param writer destination; flushed before returning
     * @return number of lines written
     * @throws IOException when reading fails
     */
    public int processLines(BufferedReader reader, PrintWriter writer) throws IOException {
        int linesWritten = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            String stripped = line.strip();
            writer.println(stripped.isEmpty() ? "" : titleCaser.titleCase(stripped));
            linesWritten++;
            if (writer.checkError()) {
                break;
            }
        }
        writer.flush();
        return linesWritten;
    }

    /**
     * Joins command-line words into one title and writes it title-cased.
     *
     * @param words words given on the command line
     * @param writer destination; flushed before returning
     */
    public void processWords(List<String> words, PrintWriter writer) {
        writer.println(titleCaser.titleCase(String.join(" ", words).strip()));
        writer.flush();
    }
}
