package com.williamcallahan.titlecase.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.titlecase.service.casing.TitleCaser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests line-by-line title casing of reader input.
 */
class TitleLineProcessorTest {

    private static final String NL = System.lineSeparator();

    private final TitleLineProcessor processor = new TitleLineProcessor(TitleCaser.withDefaults());

    @Test
    void processLines_stripsLinesAndKeepsBlankLines() throws IOException {
        StringWriter output = new StringWriter();
        BufferedReader reader = new BufferedReader(new StringReader("a tale of two cities\n\n   the end  \n"));

        int written = processor.processLines(reader, new PrintWriter(output));

        assertEquals(3, written);
        assertEquals("A Tale of Two Cities" + NL + NL + "The End" + NL, output.toString());
    }

    @Test
    void processLines_emptyInputWritesNothing() throws IOException {
        StringWriter output = new StringWriter();

        int written = processor.processLines(new BufferedReader(new StringReader("")), new PrintWriter(output));

        assertEquals(0, written);
        assertEquals("", output.toString());
    }

    @Test
    void processLines_stopsOnceWriterReportsError() throws IOException {
        Writer failing = new Writer() {
            @Override
            public void write(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("broken pipe");
            }

            @Override
            public void flush() {}

            @Override
            public void close() {}
        };
        PrintWriter writer = new PrintWriter(failing);

        int written = processor.processLines(new BufferedReader(new StringReader("one\ntwo\nthree\n")), writer);

        assertEquals(1, written);
        assertTrue(writer.checkError());
    }

    @Test
    void processWords_joinsArgumentsIntoOneTitle() {
        StringWriter output = new StringWriter();

        processor.processWords(List.of("out", "of", "the", "hurly-burly"), new PrintWriter(output));

        assertEquals("Out of the Hurly-Burly" + NL, output.toString());
    }
}
