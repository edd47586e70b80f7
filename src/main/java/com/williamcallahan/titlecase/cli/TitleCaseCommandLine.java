package com.williamcallahan.titlecase.cli;

import com.williamcallahan.titlecase.config.TitleCaseProperties;
import com.williamcallahan.titlecase.service.casing.TitleCaser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point.
 *
 * <ul>
 *   <li>{@code --version} prints the application version and stops.</li>
 *   <li>Non-option arguments are joined into a single title.</li>
 *   <li>Without arguments, titles are read line by line from standard input.</li>
 * </ul>
 *
 * <p>Output goes to standard output as UTF-8; logging is routed to standard error so the
 * two never interleave.</p>
 */
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TitleCaseCommandLine implements ApplicationRunner, ExitCodeGenerator {

    static final String VERSION_OPTION = "version";
    static final String PROGRAM_NAME = "titlecase";
    static final int EXIT_OK = 0;
    static final int EXIT_IO_FAILURE = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(TitleCaseCommandLine.class);

    private final TitleLineProcessor lineProcessor;
    private final TitleCaseProperties properties;
    private final InputStream input;
    private final OutputStream output;
    private int exitCode = EXIT_OK;

    /**
     * Creates the command line bound to the process standard streams.
     *
     * @param titleCaser converter for each title
     * @param properties title casing settings, used for the version string
     */
    public TitleCaseCommandLine(TitleCaser titleCaser, TitleCaseProperties properties) {
        this(new TitleLineProcessor(titleCaser), properties, System.in, System.out);
    }

    TitleCaseCommandLine(
            TitleLineProcessor lineProcessor, TitleCaseProperties properties, InputStream input, OutputStream output) {
        this.lineProcessor = Objects.requireNonNull(lineProcessor, "lineProcessor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
    }

    @Override
    public void run(ApplicationArguments args) {
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        if (args.containsOption(VERSION_OPTION)) {
            writer.println(PROGRAM_NAME + " " + properties.getVersion());
            checkOutput(writer);
            return;
        }

        List<String> words = args.getNonOptionArgs();
        if (!words.isEmpty()) {
            LOGGER.debug("Title casing {} command-line words", words.size());
            lineProcessor.processWords(words, writer);
            checkOutput(writer);
            return;
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        try {
            int lines = lineProcessor.processLines(reader, writer);
            LOGGER.debug("Title cased {} lines from standard input", lines);
        } catch (IOException e) {
            LOGGER.error("Failed to read titles from standard input: {}", e.getMessage());
            LOGGER.debug("Stack trace:", e);
            exitCode = EXIT_IO_FAILURE;
        }
        checkOutput(writer);
    }

    // PrintWriter swallows write failures; checkError() flushes and reports them.
    private void checkOutput(PrintWriter writer) {
        if (writer.checkError()) {
            LOGGER.error("Failed to write titles to standard output");
            exitCode = EXIT_IO_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
