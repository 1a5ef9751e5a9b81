// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);

    static final int SOLVED = 0;
    static final int NO_SOLUTION = 1;
    static final int INVALID_INPUT = 2;
    static final int LIMIT_REACHED = 3;

    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure ('#' marks a blocked cell)")
                .addOption("words", true, "filename of word list, one word per line")
                .addOption("output", true, "filename of PNG image of the solution")
                .addOption("steplimit", true, "maximum number of search steps")
                .addOption("timelimit", true, "maximum search time in ISO-8601 format")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader file(CommandLine cmd, String option) throws IOException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        return new BufferedReader(new FileReader(cmd.getOptionValue(option)));
    }

    private static Duration duration(CommandLine cmd, String option, String defaultValue) {
        String d = cmd.getOptionValue(option, defaultValue);
        return d == null ? null : Duration.parse(d);
    }

    /**
     * Solves the crossword described by the command line, printing the filled grid to out.
     * @return process exit status
     */
    static int run(String[] args, PrintStream out) {
        final Crossword crossword;
        final List<String> words;
        final CrosswordSolver solver;
        try {
            CommandLine cmd = new DefaultParser().parse(options(), args);
            try (Reader r = file(cmd, "structure")) {
                crossword = Crossword.parseFrom(r);
            }
            try (Reader r = file(cmd, "words")) {
                words = WordList.parseFrom(r);
            }
            solver = new CrosswordSolver(crossword, words)
                    .setStepLimit(Long.parseLong(cmd.getOptionValue("steplimit", "0")))
                    .setTimeLimit(duration(cmd, "timelimit", null))
                    .setLogInterval(duration(cmd, "loginterval", "PT1S"));
            Optional<Assignment> solution = solver.solve();
            if (!solution.isPresent()) {
                if (solver.outcome() == CrosswordSolver.Outcome.LIMIT_REACHED) {
                    out.println("Search limit reached");
                    return LIMIT_REACHED;
                }
                out.println("No solution found");
                return NO_SOLUTION;
            }
            out.print(solution.get().render(crossword));
            if (cmd.hasOption("output")) {
                String image = cmd.getOptionValue("output");
                try {
                    new AssignmentImageWriter(crossword, solution.get()).write(Paths.get(image));
                    log.info("image written to %s", image);
                } catch (IOException e) {
                    // The puzzle is still solved; only the image is missing.
                    log.error("could not save image %s: %s", image, e.getMessage());
                    out.println("Could not save image: " + e.getMessage());
                }
            }
            return SOLVED;
        } catch (ParseException | IOException | IllegalArgumentException | DateTimeParseException e) {
            log.error("invalid input: %s", e.getMessage());
            out.println("Invalid input: " + e.getMessage());
            return INVALID_INPUT;
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }
}
