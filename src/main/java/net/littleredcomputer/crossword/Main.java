package net.littleredcomputer.crossword;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.Optional;

public class Main {

    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure ('_' marks a fillable cell)")
                .addOption("words", true, "filename of word list, one word per line")
                .addOption("output", true, "filename of image to write the solution to")
                .addOption("propagation", true, "arc consistency after each assignment: LOCAL or FULL")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader input(CommandLine cmd, String option) throws FileNotFoundException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        String p = cmd.getOptionValue(option);
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static CrosswordSolver.Propagation propagation(CommandLine cmd) {
        String p = cmd.getOptionValue("propagation", "LOCAL");
        try {
            return CrosswordSolver.Propagation.valueOf(p.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown propagation: " + p, e);
        }
    }

    /**
     * @return the process exit status: 0 when a solution was printed, 1 when there is none
     */
    static int run(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Crossword crossword = Crossword.parseFrom(input(cmd, "structure"));
        Vocabulary vocabulary = Vocabulary.parseFrom(input(cmd, "words"));
        Optional<Assignment> outcome = new CrosswordSolver(crossword, vocabulary)
                .setPropagation(propagation(cmd))
                .setLogInterval(logInterval(cmd))
                .solve();
        if (!outcome.isPresent()) {
            System.out.println("No solution.");
            return 1;
        }
        CrosswordRenderer renderer = new CrosswordRenderer(crossword);
        System.out.print(renderer.toText(outcome.get()));
        if (cmd.hasOption("output")) {
            renderer.writeImage(outcome.get(), new File(cmd.getOptionValue("output")));
        }
        return 0;
    }

    public static void main(String[] args) throws ParseException, IOException {
        System.exit(run(args));
    }
}
