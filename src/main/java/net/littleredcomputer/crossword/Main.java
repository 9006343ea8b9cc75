package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.cli.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

public class Main {
    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of grid layout ('_' marks an open cell)")
                .addOption("words", true, "filename of word list, one word per line")
                .addOption("variables", true, "variable ordering: FIRST or MRV")
                .addOption("values", true, "value ordering: DOMAIN or LCV")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("timeout", true, "give up after this long, in ISO-8601 format");
    }

    private static Reader file(CommandLine cmd, String option) throws FileNotFoundException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        String p = cmd.getOptionValue(option);
        return new BufferedReader(p.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    static CrosswordSolver solver(CommandLine cmd, Crossword crossword) {
        CrosswordSolver s = new CrosswordSolver(crossword)
                .setVariableOrder(CrosswordSolver.VariableOrder.valueOf(cmd.getOptionValue("variables", "MRV")))
                .setValueOrder(CrosswordSolver.ValueOrder.valueOf(cmd.getOptionValue("values", "LCV")))
                .setLogInterval(logInterval(cmd));
        if (cmd.hasOption("timeout")) s.setTimeLimit(Duration.parse(cmd.getOptionValue("timeout")));
        return s;
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Crossword crossword;
        try (Reader structure = file(cmd, "structure"); Reader words = file(cmd, "words")) {
            crossword = Crossword.parseFrom(structure, words);
        }
        Stopwatch sw = Stopwatch.createStarted();
        Optional<ImmutableMap<Variable, String>> outcome = solver(cmd, crossword).solve();
        sw.stop();
        if (outcome.isPresent()) {
            System.out.print(crossword.render(outcome.get()));
        } else {
            System.out.println("No solution.");
        }
        System.out.println("solve took " + sw);
    }
}
