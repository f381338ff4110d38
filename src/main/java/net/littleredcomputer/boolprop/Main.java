package net.littleredcomputer.boolprop;

import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.time.Duration;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final Pattern randomRe = Pattern.compile("random(\\d+),(\\d+),(\\d+)");

    private static Options options() {
        return new Options()
                .addOption("problem", true, "filename of problem description, - for stdin, or randomN,M,SEED")
                .addOption("limit", true, "number of solutions to print (0 for all)")
                .addOption("count", false, "count every solution instead of printing them")
                .addOption("print", false, "print the problem before solving it")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static BooleanNetworkProblem problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        Matcher rm = randomRe.matcher(p);
        if (rm.matches()) {
            return BooleanNetworkProblem.randomInstance(Integer.parseInt(rm.group(1)),
                    Integer.parseInt(rm.group(2)),
                    Long.parseLong(rm.group(3)));
        }
        Reader r = new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
        return BooleanNetworkProblem.parseFrom(r);
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static void printSolution(PrintStream out, boolean[] bs) {
        out.print("v ");
        for (int i = 0; i < bs.length; ++i) out.printf("%d ", bs[i] ? i + 1 : -i - 1);
        out.println("0");
    }

    static void run(CommandLine cmd, PrintStream out) throws FileNotFoundException {
        BooleanNetworkProblem p = problem(cmd);
        if (cmd.hasOption("print")) out.print(p.format());
        Stopwatch sw = Stopwatch.createStarted();
        Stream<boolean[]> solutions = p.solutions(logInterval(cmd));
        if (cmd.hasOption("count")) {
            long n = solutions.count();
            sw.stop();
            out.println("c " + sw);
            out.println("c " + n + " solutions");
            out.println(n > 0 ? "s SATISFIABLE" : "s UNSATISFIABLE");
            return;
        }
        final int limit = Integer.parseInt(cmd.getOptionValue("limit", "1"));
        if (limit < 0) throw new IllegalArgumentException("limit must be non-negative");
        Iterator<boolean[]> it = (limit == 0 ? solutions : solutions.limit(limit)).iterator();
        if (!it.hasNext()) {
            sw.stop();
            out.println("c " + sw);
            out.println("s UNSATISFIABLE");
            return;
        }
        out.println("s SATISFIABLE");
        int printed = 0;
        while (it.hasNext()) {
            printSolution(out, it.next());
            ++printed;
        }
        sw.stop();
        out.println("c " + sw);
        log.debug("printed %d solutions", printed);
    }

    static CommandLine parse(String... args) throws ParseException {
        return new DefaultParser().parse(options(), args);
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        run(parse(args), System.out);
    }
}
