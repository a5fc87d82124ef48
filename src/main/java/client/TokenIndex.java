package client;

import symtab.BST;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Scanner;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

/**
 * Reads whitespace-delimited tokens and associates each one with its position
 * in the input, then prints the table in key order and in level order.
 *
 * <pre>
 *   $ java client.TokenIndex tinyST.txt
 *   A 8
 *   C 4
 *   E 12
 *   ...
 * </pre>
 */
public class TokenIndex {
    private static final Logger log = Logger.getLogger(TokenIndex.class);

    private static final Option[] OPTIONS = {
        Option.builder("s")
              .longOpt("stats")
              .desc("Print size, height, min and max after the listings")
              .build(),
        Option.builder("h")
              .longOpt("help")
              .desc("Show this help")
              .build()
    };

    /** Puts every token of {@code in} with its 0-based sequence number. */
    static BST<String,Integer> index(final Reader in) {
        BST<String,Integer> st = new BST<>();
        Scanner scanner = new Scanner(in);
        for (int i = 0; scanner.hasNext(); i++) {
            st.put(scanner.next(), i);
        }
        return st;
    }

    static void print(final BST<String,Integer> st, final boolean stats, final PrintStream out) {
        for (String s : st.keys())
            out.printf("%s %d%n", s, st.get(s));

        out.println();

        for (String s : st.levelOrder())
            out.printf("%s %d%n", s, st.get(s));

        if (stats) {
            out.println();
            out.printf("size=%d height=%d%n", st.size(), st.height());
            if (!st.isEmpty())
                out.printf("min=%s max=%s%n", st.min(), st.max());
        }
    }

    private static void printHelp(final Options options) {
        new HelpFormatter().printHelp("TokenIndex [options] [file]", options);
    }

    public static void main(String[] args) {
        Options options = new Options();
        for (Option o : OPTIONS) options.addOption(o);

        CommandLine cmd;
        try {
            CommandLineParser parser = new DefaultParser();
            cmd = parser.parse(options, args);
        } catch (ParseException ex) {
            System.err.println(ex.getMessage());
            printHelp(options);
            System.exit(1);
            return;
        }

        if (cmd.hasOption("h")) {
            printHelp(options);
            return;
        }

        args = cmd.getArgs();
        if (args.length > 1) {
            printHelp(options);
            System.exit(1);
            return;
        }

        BST<String,Integer> st;
        try (Reader in = (args.length == 1)
                ? Files.newBufferedReader(Paths.get(args[0]), StandardCharsets.UTF_8)
                : new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            if (log.isInfoEnabled())
                log.info("reading tokens from " + (args.length == 1 ? args[0] : "standard input"));
            st = index(in);
        } catch (IOException ex) {
            log.error(ex, ex);
            System.err.println("cannot read input: " + ex.getMessage());
            System.exit(1);
            return;
        }

        print(st, cmd.hasOption("s"), System.out);
    }
}
