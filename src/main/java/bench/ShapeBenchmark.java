package bench;

import symtab.BST;

import java.util.Random;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

/**
 * Single-threaded workload over a {@link BST}: preload random keys, then run
 * a seeded mix of put, delete, get, rank and select. Reports throughput and
 * the tree height before and after, which shows how Hibbard deletion lets the
 * shape drift away from a random BST.
 */
public class ShapeBenchmark {
    private static final Logger log = Logger.getLogger(ShapeBenchmark.class);

    static final int DEFAULT_PRELOAD = 50_000;
    static final int DEFAULT_OPERATIONS = 1_000_000;
    static final long DEFAULT_SEED = 12345L;

    static class Result {
        final int preload;
        final long operations;
        final long elapsedNanos;
        final int sizeAfter;
        final int heightBefore;
        final int heightAfter;
        long puts, deletes, gets, ranks, selects;

        Result(int preload, long operations, long elapsedNanos, int sizeAfter, int heightBefore, int heightAfter) {
            this.preload = preload;
            this.operations = operations;
            this.elapsedNanos = elapsedNanos;
            this.sizeAfter = sizeAfter;
            this.heightBefore = heightBefore;
            this.heightAfter = heightAfter;
        }

        double getMopsPerSecond() {
            if (elapsedNanos == 0) return 0;
            return operations / (elapsedNanos / 1e9) / 1_000_000.0;
        }

        @Override
        public String toString() {
            return String.format("Preload=%d, Ops=%d, Throughput=%.2f Mops/s, Size=%d, Height %d -> %d " +
                                 "(put:%d, delete:%d, get:%d, rank:%d, select:%d)",
                preload, operations, getMopsPerSecond(), sizeAfter, heightBefore, heightAfter,
                puts, deletes, gets, ranks, selects);
        }
    }

    /** Four keys per preloaded key, clamped to the {@code int} range. */
    static int keySpace(final int preload) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, preload * 4L));
    }

    static Result run(final BST<Integer,Integer> ds, final int preload, final long operations, final long seed) {
        Random rnd = new Random(seed);
        final int keySpace = keySpace(preload);

        if (log.isInfoEnabled()) log.info("preloading " + preload + " keys");
        while (ds.size() < preload) {
            int k = rnd.nextInt(keySpace);
            ds.put(k, k);
        }
        final int heightBefore = ds.height();

        if (log.isInfoEnabled()) log.info("running " + operations + " operations");
        long puts = 0, deletes = 0, gets = 0, ranks = 0, selects = 0;
        final long start = System.nanoTime();
        for (long i = 0; i < operations; i++) {
            int k = rnd.nextInt(keySpace);
            int r = rnd.nextInt(100);
            // 25% put, 25% delete, 30% get, 10% rank, 10% select
            if (r < 25)      { ds.put(k, k); puts++; }
            else if (r < 50) { ds.delete(k); deletes++; }
            else if (r < 80) { ds.get(k); gets++; }
            else if (r < 90) { ds.rank(k); ranks++; }
            else {
                if (!ds.isEmpty()) ds.select(rnd.nextInt(ds.size()));
                selects++;
            }
        }
        final long elapsed = System.nanoTime() - start;

        Result result = new Result(preload, operations, elapsed, ds.size(), heightBefore, ds.height());
        result.puts = puts;
        result.deletes = deletes;
        result.gets = gets;
        result.ranks = ranks;
        result.selects = selects;
        return result;
    }

    public static void main(String[] args) {
        Options options = new Options();
        options.addOption(Option.builder("p").longOpt("preload").hasArg().argName("keys")
                                .desc("Keys inserted before timing (default " + DEFAULT_PRELOAD + ")").build());
        options.addOption(Option.builder("n").longOpt("operations").hasArg().argName("count")
                                .desc("Timed operations (default " + DEFAULT_OPERATIONS + ")").build());
        options.addOption(Option.builder("r").longOpt("seed").hasArg().argName("seed")
                                .desc("Random seed (default " + DEFAULT_SEED + ")").build());

        int preload;
        long operations;
        long seed;
        try {
            CommandLine cmd = new DefaultParser().parse(options, args);
            preload = Integer.parseInt(cmd.getOptionValue("p", String.valueOf(DEFAULT_PRELOAD)));
            operations = Long.parseLong(cmd.getOptionValue("n", String.valueOf(DEFAULT_OPERATIONS)));
            seed = Long.parseLong(cmd.getOptionValue("r", String.valueOf(DEFAULT_SEED)));
        } catch (ParseException | NumberFormatException ex) {
            System.err.println(ex.getMessage());
            new HelpFormatter().printHelp("ShapeBenchmark [options]", options);
            System.exit(1);
            return;
        }

        System.out.println("========================================");
        System.out.println("BST shape benchmark (Hibbard deletion)");
        System.out.println("========================================");

        Result result = run(new BST<>(), preload, operations, seed);
        System.out.println(result);
        System.out.printf("Height ratio after/before: %.2f%n",
            result.heightBefore > 0 ? result.heightAfter / (double) result.heightBefore : 0.0);
    }
}
