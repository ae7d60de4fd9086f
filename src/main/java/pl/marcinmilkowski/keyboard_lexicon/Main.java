package pl.marcinmilkowski.keyboard_lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.config.BuildConfig;
import pl.marcinmilkowski.keyboard_lexicon.config.BuildConfigLoader;
import pl.marcinmilkowski.keyboard_lexicon.config.FuzzyStrategy;
import pl.marcinmilkowski.keyboard_lexicon.config.SourceFormat;
import pl.marcinmilkowski.keyboard_lexicon.indexer.BuildReport;
import pl.marcinmilkowski.keyboard_lexicon.indexer.LexiconIndexPipeline;
import pl.marcinmilkowski.keyboard_lexicon.indexer.PrefixRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.SuffixRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.WordRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.BkTree;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.LexiconBuildException;
import pl.marcinmilkowski.keyboard_lexicon.query.LexiconIndexReader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point: builds lexicon index artifacts and inspects them.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_BUILD_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            showUsage(out);
            return EXIT_USAGE;
        }

        String command = args[0].toLowerCase();
        try {
            switch (command) {
                case "build":
                    return handleBuildCommand(args, out);
                case "inspect":
                    return handleInspectCommand(args, out);
                case "help":
                    showUsage(out);
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + command);
                    showUsage(err);
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println("Use 'help' command for usage information.");
            return EXIT_USAGE;
        } catch (LexiconBuildException e) {
            logger.error("Build failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_BUILD_FAILED;
        } catch (IOException e) {
            logger.error("Application error", e);
            err.println("Error: " + e.getMessage());
            return EXIT_BUILD_FAILED;
        }
    }

    private static int handleBuildCommand(String[] args, PrintStream out) throws IOException {
        BuildConfig.Builder builder = null;

        // --config is applied first so the remaining flags override it regardless of order
        for (int i = 1; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                builder = new BuildConfigLoader(Paths.get(requireValue(args, i))).toBuilder();
            }
        }
        if (builder == null) {
            builder = BuildConfig.builder();
        }

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    i++;
                    break;
                case "--legitimate":
                    builder.legitimateWordsPath(Paths.get(requireValue(args, i++)));
                    break;
                case "--hidden":
                    builder.hiddenWordsPath(Paths.get(requireValue(args, i++)));
                    break;
                case "--source":
                    builder.frequencySourcePath(Paths.get(requireValue(args, i++)));
                    break;
                case "--format":
                    builder.sourceFormat(SourceFormat.parse(requireValue(args, i++)));
                    break;
                case "--corpus":
                    builder.auxiliaryCorpusPath(Paths.get(requireValue(args, i++)));
                    break;
                case "--output":
                case "-o":
                    builder.outputPath(Paths.get(requireValue(args, i++)));
                    break;
                case "--words-out":
                    builder.filteredWordListPath(Paths.get(requireValue(args, i++)));
                    break;
                case "--fuzzy":
                    builder.fuzzyStrategy(FuzzyStrategy.parse(requireValue(args, i++)));
                    break;
                case "--prefix-cap":
                    builder.prefixCap(parseInt(args[i], requireValue(args, i++)));
                    break;
                case "--delete-budget":
                    builder.deleteBudget(parseInt(args[i], requireValue(args, i++)));
                    break;
                case "--threads":
                    builder.threads(parseInt(args[i], requireValue(args, i++)));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        BuildConfig config = builder.build();
        BuildReport report = new LexiconIndexPipeline(config).run();

        out.println("Lexicon index written to " + report.artifactPath());
        out.println("  Words: " + report.wordCount() + " (" + report.hiddenCount() + " hidden)");
        report.tableRows().forEach((table, rows) -> out.println("  " + table + ": " + rows + " rows"));
        out.println("  Fuzzy strategy: " + report.fuzzyStrategy().alias());
        if (report.malformedLines() > 0) {
            out.println("  Malformed source lines skipped: " + report.malformedLines());
        }
        return EXIT_OK;
    }

    private static int handleInspectCommand(String[] args, PrintStream out) throws IOException {
        String indexPath = null;
        String prefix = null;
        String suffix = null;
        String fuzzy = null;
        int distance = 2;
        int limit = 10;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--index":
                case "-i":
                    indexPath = requireValue(args, i++);
                    break;
                case "--prefix":
                    prefix = requireValue(args, i++);
                    break;
                case "--suffix":
                    suffix = requireValue(args, i++);
                    break;
                case "--fuzzy":
                    fuzzy = requireValue(args, i++);
                    break;
                case "--distance":
                    distance = parseInt(args[i], requireValue(args, i++));
                    break;
                case "--limit":
                    limit = parseInt(args[i], requireValue(args, i++));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (indexPath == null) {
            throw new IllegalArgumentException("--index is required");
        }

        try (LexiconIndexReader reader = new LexiconIndexReader(Path.of(indexPath))) {
            out.println("Index: " + reader.getArtifactPath());
            for (String table : reader.getTables()) {
                out.println("  " + table + ": " + reader.rowCount(table) + " rows");
            }
            out.println("  Fuzzy strategy: " + reader.getFuzzyStrategy().alias());

            if (prefix != null) {
                out.println("Completions for '" + prefix + "':");
                for (PrefixRow row : reader.prefix(prefix, limit, false)) {
                    out.printf("  %s #%d%n", row.word(), row.frequencyRank());
                }
            }
            if (suffix != null) {
                out.println("Words ending in '" + suffix + "':");
                for (SuffixRow row : reader.suffix(suffix, limit, false)) {
                    out.printf("  %s #%d%n", row.word(), row.frequencyRank());
                }
            }
            if (fuzzy != null) {
                Optional<WordRow> exact = reader.exact(fuzzy);
                exact.ifPresent(row -> out.printf("Exact match: %s #%d%s%n", row.word(), row.frequencyRank(),
                    row.hidden() ? " (hidden)" : ""));
                List<BkTree.Match> matches = reader.getFuzzyStrategy() == FuzzyStrategy.BK_TREE
                    ? reader.bkSearch(fuzzy, distance)
                    : reader.fuzzyDelete(fuzzy, distance);
                out.println("Corrections for '" + fuzzy + "' within distance " + distance + ":");
                matches.stream().limit(limit).forEach(m ->
                    out.printf("  %s d=%d #%d%n", m.word(), m.distance(), m.frequencyRank()));
            }
        }
        return EXIT_OK;
    }

    private static String requireValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer for " + option + ", got " + value);
        }
    }

    private static void showUsage(PrintStream out) {
        out.println("Usage: java -jar keyboard-lexicon-lucene.jar <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  build     Build a lexicon index artifact");
        out.println("            --config <json>          Build settings (flags below override it)");
        out.println("            --legitimate <file>      Legitimate words, one per line");
        out.println("            --hidden <file>          Hidden words, one per line (optional)");
        out.println("            --source <file>          Ranked words or word<TAB>frequency lines");
        out.println("            --format <mode>          ordinal | frequency | auto (default auto)");
        out.println("            --corpus <file>          Free text for letter distributions (optional)");
        out.println("            --output <dir>           Artifact directory, replaced atomically");
        out.println("            --words-out <file>       Also write the filtered word list (optional)");
        out.println("            --fuzzy <strategy>       symspell | bktree (default symspell)");
        out.println("            --prefix-cap <n>         Visible completions kept per prefix (default 20)");
        out.println("            --delete-budget <n>      Max deletions per delete key (default 2)");
        out.println("            --threads <n>            Builder threads");
        out.println("  inspect   Inspect an artifact");
        out.println("            --index <dir> [--prefix p] [--suffix s] [--fuzzy w --distance d] [--limit n]");
        out.println("  help      Show this message");
    }
}
