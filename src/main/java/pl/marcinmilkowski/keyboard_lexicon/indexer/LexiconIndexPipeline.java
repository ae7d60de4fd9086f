package pl.marcinmilkowski.keyboard_lexicon.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.config.BuildConfig;
import pl.marcinmilkowski.keyboard_lexicon.config.FuzzyStrategy;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.BkTree;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.BkTreeBuilder;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.DeleteDictionaryBuilder;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.DeleteRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.store.ArtifactSwap;
import pl.marcinmilkowski.keyboard_lexicon.indexer.store.LexiconIndexWriter;
import pl.marcinmilkowski.keyboard_lexicon.indexer.store.LexiconTables;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.CorpusRanker;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.IndexWriteException;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.LexiconInputs;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.LexiconLoader;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.MissingInputFileException;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.RankedWord;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs a full build: load, filter and rank, build every table, then commit and swap the artifact in.
 *
 * The exact/suffix, prefix and fuzzy builders share the immutable ranked list and run
 * on a fixed pool together with the letter aggregator. Writing happens on the calling
 * thread. A failed build never touches the previously published artifact.
 */
public class LexiconIndexPipeline {

    private static final Logger logger = LoggerFactory.getLogger(LexiconIndexPipeline.class);

    private final BuildConfig config;
    private final LexiconLoader loader;
    private final CorpusRanker ranker;

    public LexiconIndexPipeline(BuildConfig config) {
        this(config, new LexiconLoader(), new CorpusRanker());
    }

    LexiconIndexPipeline(BuildConfig config, LexiconLoader loader, CorpusRanker ranker) {
        this.config = config;
        this.loader = loader;
        this.ranker = ranker;
    }

    public BuildReport run() throws IOException {
        long started = System.currentTimeMillis();
        logger.info("Starting lexicon build: {}", config);

        LexiconInputs inputs = loader.load(config);
        List<RankedWord> ranked = ranker.rank(inputs);
        checkAuxiliaryCorpus();

        Built built = buildTables(ranked);
        Map<String, Long> tableRows = writeArtifact(built, ranked);

        int hidden = (int) ranked.stream().filter(RankedWord::hidden).count();
        BuildReport report = new BuildReport(config.getOutputPath(), config.getFuzzyStrategy(),
            ranked.size(), hidden, inputs.malformedLines(), tableRows, built.distribution,
            System.currentTimeMillis() - started);
        logger.info("Lexicon build complete: {}", report);
        return report;
    }

    private void checkAuxiliaryCorpus() throws MissingInputFileException {
        Path corpus = config.getAuxiliaryCorpusPath();
        if (corpus != null && !Files.isReadable(corpus)) {
            throw new MissingInputFileException("auxiliary corpus", corpus);
        }
    }

    private Built buildTables(List<RankedWord> ranked) throws IOException {
        ExecutorService executor = Executors.newFixedThreadPool(config.getThreads());
        try {
            Future<ExactSuffixIndexBuilder.Result> exact =
                executor.submit(() -> new ExactSuffixIndexBuilder().build(ranked));
            Future<List<PrefixRow>> prefixes =
                executor.submit(() -> new PrefixIndexBuilder(config.getPrefixCap()).build(ranked));
            Future<List<DeleteRow>> deletes = null;
            Future<BkTree> bkTree = null;
            if (config.getFuzzyStrategy() == FuzzyStrategy.DELETE_DICTIONARY) {
                deletes = executor.submit(() -> new DeleteDictionaryBuilder(config.getDeleteBudget()).build(ranked));
            } else {
                bkTree = executor.submit(() -> new BkTreeBuilder().build(ranked));
            }
            Future<LetterDistribution> distribution = executor.submit(
                () -> new LetterDistributionAggregator().aggregate(config.getAuxiliaryCorpusPath()));

            return new Built(
                await(exact),
                await(prefixes),
                deletes != null ? await(deletes) : null,
                bkTree != null ? await(bkTree) : null,
                await(distribution));
        } finally {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    logger.warn("Builder threads did not stop within a minute");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Map<String, Long> writeArtifact(Built built, List<RankedWord> ranked) throws IOException {
        Path target = config.getOutputPath();
        Path staging;
        try {
            staging = ArtifactSwap.createStaging(target);
        } catch (IOException e) {
            throw new IndexWriteException("Cannot create staging directory for " + target, e);
        }

        boolean published = false;
        try {
            LexiconIndexWriter writer = openWriter(staging);
            Map<String, Long> rows = new LinkedHashMap<>();
            rows.put(LexiconTables.WORDS, writer.writeWords(built.exact.words()));
            rows.put(LexiconTables.WORDS_BY_SUFFIX, writer.writeSuffixes(built.exact.suffixes()));
            rows.put(LexiconTables.PREFIXES, writer.writePrefixes(built.prefixes));
            if (built.deletes != null) {
                rows.put(LexiconTables.SYMSPELL_DELETES, writer.writeDeletes(built.deletes));
            }
            if (built.bkTree != null) {
                rows.put(LexiconTables.BK_NODES, writer.writeBkNodes(built.bkTree.getNodes()));
                rows.put(LexiconTables.BK_EDGES, writer.writeBkEdges(built.bkTree.getEdges()));
            }

            Map<String, String> kv = new LinkedHashMap<>();
            kv.put(LetterDistribution.INITIAL_KEY, built.distribution.initialCsv());
            kv.put(LetterDistribution.GENERAL_KEY, built.distribution.generalCsv());
            kv.put(LexiconTables.KV_FUZZY_STRATEGY, config.getFuzzyStrategy().alias());
            kv.put(LexiconTables.KV_WORD_COUNT, String.valueOf(ranked.size()));
            kv.put(LexiconTables.KV_SCHEMA_VERSION, String.valueOf(LexiconTables.SCHEMA_VERSION));
            rows.put(LexiconTables.KV, writer.writeKv(kv));

            Path wordList = config.getFilteredWordListPath();
            if (wordList != null) {
                try {
                    ranker.writeWordList(ranked, wordList);
                } catch (IOException e) {
                    throw new IndexWriteException("Cannot write filtered word list " + wordList, e);
                }
            }

            try {
                ArtifactSwap.publish(staging, target);
            } catch (IOException e) {
                throw new IndexWriteException("Cannot publish artifact to " + target, e);
            }
            published = true;
            return rows;
        } finally {
            if (!published) {
                ArtifactSwap.discard(staging);
            }
        }
    }

    LexiconIndexWriter openWriter(Path staging) {
        return new LexiconIndexWriter(staging);
    }

    private static <T> T await(Future<T> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for index builders");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Index builder failed", cause);
        }
    }

    private static final class Built {
        final ExactSuffixIndexBuilder.Result exact;
        final List<PrefixRow> prefixes;
        final List<DeleteRow> deletes;
        final BkTree bkTree;
        final LetterDistribution distribution;

        Built(ExactSuffixIndexBuilder.Result exact, List<PrefixRow> prefixes, List<DeleteRow> deletes,
              BkTree bkTree, LetterDistribution distribution) {
            this.exact = exact;
            this.prefixes = prefixes;
            this.deletes = deletes;
            this.bkTree = bkTree;
            this.distribution = distribution;
        }
    }
}
