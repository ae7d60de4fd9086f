package pl.marcinmilkowski.keyboard_lexicon.query;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.MMapDirectory;
import org.apache.lucene.util.Bits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.config.FuzzyStrategy;
import pl.marcinmilkowski.keyboard_lexicon.indexer.ExactSuffixIndexBuilder;
import pl.marcinmilkowski.keyboard_lexicon.indexer.LetterDistribution;
import pl.marcinmilkowski.keyboard_lexicon.indexer.PrefixRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.SuffixRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.WordRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.BkEdgeRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.BkNodeRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.BkTree;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.DeleteGenerator;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.DeleteHash;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.DeleteRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.EditDistance;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static pl.marcinmilkowski.keyboard_lexicon.indexer.store.LexiconTables.*;

/**
 * Read-only view over a published lexicon artifact.
 *
 * Mirrors the lookups an on-device consumer performs (exact, prefix, suffix, delete-key
 * probe, BK-tree radius search, distributions) so builds can be verified end to end.
 * Candidate ranking and presentation are the consumer's business.
 */
public class LexiconIndexReader implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(LexiconIndexReader.class);

    private static final Sort BY_RANK = new Sort(new SortField(FREQUENCY_RANK, SortField.Type.INT));
    private static final Map<String, Sort> ORDER_BY_TABLE = Map.of(
        WORDS, BY_RANK,
        WORDS_BY_SUFFIX, BY_RANK,
        PREFIXES, BY_RANK,
        SYMSPELL_DELETES, BY_RANK,
        BK_NODES, Sort.INDEXORDER,
        BK_EDGES, Sort.INDEXORDER,
        KV, Sort.INDEXORDER);

    private final Path artifactPath;
    private final Map<String, DirectoryReader> readers = new LinkedHashMap<>();
    private final Map<String, String> kv;

    public LexiconIndexReader(Path artifactPath) throws IOException {
        this.artifactPath = artifactPath;
        if (!Files.isDirectory(artifactPath)) {
            throw new FileNotFoundException("Lexicon index not found: " + artifactPath);
        }
        try {
            for (String table : List.of(WORDS, WORDS_BY_SUFFIX, PREFIXES, SYMSPELL_DELETES, BK_NODES, BK_EDGES, KV)) {
                Path tablePath = artifactPath.resolve(table);
                if (Files.isDirectory(tablePath)) {
                    readers.put(table, DirectoryReader.open(MMapDirectory.open(tablePath)));
                }
            }
            this.kv = loadKv();
        } catch (IOException | RuntimeException e) {
            close();
            throw e;
        }
        logger.info("Opened lexicon index {} with tables {}", artifactPath, readers.keySet());
    }

    public Path getArtifactPath() {
        return artifactPath;
    }

    public Set<String> getTables() {
        return readers.keySet();
    }

    public boolean hasTable(String table) {
        return readers.containsKey(table);
    }

    public int rowCount(String table) {
        DirectoryReader reader = readers.get(table);
        return reader != null ? reader.numDocs() : 0;
    }

    public Map<String, String> getKv() {
        return kv;
    }

    public Optional<String> kvValue(String key) {
        return Optional.ofNullable(kv.get(key));
    }

    public FuzzyStrategy getFuzzyStrategy() {
        String alias = kv.get(KV_FUZZY_STRATEGY);
        if (alias != null) {
            return FuzzyStrategy.parse(alias);
        }
        return hasTable(BK_NODES) ? FuzzyStrategy.BK_TREE : FuzzyStrategy.DELETE_DICTIONARY;
    }

    public LetterDistribution getDistribution() {
        String initial = kv.get(LetterDistribution.INITIAL_KEY);
        String general = kv.get(LetterDistribution.GENERAL_KEY);
        if (initial == null || general == null) {
            throw new IllegalStateException("Letter distributions missing from " + artifactPath);
        }
        return new LetterDistribution(LetterDistribution.parseCsv(initial), LetterDistribution.parseCsv(general));
    }

    /**
     * Exact lookup; hidden words are returned too, with their flag.
     */
    public Optional<WordRow> exact(String word) throws IOException {
        List<Document> docs = search(WORDS, new TermQuery(new Term(WORD_LOWER, word.toLowerCase(Locale.ROOT))), 1);
        return docs.isEmpty() ? Optional.empty() : Optional.of(toWordRow(docs.get(0)));
    }

    /**
     * Best-ranked completions stored under {@code prefix}.
     */
    public List<PrefixRow> prefix(String prefix, int limit, boolean includeHidden) throws IOException {
        Query query = withHiddenFilter(new TermQuery(new Term(PREFIX_LOWER, prefix.toLowerCase(Locale.ROOT))), includeHidden);
        List<PrefixRow> rows = new ArrayList<>();
        for (Document doc : search(PREFIXES, query, limit)) {
            rows.add(toPrefixRow(doc));
        }
        return rows;
    }

    /**
     * Words ending in {@code suffix}, found by a prefix scan over reversed keys.
     */
    public List<SuffixRow> suffix(String suffix, int limit, boolean includeHidden) throws IOException {
        String reversed = ExactSuffixIndexBuilder.reverse(suffix.toLowerCase(Locale.ROOT));
        Query query = withHiddenFilter(new PrefixQuery(new Term(WORD_LOWER_REVERSED, reversed)), includeHidden);
        List<SuffixRow> rows = new ArrayList<>();
        for (Document doc : search(WORDS_BY_SUFFIX, query, limit)) {
            rows.add(toSuffixRow(doc));
        }
        return rows;
    }

    /**
     * Rows stored under one delete hash.
     */
    public List<DeleteRow> deletesForHash(long hash) throws IOException {
        List<DeleteRow> rows = new ArrayList<>();
        for (Document doc : searchAll(SYMSPELL_DELETES, LongPoint.newExactQuery(DELETE_HASH, hash))) {
            rows.add(toDeleteRow(doc));
        }
        return rows;
    }

    /**
     * Candidate generation: probes the hash of every delete of {@code input}.
     * The result is a superset of true neighbours and may include hash collisions.
     */
    public List<DeleteRow> deleteCandidates(String input, int deleteBudget) throws IOException {
        Set<String> deletes = new DeleteGenerator(deleteBudget).deletes(input.toLowerCase(Locale.ROOT));
        long[] hashes = deletes.stream().mapToLong(DeleteHash::hash).distinct().toArray();
        if (hashes.length == 0) {
            return List.of();
        }
        Map<String, DeleteRow> unique = new LinkedHashMap<>();
        for (Document doc : searchAll(SYMSPELL_DELETES, LongPoint.newSetQuery(DELETE_HASH, hashes))) {
            DeleteRow row = toDeleteRow(doc);
            unique.putIfAbsent(row.wordLower(), row);
        }
        List<DeleteRow> rows = new ArrayList<>(unique.values());
        rows.sort(Comparator.comparingInt(DeleteRow::frequencyRank));
        return rows;
    }

    /**
     * Delete-dictionary correction: candidates re-verified by exact edit distance,
     * ordered by distance then rank.
     */
    public List<BkTree.Match> fuzzyDelete(String input, int maxDistance) throws IOException {
        String lower = input.toLowerCase(Locale.ROOT);
        List<BkTree.Match> matches = new ArrayList<>();
        for (DeleteRow row : deleteCandidates(lower, maxDistance)) {
            int distance = EditDistance.between(lower, row.wordLower());
            if (distance <= maxDistance) {
                matches.add(new BkTree.Match(row.word(), distance, row.frequencyRank(), false));
            }
        }
        matches.sort(Comparator.comparingInt(BkTree.Match::distance).thenComparingInt(BkTree.Match::frequencyRank));
        return matches;
    }

    /**
     * Radius search over the persisted BK-tree, visiting only children whose edge distance
     * lies within {@code [d - radius, d + radius]}. Hidden nodes are skipped in the result.
     */
    public List<BkTree.Match> bkSearch(String query, int radius) throws IOException {
        if (!hasTable(BK_NODES) || rowCount(BK_NODES) == 0) {
            return List.of();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        List<BkTree.Match> matches = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(1);
        while (!queue.isEmpty()) {
            int nodeId = queue.poll();
            List<Document> nodeDocs = search(BK_NODES, IntPoint.newExactQuery(NODE_ID, nodeId), 1);
            if (nodeDocs.isEmpty()) {
                throw new IOException("Dangling BK-tree node id " + nodeId + " in " + artifactPath);
            }
            BkNodeRow node = toBkNodeRow(nodeDocs.get(0));
            int distance = EditDistance.between(lower, node.word());
            if (distance <= radius && !node.hidden()) {
                matches.add(new BkTree.Match(node.word(), distance, node.frequencyRank(), false));
            }

            BooleanQuery edgeQuery = new BooleanQuery.Builder()
                .add(IntPoint.newExactQuery(PARENT_ID, nodeId), BooleanClause.Occur.FILTER)
                .add(IntPoint.newRangeQuery(DISTANCE, Math.max(0, distance - radius), distance + radius),
                    BooleanClause.Occur.FILTER)
                .build();
            for (Document edge : searchAll(BK_EDGES, edgeQuery)) {
                queue.add(edge.getField(CHILD_ID).numericValue().intValue());
            }
        }
        matches.sort(Comparator.comparingInt(BkTree.Match::distance).thenComparingInt(BkTree.Match::frequencyRank));
        return matches;
    }

    public List<WordRow> allWords() throws IOException {
        List<WordRow> rows = new ArrayList<>();
        for (Document doc : scan(WORDS)) {
            rows.add(toWordRow(doc));
        }
        return rows;
    }

    public List<SuffixRow> allSuffixes() throws IOException {
        List<SuffixRow> rows = new ArrayList<>();
        for (Document doc : scan(WORDS_BY_SUFFIX)) {
            rows.add(toSuffixRow(doc));
        }
        return rows;
    }

    public List<PrefixRow> allPrefixes() throws IOException {
        List<PrefixRow> rows = new ArrayList<>();
        for (Document doc : scan(PREFIXES)) {
            rows.add(toPrefixRow(doc));
        }
        return rows;
    }

    public List<DeleteRow> allDeletes() throws IOException {
        List<DeleteRow> rows = new ArrayList<>();
        for (Document doc : scan(SYMSPELL_DELETES)) {
            rows.add(toDeleteRow(doc));
        }
        return rows;
    }

    public List<BkNodeRow> allBkNodes() throws IOException {
        List<BkNodeRow> rows = new ArrayList<>();
        for (Document doc : scan(BK_NODES)) {
            rows.add(toBkNodeRow(doc));
        }
        return rows;
    }

    public List<BkEdgeRow> allBkEdges() throws IOException {
        List<BkEdgeRow> rows = new ArrayList<>();
        for (Document doc : scan(BK_EDGES)) {
            rows.add(new BkEdgeRow(
                doc.getField(PARENT_ID).numericValue().intValue(),
                doc.getField(CHILD_ID).numericValue().intValue(),
                doc.getField(DISTANCE).numericValue().intValue()));
        }
        return rows;
    }

    @Override
    public void close() throws IOException {
        IOException first = null;
        for (DirectoryReader reader : readers.values()) {
            try {
                reader.close();
            } catch (IOException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        readers.clear();
        if (first != null) {
            throw first;
        }
    }

    private Map<String, String> loadKv() throws IOException {
        Map<String, String> values = new HashMap<>();
        for (Document doc : scan(KV)) {
            values.put(doc.get(KEY), doc.get(VALUE));
        }
        return values;
    }

    private static Query withHiddenFilter(Query query, boolean includeHidden) {
        if (includeHidden) {
            return query;
        }
        return new BooleanQuery.Builder()
            .add(query, BooleanClause.Occur.FILTER)
            .add(IntPoint.newExactQuery(HIDDEN, 0), BooleanClause.Occur.FILTER)
            .build();
    }

    private List<Document> searchAll(String table, Query query) throws IOException {
        DirectoryReader reader = readers.get(table);
        if (reader == null) {
            return List.of();
        }
        int count = new IndexSearcher(reader).count(query);
        return search(table, query, Math.max(1, count));
    }

    private List<Document> search(String table, Query query, int limit) throws IOException {
        DirectoryReader reader = readers.get(table);
        if (reader == null) {
            return List.of();
        }
        IndexSearcher searcher = new IndexSearcher(reader);
        TopDocs top = searcher.search(query, Math.max(1, limit), ORDER_BY_TABLE.get(table));
        StoredFields storedFields = searcher.storedFields();
        List<Document> docs = new ArrayList<>(top.scoreDocs.length);
        for (ScoreDoc sd : top.scoreDocs) {
            docs.add(storedFields.document(sd.doc));
        }
        return docs;
    }

    private List<Document> scan(String table) throws IOException {
        DirectoryReader reader = readers.get(table);
        List<Document> docs = new ArrayList<>();
        if (reader == null) {
            return docs;
        }
        for (LeafReaderContext leaf : reader.leaves()) {
            Bits live = leaf.reader().getLiveDocs();
            StoredFields storedFields = leaf.reader().storedFields();
            for (int doc = 0; doc < leaf.reader().maxDoc(); doc++) {
                if (live != null && !live.get(doc)) {
                    continue;
                }
                docs.add(storedFields.document(doc));
            }
        }
        return docs;
    }

    private static WordRow toWordRow(Document doc) {
        return new WordRow(doc.get(WORD_LOWER), doc.get(WORD_LOWER_REVERSED), intField(doc, FREQUENCY_RANK),
            doc.get(WORD), intField(doc, HIDDEN) != 0);
    }

    private static SuffixRow toSuffixRow(Document doc) {
        return new SuffixRow(doc.get(WORD_LOWER_REVERSED), intField(doc, FREQUENCY_RANK), doc.get(WORD),
            doc.get(WORD_LOWER), intField(doc, HIDDEN) != 0);
    }

    private static PrefixRow toPrefixRow(Document doc) {
        return new PrefixRow(doc.get(PREFIX_LOWER), doc.get(WORD), intField(doc, FREQUENCY_RANK),
            intField(doc, HIDDEN) != 0);
    }

    private static DeleteRow toDeleteRow(Document doc) {
        return new DeleteRow(doc.getField(DELETE_HASH).numericValue().longValue(), doc.get(WORD_LOWER),
            intField(doc, FREQUENCY_RANK), doc.get(WORD));
    }

    private static BkNodeRow toBkNodeRow(Document doc) {
        return new BkNodeRow(intField(doc, NODE_ID), doc.get(WORD), intField(doc, FREQUENCY_RANK),
            intField(doc, HIDDEN) != 0);
    }

    private static int intField(Document doc, String name) {
        return doc.getField(name).numericValue().intValue();
    }
}
