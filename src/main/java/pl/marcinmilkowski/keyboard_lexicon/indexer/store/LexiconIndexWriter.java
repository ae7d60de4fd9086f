package pl.marcinmilkowski.keyboard_lexicon.indexer.store;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.KeywordAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.MMapDirectory;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.keyboard_lexicon.indexer.PrefixRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.SuffixRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.WordRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.BkEdgeRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.BkNodeRow;
import pl.marcinmilkowski.keyboard_lexicon.indexer.fuzzy.DeleteRow;
import pl.marcinmilkowski.keyboard_lexicon.lexicon.IndexWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static pl.marcinmilkowski.keyboard_lexicon.indexer.store.LexiconTables.*;

/**
 * Writes lexicon tables as sorted Lucene indexes under one artifact directory.
 *
 * Each table is written and committed in a single batch by its own {@link IndexWriter}.
 * Rows whose composite key was already written are ignored. Not thread-safe; the
 * pipeline calls it from one thread after all builders finished.
 */
public class LexiconIndexWriter {

    private static final Logger log = LoggerFactory.getLogger(LexiconIndexWriter.class);

    private final Path artifactDir;

    public LexiconIndexWriter(Path artifactDir) {
        this.artifactDir = artifactDir;
    }

    public long writeWords(Iterable<WordRow> rows) throws IndexWriteException {
        return writeTable(WORDS, rows, row -> {
            Document doc = new Document();
            doc.add(new StringField(PK, compositeKey(row.wordLower(), row.frequencyRank()), Field.Store.NO));
            addKeyString(doc, WORD_LOWER, row.wordLower());
            addString(doc, WORD_LOWER_REVERSED, row.wordLowerReversed());
            addInt(doc, FREQUENCY_RANK, row.frequencyRank());
            doc.add(new StoredField(WORD, row.word()));
            addInt(doc, HIDDEN, row.hidden() ? 1 : 0);
            return doc;
        }, row -> compositeKey(row.wordLower(), row.frequencyRank()));
    }

    public long writeSuffixes(Iterable<SuffixRow> rows) throws IndexWriteException {
        return writeTable(WORDS_BY_SUFFIX, rows, row -> {
            Document doc = new Document();
            doc.add(new StringField(PK, compositeKey(row.wordLowerReversed(), row.frequencyRank()), Field.Store.NO));
            addKeyString(doc, WORD_LOWER_REVERSED, row.wordLowerReversed());
            addInt(doc, FREQUENCY_RANK, row.frequencyRank());
            doc.add(new StoredField(WORD, row.word()));
            addString(doc, WORD_LOWER, row.wordLower());
            addInt(doc, HIDDEN, row.hidden() ? 1 : 0);
            return doc;
        }, row -> compositeKey(row.wordLowerReversed(), row.frequencyRank()));
    }

    public long writePrefixes(Iterable<PrefixRow> rows) throws IndexWriteException {
        return writeTable(PREFIXES, rows, row -> {
            Document doc = new Document();
            doc.add(new StringField(PK, compositeKey(row.prefixLower(), row.frequencyRank()), Field.Store.NO));
            addKeyString(doc, PREFIX_LOWER, row.prefixLower());
            doc.add(new StoredField(WORD, row.word()));
            addInt(doc, FREQUENCY_RANK, row.frequencyRank());
            addInt(doc, HIDDEN, row.hidden() ? 1 : 0);
            return doc;
        }, row -> compositeKey(row.prefixLower(), row.frequencyRank()));
    }

    /**
     * Delete rows carry hash, rank and display word together so a hash probe needs no join.
     */
    public long writeDeletes(Iterable<DeleteRow> rows) throws IndexWriteException {
        return writeTable(SYMSPELL_DELETES, rows, row -> {
            Document doc = new Document();
            doc.add(new StringField(PK, compositeKey(row.deleteHash(), row.wordLower()), Field.Store.NO));
            addLong(doc, DELETE_HASH, row.deleteHash());
            addKeyString(doc, WORD_LOWER, row.wordLower());
            addInt(doc, FREQUENCY_RANK, row.frequencyRank());
            doc.add(new StoredField(WORD, row.word()));
            return doc;
        }, row -> compositeKey(row.deleteHash(), row.wordLower()));
    }

    public long writeBkNodes(Iterable<BkNodeRow> rows) throws IndexWriteException {
        return writeTable(BK_NODES, rows, row -> {
            Document doc = new Document();
            doc.add(new StringField(PK, String.valueOf(row.nodeId()), Field.Store.NO));
            addInt(doc, NODE_ID, row.nodeId());
            doc.add(new StoredField(WORD, row.word()));
            addInt(doc, FREQUENCY_RANK, row.frequencyRank());
            addInt(doc, HIDDEN, row.hidden() ? 1 : 0);
            return doc;
        }, row -> String.valueOf(row.nodeId()));
    }

    public long writeBkEdges(Iterable<BkEdgeRow> rows) throws IndexWriteException {
        return writeTable(BK_EDGES, rows, row -> {
            Document doc = new Document();
            doc.add(new StringField(PK, compositeKey(row.parentId(), row.childId()), Field.Store.NO));
            addInt(doc, PARENT_ID, row.parentId());
            addInt(doc, CHILD_ID, row.childId());
            addInt(doc, DISTANCE, row.distance());
            return doc;
        }, row -> compositeKey(row.parentId(), row.childId()));
    }

    public long writeKv(Map<String, String> entries) throws IndexWriteException {
        return writeTable(KV, entries.entrySet(), entry -> {
            Document doc = new Document();
            doc.add(new StringField(PK, entry.getKey(), Field.Store.NO));
            addKeyString(doc, KEY, entry.getKey());
            doc.add(new StoredField(VALUE, entry.getValue()));
            return doc;
        }, Map.Entry::getKey);
    }

    private <T> long writeTable(String table, Iterable<T> rows, Function<T, Document> toDocument,
                                Function<T, String> primaryKey) throws IndexWriteException {
        Path tablePath = artifactDir.resolve(table);
        Set<String> written = new HashSet<>();
        long count = 0;
        long ignored = 0;

        try {
            Files.createDirectories(tablePath);
            Analyzer analyzer = new KeywordAnalyzer();
            IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
            config.setIndexSort(LexiconTables.sortFor(table));
            config.setRAMBufferSizeMB(256.0);

            try (Directory directory = MMapDirectory.open(tablePath);
                 IndexWriter writer = new IndexWriter(directory, config)) {
                for (T row : rows) {
                    if (!written.add(primaryKey.apply(row))) {
                        ignored++;
                        continue;
                    }
                    writer.addDocument(toDocument.apply(row));
                    count++;
                }
                writer.forceMerge(1);
                writer.commit();
            }
        } catch (IOException e) {
            throw new IndexWriteException("Failed to write table " + table + " at " + tablePath, e);
        }

        if (ignored > 0) {
            log.warn("Table {}: ignored {} rows with a duplicate primary key", table, ignored);
        }
        log.info("Committed table {}: {} rows", table, count);
        return count;
    }

    private static void addKeyString(Document doc, String name, String value) {
        doc.add(new StringField(name, value, Field.Store.YES));
        doc.add(new SortedDocValuesField(name, new BytesRef(value)));
    }

    private static void addString(Document doc, String name, String value) {
        doc.add(new StringField(name, value, Field.Store.YES));
    }

    private static void addInt(Document doc, String name, int value) {
        doc.add(new IntPoint(name, value));
        doc.add(new StoredField(name, value));
        doc.add(new NumericDocValuesField(name, value));
    }

    private static void addLong(Document doc, String name, long value) {
        doc.add(new LongPoint(name, value));
        doc.add(new StoredField(name, value));
        doc.add(new NumericDocValuesField(name, value));
    }
}
