package pl.marcinmilkowski.keyboard_lexicon.indexer.store;

import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;

/**
 * Table and column names of the index artifact.
 *
 * Each table is a Lucene index in its own subdirectory of the artifact, sorted on its
 * primary-key columns so rows are clustered by key. {@link #PK} holds the composite key
 * of every row.
 */
public final class LexiconTables {

    public static final int SCHEMA_VERSION = 1;

    public static final String WORDS = "words";
    public static final String WORDS_BY_SUFFIX = "words_by_suffix";
    public static final String PREFIXES = "prefixes";
    public static final String SYMSPELL_DELETES = "symspell_deletes";
    public static final String BK_NODES = "bk_nodes";
    public static final String BK_EDGES = "bk_edges";
    public static final String KV = "kv";

    public static final String PK = "_pk";

    public static final String WORD_LOWER = "word_lower";
    public static final String WORD_LOWER_REVERSED = "word_lower_reversed";
    public static final String FREQUENCY_RANK = "frequency_rank";
    public static final String WORD = "word";
    public static final String HIDDEN = "hidden";
    public static final String PREFIX_LOWER = "prefix_lower";
    public static final String DELETE_HASH = "delete_hash";
    public static final String NODE_ID = "node_id";
    public static final String PARENT_ID = "parent_id";
    public static final String CHILD_ID = "child_id";
    public static final String DISTANCE = "distance";
    public static final String KEY = "key";
    public static final String VALUE = "value";

    public static final String KV_FUZZY_STRATEGY = "fuzzy_strategy";
    public static final String KV_WORD_COUNT = "word_count";
    public static final String KV_SCHEMA_VERSION = "schema_version";

    private LexiconTables() {
    }

    static Sort sortFor(String table) {
        switch (table) {
            case WORDS:
                return new Sort(new SortField(WORD_LOWER, SortField.Type.STRING),
                    new SortField(FREQUENCY_RANK, SortField.Type.INT));
            case WORDS_BY_SUFFIX:
                return new Sort(new SortField(WORD_LOWER_REVERSED, SortField.Type.STRING),
                    new SortField(FREQUENCY_RANK, SortField.Type.INT));
            case PREFIXES:
                return new Sort(new SortField(PREFIX_LOWER, SortField.Type.STRING),
                    new SortField(FREQUENCY_RANK, SortField.Type.INT));
            case SYMSPELL_DELETES:
                return new Sort(new SortField(DELETE_HASH, SortField.Type.LONG),
                    new SortField(WORD_LOWER, SortField.Type.STRING));
            case BK_NODES:
                return new Sort(new SortField(NODE_ID, SortField.Type.INT));
            case BK_EDGES:
                return new Sort(new SortField(PARENT_ID, SortField.Type.INT),
                    new SortField(DISTANCE, SortField.Type.INT));
            case KV:
                return new Sort(new SortField(KEY, SortField.Type.STRING));
            default:
                throw new IllegalArgumentException("Unknown table: " + table);
        }
    }

    static String compositeKey(Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('\u0000');
            }
            sb.append(parts[i]);
        }
        return sb.toString();
    }
}
