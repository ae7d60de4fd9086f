package pl.marcinmilkowski.keyboard_lexicon.tools;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import pl.marcinmilkowski.keyboard_lexicon.indexer.store.LexiconTables;
import pl.marcinmilkowski.keyboard_lexicon.query.LexiconIndexReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prints a JSON fingerprint of a lexicon artifact: row counts, kv entries and a content
 * digest per table. Two builds from identical inputs have identical digests.
 */
public class IndexFingerprintTool {

    public static void main(String[] args) throws Exception {
        Map<String, String> params = parseArgs(args);

        String indexArg = params.get("index");
        if (indexArg == null || indexArg.isBlank()) {
            System.err.println("Usage: IndexFingerprintTool --index <path> [--output <path>]");
            System.exit(1);
            return;
        }

        Path indexPath = Paths.get(indexArg);
        if (!Files.exists(indexPath)) {
            throw new IOException("Index path does not exist: " + indexPath);
        }
        Path outputPath = params.containsKey("output") ? Paths.get(params.get("output")) : null;

        String pretty;
        try (LexiconIndexReader reader = new LexiconIndexReader(indexPath)) {
            pretty = JSON.toJSONString(fingerprint(reader), JSONWriter.Feature.PrettyFormat);
        }

        if (outputPath != null) {
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            Files.writeString(outputPath, pretty);
            System.out.println("Fingerprint written: " + outputPath.toAbsolutePath());
        } else {
            System.out.println(pretty);
        }
    }

    public static Map<String, Object> fingerprint(LexiconIndexReader reader) throws IOException {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timestamp_utc", Instant.now().toString());
        out.put("index_path", reader.getArtifactPath().toAbsolutePath().toString());
        out.put("fuzzy_strategy", reader.getFuzzyStrategy().alias());

        Map<String, Integer> rows = new LinkedHashMap<>();
        for (String table : reader.getTables()) {
            rows.put(table, reader.rowCount(table));
        }
        out.put("rows", rows);
        out.put("kv", new TreeMap<>(reader.getKv()));
        out.put("digests", tableDigests(reader));
        return out;
    }

    /**
     * SHA-256 over each table's rows in key order. Physical file layout is not part of it.
     */
    public static Map<String, String> tableDigests(LexiconIndexReader reader) throws IOException {
        Map<String, String> digests = new LinkedHashMap<>();
        digests.put(LexiconTables.WORDS, digest(reader.allWords()));
        digests.put(LexiconTables.WORDS_BY_SUFFIX, digest(reader.allSuffixes()));
        digests.put(LexiconTables.PREFIXES, digest(reader.allPrefixes()));
        if (reader.hasTable(LexiconTables.SYMSPELL_DELETES)) {
            digests.put(LexiconTables.SYMSPELL_DELETES, digest(reader.allDeletes()));
        }
        if (reader.hasTable(LexiconTables.BK_NODES)) {
            digests.put(LexiconTables.BK_NODES, digest(reader.allBkNodes()));
            digests.put(LexiconTables.BK_EDGES, digest(reader.allBkEdges()));
        }
        digests.put(LexiconTables.KV, digest(List.copyOf(new TreeMap<>(reader.getKv()).entrySet())));
        return digests;
    }

    private static String digest(List<?> rows) {
        MessageDigest sha;
        try {
            sha = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (Object row : rows) {
            sha.update(row.toString().getBytes(StandardCharsets.UTF_8));
            sha.update((byte) '\n');
        }
        return HexFormat.of().formatHex(sha.digest());
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            String key = arg.substring(2).toLowerCase(Locale.ROOT);
            String value = "true";
            if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                value = args[++i];
            }
            out.put(key, value);
        }
        return out;
    }
}
