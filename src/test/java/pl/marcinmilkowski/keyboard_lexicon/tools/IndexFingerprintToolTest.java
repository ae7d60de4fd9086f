package pl.marcinmilkowski.keyboard_lexicon.tools;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.keyboard_lexicon.config.FuzzyStrategy;
import pl.marcinmilkowski.keyboard_lexicon.config.TestCorpus;
import pl.marcinmilkowski.keyboard_lexicon.indexer.LexiconIndexPipeline;
import pl.marcinmilkowski.keyboard_lexicon.indexer.store.LexiconTables;
import pl.marcinmilkowski.keyboard_lexicon.query.LexiconIndexReader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IndexFingerprintToolTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Digests cover every table and differ when the content differs")
    void digests() throws Exception {
        Path small = tempDir.resolve("small.idx");
        Path large = tempDir.resolve("large.idx");
        new LexiconIndexPipeline(TestCorpus.ordinalConfig(small).prefixCap(2).build()).run();
        new LexiconIndexPipeline(TestCorpus.ordinalConfig(large).prefixCap(20).build()).run();

        try (LexiconIndexReader a = new LexiconIndexReader(small);
             LexiconIndexReader b = new LexiconIndexReader(large)) {
            Map<String, String> first = IndexFingerprintTool.tableDigests(a);
            Map<String, String> second = IndexFingerprintTool.tableDigests(b);

            assertEquals(first.keySet(), second.keySet());
            assertTrue(first.containsKey(LexiconTables.SYMSPELL_DELETES));
            assertFalse(first.containsKey(LexiconTables.BK_NODES));
            assertEquals(first.get(LexiconTables.WORDS), second.get(LexiconTables.WORDS));
            assertNotEquals(first.get(LexiconTables.PREFIXES), second.get(LexiconTables.PREFIXES));
            first.values().forEach(hex -> assertEquals(64, hex.length()));
        }
    }

    @Test
    @DisplayName("main writes a JSON fingerprint file")
    void writesJson() throws Exception {
        Path index = tempDir.resolve("words.idx");
        Path json = tempDir.resolve("out/fingerprint.json");
        new LexiconIndexPipeline(TestCorpus.ordinalConfig(index).fuzzyStrategy(FuzzyStrategy.BK_TREE).build()).run();

        IndexFingerprintTool.main(new String[]{"--index", index.toString(), "--output", json.toString()});

        JSONObject parsed = JSON.parseObject(Files.readString(json));
        assertEquals("bktree", parsed.getString("fuzzy_strategy"));
        assertEquals(TestCorpus.ORDINAL_WORD_COUNT, parsed.getJSONObject("rows").getIntValue(LexiconTables.WORDS));
        assertTrue(parsed.getJSONObject("digests").containsKey(LexiconTables.BK_EDGES));
        assertEquals("1", parsed.getJSONObject("kv").getString(LexiconTables.KV_SCHEMA_VERSION));
    }
}
