package work.pollochang.palette.tools;

import org.junit.jupiter.api.Test;
import work.pollochang.palette.cache.PaletteCacheKey;
import work.pollochang.palette.model.ExtractionOptions;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CacheToolsTest {

    @Test
    void testSha256Hex_KnownVector() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                CacheTools.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void testCreateKey_ShouldIncludeOptions() {
        byte[] content = {1, 2, 3};

        PaletteCacheKey key = CacheTools.createKey(content, new ExtractionOptions(4, true));

        assertEquals(64, key.contentHash().length());
        assertEquals(4, key.colorCount());
        assertTrue(key.includeTransparent());
        assertEquals(key, CacheTools.createKey(new byte[]{1, 2, 3}, new ExtractionOptions(4, true)));
        assertNotEquals(key, CacheTools.createKey(content, new ExtractionOptions(5, true)));
    }
}
