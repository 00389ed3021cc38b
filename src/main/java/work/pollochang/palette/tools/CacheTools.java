package work.pollochang.palette.tools;

import work.pollochang.palette.cache.PaletteCacheKey;
import work.pollochang.palette.model.ExtractionOptions;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public class CacheTools {

    /**
     * 以檔案內容的 SHA-256 與萃取參數產生快取 Key。
     * @param content 圖片檔案的原始 bytes
     * @param options 萃取參數
     * @return 快取 Key
     */
    public static PaletteCacheKey createKey(byte[] content, ExtractionOptions options) {
        return new PaletteCacheKey(sha256Hex(content), options.colorCount(), options.includeTransparent());
    }

    static String sha256Hex(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // 每個 JDK 都必須提供 SHA-256
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
