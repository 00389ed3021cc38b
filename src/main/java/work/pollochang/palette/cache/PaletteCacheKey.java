package work.pollochang.palette.cache;

/**
 * 萃取結果快取的 Key。萃取為確定性演算法，相同內容與參數必得相同結果。
 * @param contentHash        圖片檔案內容的 SHA-256 (小寫十六進位)
 * @param colorCount         要求的顏色數量
 * @param includeTransparent 是否納入透明像素
 */
public record PaletteCacheKey(String contentHash, int colorCount, boolean includeTransparent) {}
