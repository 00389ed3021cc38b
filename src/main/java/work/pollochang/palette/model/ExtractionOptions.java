package work.pollochang.palette.model;

/**
 * 萃取參數。
 * @param colorCount         最多輸出的顏色數量
 * @param includeTransparent 是否納入 alpha &lt; 128 的像素
 */
public record ExtractionOptions(int colorCount, boolean includeTransparent) {

    public static final int DEFAULT_COLOR_COUNT = 6;

    public ExtractionOptions {
        if (colorCount < 1) {
            throw new IllegalArgumentException("colorCount 至少為 1: " + colorCount);
        }
    }

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(DEFAULT_COLOR_COUNT, false);
    }
}
