package work.pollochang.palette.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.palette.model.Rgb;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 從 RGBA 像素緩衝區以固定步距取樣。
 * <p>
 * 取樣上限固定為 {@value #MAX_SAMPLE_SIDE} x {@value #MAX_SAMPLE_SIDE}，與圖片解析度無關。
 * 空結果不是錯誤，由呼叫端決定如何處理。
 */
@Slf4j
public final class PixelSampler {

    public static final int MAX_SAMPLE_SIDE = 200;
    public static final int MAX_SAMPLE_BUDGET = MAX_SAMPLE_SIDE * MAX_SAMPLE_SIDE;
    static final int ALPHA_THRESHOLD = 128;

    private PixelSampler() {}

    /**
     * @param rgba               每像素 4 bytes (R, G, B, A) 的緩衝區
     * @param width              寬
     * @param height             高
     * @param includeTransparent 為 true 時不略過 alpha &lt; 128 的像素
     * @return 取樣到的 RGB 列表，可能為空
     */
    public static List<Rgb> sample(byte[] rgba, int width, int height, boolean includeTransparent) {
        Objects.requireNonNull(rgba, "rgba must not be null");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("圖片尺寸不可為負數: " + width + "x" + height);
        }
        long totalPixels = (long) width * height;
        if (rgba.length < totalPixels * 4) {
            throw new IllegalArgumentException(String.format("像素緩衝區長度 %d 小於 %dx%dx4", rgba.length, width, height));
        }

        int step = stepFor(totalPixels);
        List<Rgb> colors = new ArrayList<>();

        for (int y = 0; y < height; y += step) {
            for (int x = 0; x < width; x += step) {
                int i = (y * width + x) * 4;
                int alpha = rgba[i + 3] & 0xFF;
                if (!includeTransparent && alpha < ALPHA_THRESHOLD) {
                    continue;
                }
                colors.add(new Rgb(rgba[i] & 0xFF, rgba[i + 1] & 0xFF, rgba[i + 2] & 0xFF));
            }
        }

        log.trace("取樣步距 {}，共取得 {} 個像素 (總像素 {})", step, colors.size(), totalPixels);
        return colors;
    }

    static int stepFor(long totalPixels) {
        return Math.max(1, (int) Math.floor(Math.sqrt((double) totalPixels / MAX_SAMPLE_BUDGET)));
    }
}
