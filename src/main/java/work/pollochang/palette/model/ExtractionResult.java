package work.pollochang.palette.model;

import java.util.List;

/**
 * 萃取結果。{@code colors} 依權重遞減排序，{@code dominantColor} 即第一個顏色。
 * @param colors         萃取出的顏色
 * @param dominantColor  主色
 * @param processingTime 處理耗時 (毫秒)，僅供觀察
 */
public record ExtractionResult(List<Color> colors, Color dominantColor, long processingTime) {

    public ExtractionResult {
        colors = List.copyOf(colors);
    }

    public static ExtractionResult of(List<Color> colors, long processingTime) {
        return new ExtractionResult(colors, colors.isEmpty() ? null : colors.get(0), processingTime);
    }
}
