package work.pollochang.palette.report;

import work.pollochang.palette.model.ExtractionOptions;

/**
 * 批次萃取參數。
 * @param colorCount         每張圖片要萃取的顏色數量
 * @param includeTransparent 是否納入半透明像素
 * @param includeSuggestions 報告中是否附上和諧配色、補色與漸層建議
 */
public record ExtractionParams(int colorCount, boolean includeTransparent, boolean includeSuggestions) {

    public ExtractionOptions toOptions() {
        return new ExtractionOptions(colorCount, includeTransparent);
    }
}
