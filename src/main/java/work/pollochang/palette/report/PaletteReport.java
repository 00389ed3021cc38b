package work.pollochang.palette.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import work.pollochang.palette.model.ExtractionResult;
import work.pollochang.palette.suggest.GradientSuggestion;
import work.pollochang.palette.suggest.HarmonySuggestion;
import work.pollochang.palette.suggest.PaletteCompletionSuggestion;

import java.util.List;

/**
 * 單張圖片的輸出報告，寫成 {@code <檔名>.palette.json}。
 * 未要求建議時，三個建議欄位為 null 且不輸出。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaletteReport(
        String source,
        ExtractionResult result,
        List<HarmonySuggestion> harmonies,
        List<PaletteCompletionSuggestion> completions,
        List<GradientSuggestion> gradients
) {

    public static PaletteReport withoutSuggestions(String source, ExtractionResult result) {
        return new PaletteReport(source, result, null, null, null);
    }
}
