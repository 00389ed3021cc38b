package work.pollochang.palette.suggest;

import java.util.List;

/**
 * @param name        顯示名稱
 * @param stops       依序排列的色標
 * @param cssGradient 等價的 CSS 漸層語法
 */
public record GradientSuggestion(String name, List<GradientStop> stops, String cssGradient) {

    public GradientSuggestion {
        stops = List.copyOf(stops);
    }
}
