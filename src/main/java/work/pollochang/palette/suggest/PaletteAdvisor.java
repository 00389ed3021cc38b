package work.pollochang.palette.suggest;

import work.pollochang.palette.core.ColorSpace;
import work.pollochang.palette.model.Color;
import work.pollochang.palette.model.Hsl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 依調色盤的統計特徵提出補色建議。
 *
 * <p>建議依序為：
 * <ol>
 *   <li>最高明度低於 85 時，主色的淺色版；最低明度高於 20 時，主色的深色版。</li>
 *   <li>平均飽和度高於 30 時，低飽和版；低於 80 時，高飽和版。</li>
 *   <li>色相環上最大的兩個缺口若超過 60°，在缺口中點補一色 (使用平均飽和度與明度)。</li>
 *   <li>主色的互補色 ±30° 內沒有任何顏色時，補上互補色。</li>
 * </ol>
 */
public final class PaletteAdvisor {

    public static final int DEFAULT_MAX_SUGGESTIONS = 6;

    private static final int LIGHTNESS_STEP = 20;
    private static final int SATURATION_STEP = 20;
    private static final int DESATURATION_STEP = 30;
    private static final int MIN_HUE_GAP = 60;
    private static final int COMPLEMENT_TOLERANCE = 30;

    private record HueGap(int start, int gap) {}

    private PaletteAdvisor() {}

    public static List<PaletteCompletionSuggestion> getPaletteCompletionSuggestions(List<Color> existingColors) {
        return getPaletteCompletionSuggestions(existingColors, DEFAULT_MAX_SUGGESTIONS);
    }

    /**
     * @param existingColors 既有顏色，第一個視為主色；空列表回傳空列表
     * @param maxSuggestions 最多建議數
     */
    public static List<PaletteCompletionSuggestion> getPaletteCompletionSuggestions(List<Color> existingColors, int maxSuggestions) {
        if (existingColors == null || existingColors.isEmpty() || maxSuggestions <= 0) {
            return List.of();
        }

        List<PaletteCompletionSuggestion> suggestions = new ArrayList<>();
        Color dominant = existingColors.get(0);
        Hsl dominantHsl = dominant.hsl();

        double sumLightness = 0;
        double sumSaturation = 0;
        int minLightness = Integer.MAX_VALUE;
        int maxLightness = Integer.MIN_VALUE;
        List<Integer> hues = new ArrayList<>();
        for (Color color : existingColors) {
            Hsl hsl = color.hsl();
            sumLightness += hsl.l();
            sumSaturation += hsl.s();
            minLightness = Math.min(minLightness, hsl.l());
            maxLightness = Math.max(maxLightness, hsl.l());
            hues.add(hsl.h());
        }
        double avgLightness = sumLightness / existingColors.size();
        double avgSaturation = sumSaturation / existingColors.size();

        if (maxLightness < 85) {
            suggestions.add(new PaletteCompletionSuggestion(SuggestionType.LIGHTER, "Lighter Variant",
                    Color.fromHsl(ColorSpace.lighten(dominantHsl, LIGHTNESS_STEP)),
                    "Add a lighter shade for highlights and backgrounds"));
        }
        if (minLightness > 20) {
            suggestions.add(new PaletteCompletionSuggestion(SuggestionType.DARKER, "Darker Variant",
                    Color.fromHsl(ColorSpace.darken(dominantHsl, LIGHTNESS_STEP)),
                    "Add a darker shade for text and emphasis"));
        }

        if (avgSaturation > 30) {
            suggestions.add(new PaletteCompletionSuggestion(SuggestionType.DESATURATED, "Muted Variant",
                    Color.fromHsl(ColorSpace.desaturate(dominantHsl, DESATURATION_STEP)),
                    "Add a muted tone for subtle elements"));
        }
        if (avgSaturation < 80) {
            suggestions.add(new PaletteCompletionSuggestion(SuggestionType.SATURATED, "Vibrant Variant",
                    Color.fromHsl(ColorSpace.saturate(dominantHsl, SATURATION_STEP)),
                    "Add a vibrant accent color"));
        }

        for (HueGap hueGap : largestHueGaps(hues, 2)) {
            if (hueGap.gap() > MIN_HUE_GAP) {
                double midHue = (hueGap.start() + hueGap.gap() / 2.0) % 360;
                Hsl gapHsl = new Hsl((int) Math.round(midHue), (int) Math.round(avgSaturation), (int) Math.round(avgLightness));
                suggestions.add(new PaletteCompletionSuggestion(SuggestionType.GAP_FILL, "Gap Fill",
                        Color.fromHsl(gapHsl),
                        "Fill the gap in the color wheel (around " + Math.round(midHue) + "°)"));
            }
        }

        int complementaryHue = (dominantHsl.h() + 180) % 360;
        boolean hasComplementary = false;
        for (int hue : hues) {
            int diff = Math.abs(hue - complementaryHue);
            if (diff < COMPLEMENT_TOLERANCE || diff > 360 - COMPLEMENT_TOLERANCE) {
                hasComplementary = true;
                break;
            }
        }
        if (!hasComplementary) {
            suggestions.add(new PaletteCompletionSuggestion(SuggestionType.HARMONY, "Complementary Accent",
                    Color.fromHsl(dominantHsl.withHue(complementaryHue)),
                    "Add contrast with a complementary color"));
        }

        return List.copyOf(suggestions.subList(0, Math.min(maxSuggestions, suggestions.size())));
    }

    /**
     * 依序排列色相後計算相鄰間距 (最後一個繞回第一個)，回傳最大的 {@code limit} 個。
     */
    private static List<HueGap> largestHueGaps(List<Integer> hues, int limit) {
        List<Integer> sorted = new ArrayList<>(hues);
        sorted.sort(Comparator.naturalOrder());

        List<HueGap> gaps = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            int current = sorted.get(i);
            int next = sorted.get((i + 1) % sorted.size());
            int gap = next > current ? next - current : 360 - current + next;
            gaps.add(new HueGap(current, gap));
        }
        gaps.sort(Comparator.comparingInt(HueGap::gap).reversed());
        return gaps.subList(0, Math.min(limit, gaps.size()));
    }
}
