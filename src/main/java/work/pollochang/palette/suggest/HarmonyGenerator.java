package work.pollochang.palette.suggest;

import work.pollochang.palette.core.ColorSpace;
import work.pollochang.palette.model.Color;
import work.pollochang.palette.model.Hsl;
import work.pollochang.palette.model.Rgb;

import java.util.ArrayList;
import java.util.List;

/**
 * 依固定色相偏移產生六種和諧配色，飽和度與明度維持不變。
 */
public final class HarmonyGenerator {

    private HarmonyGenerator() {}

    /**
     * @param base 基準色，null 時回傳空列表
     * @return 互補、類似、三角、分裂互補、矩形、正方形六組建議
     */
    public static List<HarmonySuggestion> getHarmonySuggestions(Color base) {
        if (base == null) {
            return List.of();
        }
        Hsl hsl = base.hsl();
        List<HarmonySuggestion> suggestions = new ArrayList<>();

        suggestions.add(HarmonySuggestion.of(HarmonyType.COMPLEMENTARY,
                List.of(base, Color.fromHsl(ColorSpace.complementary(hsl)))));

        List<Hsl> analogous = ColorSpace.analogous(hsl);
        suggestions.add(HarmonySuggestion.of(HarmonyType.ANALOGOUS,
                List.of(Color.fromHsl(analogous.get(1)), base, Color.fromHsl(analogous.get(0)))));

        List<Hsl> triadic = ColorSpace.triadic(hsl);
        suggestions.add(HarmonySuggestion.of(HarmonyType.TRIADIC,
                List.of(base, Color.fromHsl(triadic.get(0)), Color.fromHsl(triadic.get(1)))));

        List<Hsl> split = ColorSpace.splitComplementary(hsl);
        suggestions.add(HarmonySuggestion.of(HarmonyType.SPLIT_COMPLEMENTARY,
                List.of(base, Color.fromHsl(split.get(0)), Color.fromHsl(split.get(1)))));

        suggestions.add(HarmonySuggestion.of(HarmonyType.TETRADIC, rotations(hsl, 0, 60, 180, 240)));
        suggestions.add(HarmonySuggestion.of(HarmonyType.SQUARE, rotations(hsl, 0, 90, 180, 270)));

        return suggestions;
    }

    public static List<HarmonySuggestion> getHarmonySuggestions(Hsl base) {
        return getHarmonySuggestions(Color.fromHsl(base));
    }

    /**
     * 由單一顏色產生調色盤：基準色、互補、+30°、-30°、+120°，取前 {@code count} 個。
     */
    public static List<Color> generatePaletteFromColor(Rgb base, int count) {
        Hsl hsl = ColorSpace.rgbToHsl(base);
        List<Color> colors = new ArrayList<>();
        colors.add(Color.fromRgb(base));
        colors.add(Color.fromHsl(ColorSpace.complementary(hsl)));
        colors.add(Color.fromHsl(ColorSpace.rotateHue(hsl, 30)));
        colors.add(Color.fromHsl(ColorSpace.rotateHue(hsl, 330)));
        colors.add(Color.fromHsl(ColorSpace.rotateHue(hsl, 120)));
        return List.copyOf(colors.subList(0, Math.max(1, Math.min(count, colors.size()))));
    }

    private static List<Color> rotations(Hsl hsl, int... offsets) {
        List<Color> colors = new ArrayList<>(offsets.length);
        for (int offset : offsets) {
            colors.add(Color.fromHsl(ColorSpace.rotateHue(hsl, offset)));
        }
        return colors;
    }
}
