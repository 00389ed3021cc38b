package work.pollochang.palette.suggest;

import work.pollochang.palette.core.ColorSpace;
import work.pollochang.palette.model.Color;
import work.pollochang.palette.model.Rgb;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * 由調色盤產生漸層建議。
 *
 * <p>輸入至少兩色時產生：完整調色盤的線性漸層、首尾兩色的 5 段平滑漸層、
 * Delta-E 最大的一對顏色組成的雙色漸層、完整調色盤的放射漸層；
 * 至少三色時再加上圓錐漸層。</p>
 */
public final class GradientGenerator {

    static final int SMOOTH_STEPS = 5;

    private GradientGenerator() {}

    public static List<GradientSuggestion> getGradientSuggestions(List<Color> colors) {
        if (colors == null || colors.size() < 2) {
            return List.of();
        }

        List<GradientSuggestion> suggestions = new ArrayList<>();
        int n = colors.size();

        List<GradientStop> paletteStops = new ArrayList<>(n);
        StringJoiner paletteCss = new StringJoiner(", ");
        for (int i = 0; i < n; i++) {
            double position = (double) i / (n - 1) * 100;
            paletteStops.add(new GradientStop(colors.get(i), position));
            paletteCss.add(colors.get(i).hex() + " " + Math.round(position) + "%");
        }
        suggestions.add(new GradientSuggestion("Full Palette Gradient", paletteStops,
                "linear-gradient(90deg, " + paletteCss + ")"));

        List<GradientStop> smoothStops = smoothGradient(colors.get(0), colors.get(n - 1), SMOOTH_STEPS);
        suggestions.add(new GradientSuggestion("Smooth Transition", smoothStops,
                "linear-gradient(90deg, " + toCss(smoothStops) + ")"));

        Color[] pair = mostContrastingPair(colors);
        List<GradientStop> duotoneStops = List.of(new GradientStop(pair[0], 0), new GradientStop(pair[1], 100));
        suggestions.add(new GradientSuggestion("High Contrast Duotone", duotoneStops,
                "linear-gradient(90deg, " + toCss(duotoneStops) + ")"));

        suggestions.add(new GradientSuggestion("Radial Gradient", paletteStops,
                "radial-gradient(circle, " + paletteCss + ")"));

        if (n >= 3) {
            StringJoiner conicCss = new StringJoiner(", ");
            for (int i = 0; i < n; i++) {
                conicCss.add(colors.get(i).hex() + " " + Math.round((double) i / n * 360) + "deg");
            }
            suggestions.add(new GradientSuggestion("Conic Gradient", paletteStops,
                    "conic-gradient(from 0deg, " + conicCss + ", " + colors.get(0).hex() + " 360deg)"));
        }

        return suggestions;
    }

    /**
     * 在兩色之間線性內插 RGB，每個通道四捨五入。
     */
    static List<GradientStop> smoothGradient(Color start, Color end, int steps) {
        List<GradientStop> stops = new ArrayList<>(steps);
        Rgb from = start.rgb();
        Rgb to = end.rgb();
        for (int i = 0; i < steps; i++) {
            double t = (double) i / (steps - 1);
            Rgb rgb = Rgb.of(
                    from.r() + (to.r() - from.r()) * t,
                    from.g() + (to.g() - from.g()) * t,
                    from.b() + (to.b() - from.b()) * t
            );
            stops.add(new GradientStop(Color.fromRgb(rgb), t * 100));
        }
        return stops;
    }

    private static Color[] mostContrastingPair(List<Color> colors) {
        Color[] pair = {colors.get(0), colors.get(1)};
        double maxContrast = 0;
        for (int i = 0; i < colors.size(); i++) {
            for (int j = i + 1; j < colors.size(); j++) {
                double contrast = ColorSpace.deltaE(colors.get(i).rgb(), colors.get(j).rgb());
                if (contrast > maxContrast) {
                    maxContrast = contrast;
                    pair = new Color[]{colors.get(i), colors.get(j)};
                }
            }
        }
        return pair;
    }

    private static String toCss(List<GradientStop> stops) {
        StringJoiner css = new StringJoiner(", ");
        for (GradientStop stop : stops) {
            css.add(stop.color().hex() + " " + Math.round(stop.position()) + "%");
        }
        return css.toString();
    }
}
