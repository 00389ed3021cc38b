package work.pollochang.palette.core;

import work.pollochang.palette.exception.InvalidColorFormatException;
import work.pollochang.palette.model.Hsl;
import work.pollochang.palette.model.Rgb;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 色彩空間轉換與感知距離工具類。
 *
 * <p>提供以下功能：
 * <ul>
 *   <li>RGB 與 HEX、HSL 之間的雙向轉換。</li>
 *   <li>近似 CIE Lab 轉換與 CIE76 Delta-E 距離。</li>
 *   <li>WCAG 相對亮度與對比度。</li>
 *   <li>以固定色相偏移產生互補、類似、三角、分裂互補色。</li>
 * </ul>
 *
 * <p>RGB → HSL → RGB 因整數四捨五入，每個通道可能有 ±3 的誤差，屬於預期行為。</p>
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class ColorSpace {

    private static final Pattern HEX_PATTERN = Pattern.compile("^#?([0-9a-fA-F]{2})([0-9a-fA-F]{2})([0-9a-fA-F]{2})$");

    // D65 參考白點
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private ColorSpace() {}

    // ==================== HEX ====================

    public static String rgbToHex(Rgb rgb) {
        return String.format("#%02X%02X%02X", rgb.r(), rgb.g(), rgb.b());
    }

    /**
     * 浮點通道版本，每個通道先四捨五入並限制在 0–255。
     */
    public static String rgbToHex(double r, double g, double b) {
        return rgbToHex(Rgb.of(r, g, b));
    }

    /**
     * 解析 HEX 色碼，可帶或不帶 {@code #}，大小寫皆可，必須剛好 6 個十六進位字元。
     *
     * @param hex HEX 字串
     * @return 對應的 {@link Rgb}
     * @throws InvalidColorFormatException 長度或字元不合法 (包含 null)
     */
    public static Rgb hexToRgb(String hex) {
        if (hex == null) {
            throw new InvalidColorFormatException(null);
        }
        Matcher matcher = HEX_PATTERN.matcher(hex);
        if (!matcher.matches()) {
            throw new InvalidColorFormatException(hex);
        }
        return new Rgb(
                Integer.parseInt(matcher.group(1), 16),
                Integer.parseInt(matcher.group(2), 16),
                Integer.parseInt(matcher.group(3), 16)
        );
    }

    // ==================== HSL ====================

    /**
     * RGB 轉 HSL。灰階 (max == min) 的色相固定為 0。
     */
    public static Hsl rgbToHsl(Rgb rgb) {
        double r = rgb.r() / 255.0;
        double g = rgb.g() / 255.0;
        double b = rgb.b() / 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double h = 0;
        double s = 0;
        double l = (max + min) / 2;

        if (max != min) {
            double d = max - min;
            s = l > 0.5 ? d / (2 - max - min) : d / (max + min);

            if (max == r) {
                h = ((g - b) / d + (g < b ? 6 : 0)) / 6;
            } else if (max == g) {
                h = ((b - r) / d + 2) / 6;
            } else {
                h = ((r - g) / d + 4) / 6;
            }
        }

        return new Hsl(
                (int) Math.round(h * 360),
                (int) Math.round(s * 100),
                (int) Math.round(l * 100)
        );
    }

    /**
     * HSL 轉 RGB。飽和度為 0 時三個通道等於明度。
     */
    public static Rgb hslToRgb(Hsl hsl) {
        double h = hsl.h() / 360.0;
        double s = hsl.s() / 100.0;
        double l = hsl.l() / 100.0;

        double r;
        double g;
        double b;

        if (s == 0) {
            r = l;
            g = l;
            b = l;
        } else {
            double q = l < 0.5 ? l * (1 + s) : l + s - l * s;
            double p = 2 * l - q;
            r = hueToChannel(p, q, h + 1.0 / 3);
            g = hueToChannel(p, q, h);
            b = hueToChannel(p, q, h - 1.0 / 3);
        }

        return Rgb.of(r * 255, g * 255, b * 255);
    }

    private static double hueToChannel(double p, double q, double t) {
        if (t < 0) t += 1;
        if (t > 1) t -= 1;
        if (t < 1.0 / 6) return p + (q - p) * 6 * t;
        if (t < 1.0 / 2) return q;
        if (t < 2.0 / 3) return p + (q - p) * (2.0 / 3 - t) * 6;
        return p;
    }

    // ==================== Lab / Delta-E ====================

    /**
     * 近似 sRGB → CIELAB [L*, a*, b*]。
     */
    public static double[] toLab(Rgb rgb) {
        // 1. sRGB → 線性 RGB
        double r = gammaExpand(rgb.r() / 255.0, 0.04045);
        double g = gammaExpand(rgb.g() / 255.0, 0.04045);
        double b = gammaExpand(rgb.b() / 255.0, 0.04045);

        // 2. 線性 RGB → XYZ，並以參考白點正規化
        double x = (r * 0.4124 + g * 0.3576 + b * 0.1805) / XN;
        double y = (r * 0.2126 + g * 0.7152 + b * 0.0722) / YN;
        double z = (r * 0.0193 + g * 0.1192 + b * 0.9505) / ZN;

        // 3. XYZ → Lab
        double fx = labF(x);
        double fy = labF(y);
        double fz = labF(z);

        return new double[]{116 * fy - 16, 500 * (fx - fy), 200 * (fy - fz)};
    }

    /**
     * CIE76 色差：Lab 空間中的歐氏距離。對稱，相同輸入必為 0。
     */
    public static double deltaE(Rgb c1, Rgb c2) {
        double[] lab1 = toLab(c1);
        double[] lab2 = toLab(c2);
        double dl = lab2[0] - lab1[0];
        double da = lab2[1] - lab1[1];
        double db = lab2[2] - lab1[2];
        return Math.sqrt(dl * dl + da * da + db * db);
    }

    private static double gammaExpand(double c, double threshold) {
        return c > threshold ? Math.pow((c + 0.055) / 1.055, 2.4) : c / 12.92;
    }

    private static double labF(double t) {
        return t > 0.008856 ? Math.cbrt(t) : 7.787 * t + 16.0 / 116;
    }

    // ==================== 亮度與對比 ====================

    /**
     * WCAG 相對亮度，範圍 [0, 1]。
     */
    public static double relativeLuminance(Rgb rgb) {
        return 0.2126 * gammaExpand(rgb.r() / 255.0, 0.03928)
                + 0.7152 * gammaExpand(rgb.g() / 255.0, 0.03928)
                + 0.0722 * gammaExpand(rgb.b() / 255.0, 0.03928);
    }

    /**
     * WCAG 對比度 (較亮 + 0.05) / (較暗 + 0.05)，範圍 [1, 21]。
     */
    public static double contrastRatio(Rgb c1, Rgb c2) {
        double l1 = relativeLuminance(c1);
        double l2 = relativeLuminance(c2);
        double lighter = Math.max(l1, l2);
        double darker = Math.min(l1, l2);
        return (lighter + 0.05) / (darker + 0.05);
    }

    public static boolean isLightColor(Rgb rgb) {
        double luminance = (0.299 * rgb.r() + 0.587 * rgb.g() + 0.114 * rgb.b()) / 255;
        return luminance > 0.5;
    }

    /**
     * 依背景色挑選可讀的文字顏色 (黑或白)。
     */
    public static Rgb textColorFor(Rgb background) {
        return isLightColor(background) ? Rgb.BLACK : Rgb.WHITE;
    }

    // ==================== 色相旋轉與調整 ====================

    public static Hsl rotateHue(Hsl hsl, int degrees) {
        return hsl.withHue(hsl.h() + degrees);
    }

    public static Hsl complementary(Hsl hsl) {
        return rotateHue(hsl, 180);
    }

    /**
     * @return [+30°, -30°]
     */
    public static List<Hsl> analogous(Hsl hsl) {
        return List.of(rotateHue(hsl, 30), rotateHue(hsl, 330));
    }

    /**
     * @return [+120°, +240°]
     */
    public static List<Hsl> triadic(Hsl hsl) {
        return List.of(rotateHue(hsl, 120), rotateHue(hsl, 240));
    }

    /**
     * @return [+150°, +210°]
     */
    public static List<Hsl> splitComplementary(Hsl hsl) {
        return List.of(rotateHue(hsl, 150), rotateHue(hsl, 210));
    }

    public static Hsl lighten(Hsl hsl, int amount) {
        return hsl.withLightness(Math.min(100, hsl.l() + amount));
    }

    public static Hsl darken(Hsl hsl, int amount) {
        return hsl.withLightness(Math.max(0, hsl.l() - amount));
    }

    public static Hsl saturate(Hsl hsl, int amount) {
        return hsl.withSaturation(Math.min(100, hsl.s() + amount));
    }

    public static Hsl desaturate(Hsl hsl, int amount) {
        return hsl.withSaturation(Math.max(0, hsl.s() - amount));
    }
}
