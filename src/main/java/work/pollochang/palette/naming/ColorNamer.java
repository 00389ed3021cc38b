package work.pollochang.palette.naming;

import work.pollochang.palette.model.NamedColor;
import work.pollochang.palette.model.Rgb;

/**
 * 以最近鄰搜尋為任意 RGB 取名。
 * <p>
 * 距離採 redmean 加權的歐氏距離 (綠色權重最高)，找到最近的字典色後，
 * 若明暗差距超過 {@value #SHADE_OFFSET} 則加上 "Dark" 或 "Light" 前綴。
 */
public final class ColorNamer {

    static final double SHADE_OFFSET = 40;

    private ColorNamer() {}

    /**
     * 永遠回傳一個名稱，最差情況為字典中最接近的一筆。
     */
    public static String getColorName(Rgb rgb) {
        return applyShade(findNearest(rgb), rgb);
    }

    /**
     * 線性掃描字典，距離相同時取先出現者。
     */
    public static NamedColor findNearest(Rgb rgb) {
        NamedColor closest = null;
        double minDistance = Double.MAX_VALUE;
        for (NamedColor named : NamedColors.all()) {
            double distance = weightedDistance(rgb, named.rgb());
            if (distance < minDistance) {
                minDistance = distance;
                closest = named;
            }
        }
        return closest;
    }

    static String applyShade(NamedColor nearest, Rgb rgb) {
        double lightness = (rgb.r() + rgb.g() + rgb.b()) / 3.0;
        Rgb reference = nearest.rgb();
        double referenceLightness = (reference.r() + reference.g() + reference.b()) / 3.0;

        if (lightness < referenceLightness - SHADE_OFFSET) {
            return "Dark " + nearest.name();
        } else if (lightness > referenceLightness + SHADE_OFFSET) {
            return "Light " + nearest.name();
        }
        return nearest.name();
    }

    static double weightedDistance(Rgb c1, Rgb c2) {
        double rMean = (c1.r() + c2.r()) / 2.0;
        int dR = c1.r() - c2.r();
        int dG = c1.g() - c2.g();
        int dB = c1.b() - c2.b();

        double weightR = 2 + rMean / 256;
        double weightG = 4;
        double weightB = 2 + (255 - rMean) / 256;

        return Math.sqrt(weightR * dR * dR + weightG * dG * dG + weightB * dB * dB);
    }
}
