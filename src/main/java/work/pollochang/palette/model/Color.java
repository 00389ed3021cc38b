package work.pollochang.palette.model;

import work.pollochang.palette.core.ColorSpace;

import java.util.Objects;

/**
 * 調色盤中的一個顏色。
 * <p>
 * HEX 字串永遠由 {@link #rgb()} 推導，不獨立儲存，因此兩者不會不一致。
 * {@code name} 與 {@code percentage} 可為 null。
 *
 * @param rgb        RGB 值
 * @param hsl        HSL 值 (由 HSL 建立時保留原值，其餘情況由 RGB 換算)
 * @param name       顏色名稱
 * @param percentage 萃取後此色佔取樣像素的比例 (0, 100]，非萃取結果時為 null
 */
public record Color(Rgb rgb, Hsl hsl, String name, Double percentage) {

    public Color {
        Objects.requireNonNull(rgb, "rgb must not be null");
        Objects.requireNonNull(hsl, "hsl must not be null");
    }

    /**
     * @return 7 個字元的大寫 HEX，例如 {@code #FF8800}
     */
    public String hex() {
        return ColorSpace.rgbToHex(rgb);
    }

    public static Color fromRgb(Rgb rgb) {
        return fromRgb(rgb, null);
    }

    public static Color fromRgb(Rgb rgb, String name) {
        return new Color(rgb, ColorSpace.rgbToHsl(rgb), name, null);
    }

    /**
     * @throws work.pollochang.palette.exception.InvalidColorFormatException HEX 格式錯誤時
     */
    public static Color fromHex(String hex) {
        return fromRgb(ColorSpace.hexToRgb(hex));
    }

    public static Color fromHex(String hex, String name) {
        return fromRgb(ColorSpace.hexToRgb(hex), name);
    }

    public static Color fromHsl(Hsl hsl) {
        return new Color(ColorSpace.hslToRgb(hsl), hsl, null, null);
    }

    public Color withName(String newName) {
        return new Color(rgb, hsl, newName, percentage);
    }

    public Color withPercentage(Double newPercentage) {
        return new Color(rgb, hsl, name, newPercentage);
    }
}
