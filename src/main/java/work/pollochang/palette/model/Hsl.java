package work.pollochang.palette.model;

/**
 * HSL 色彩。色相以 360 取模，飽和度與明度限制在 0–100。
 * @param h 色相 (度)
 * @param s 飽和度 (%)
 * @param l 明度 (%)
 */
public record Hsl(int h, int s, int l) {

    public Hsl {
        h = ((h % 360) + 360) % 360;
        s = Math.max(0, Math.min(100, s));
        l = Math.max(0, Math.min(100, l));
    }

    public Hsl withHue(int hue) {
        return new Hsl(hue, s, l);
    }

    public Hsl withSaturation(int saturation) {
        return new Hsl(h, saturation, l);
    }

    public Hsl withLightness(int lightness) {
        return new Hsl(h, s, lightness);
    }
}
