package work.pollochang.palette.model;

/**
 * sRGB 色彩，三個通道皆限制在 0–255。
 * @param r 紅色通道
 * @param g 綠色通道
 * @param b 藍色通道
 */
public record Rgb(int r, int g, int b) {

    public static final Rgb BLACK = new Rgb(0, 0, 0);
    public static final Rgb WHITE = new Rgb(255, 255, 255);

    public Rgb {
        r = clamp(r);
        g = clamp(g);
        b = clamp(b);
    }

    /**
     * 以浮點數通道建立，先四捨五入再限制範圍。
     */
    public static Rgb of(double r, double g, double b) {
        return new Rgb((int) Math.round(r), (int) Math.round(g), (int) Math.round(b));
    }

    /**
     * 依序取出 R、G、B 通道 (0、1、2)。
     */
    public int channel(int index) {
        switch (index) {
            case 0:
                return r;
            case 1:
                return g;
            case 2:
                return b;
            default:
                throw new IllegalArgumentException("不存在的色彩通道: " + index);
        }
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }
}
