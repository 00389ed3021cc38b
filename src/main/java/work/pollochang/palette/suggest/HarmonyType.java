package work.pollochang.palette.suggest;

/**
 * 配色理論中的和諧類型，附帶固定的顯示名稱與說明。
 */
public enum HarmonyType {
    COMPLEMENTARY("Complementary", "Colors opposite on the color wheel. High contrast, vibrant."),
    ANALOGOUS("Analogous", "Colors next to each other. Harmonious and pleasing."),
    TRIADIC("Triadic", "Three colors evenly spaced. Balanced and vibrant."),
    SPLIT_COMPLEMENTARY("Split-Complementary", "Base color + two adjacent to its complement. Vibrant yet balanced."),
    TETRADIC("Tetradic (Rectangle)", "Four colors forming a rectangle. Rich and complex."),
    SQUARE("Square", "Four colors evenly spaced. Dynamic and bold.");

    private final String displayName;
    private final String description;

    HarmonyType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() { return displayName; }
    public String getDescription() { return description; }
}
