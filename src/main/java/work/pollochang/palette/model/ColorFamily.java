package work.pollochang.palette.model;

public enum ColorFamily {
    RED("紅"),
    ORANGE("橙"),
    YELLOW("黃"),
    GREEN("綠"),
    BLUE("藍"),
    PURPLE("紫"),
    PINK("粉"),
    BROWN("棕"),
    NEUTRAL("中性"),
    METALLIC("金屬");

    private final String description;
    ColorFamily(String description) { this.description = description; }
    public String getDescription() { return description; }
}
