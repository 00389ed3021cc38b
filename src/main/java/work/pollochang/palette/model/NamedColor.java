package work.pollochang.palette.model;

/**
 * 命名色字典中的一筆資料。
 * @param name   名稱
 * @param rgb    參考 RGB
 * @param family 所屬色系
 */
public record NamedColor(String name, Rgb rgb, ColorFamily family) {}
