package work.pollochang.palette.naming;

import work.pollochang.palette.model.ColorFamily;
import work.pollochang.palette.model.NamedColor;
import work.pollochang.palette.model.Rgb;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 固定的命名色字典，共 152 筆，依色系分組。程式執行期間不可變。
 */
public final class NamedColors {

    private static final List<NamedColor> DICTIONARY = List.of(
            // red
            named("Red", 255, 0, 0, ColorFamily.RED),
            named("Crimson", 220, 20, 60, ColorFamily.RED),
            named("Scarlet", 255, 36, 0, ColorFamily.RED),
            named("Ruby", 224, 17, 95, ColorFamily.RED),
            named("Cherry", 222, 49, 99, ColorFamily.RED),
            named("Wine", 114, 47, 55, ColorFamily.RED),
            named("Burgundy", 128, 0, 32, ColorFamily.RED),
            named("Maroon", 128, 0, 0, ColorFamily.RED),
            named("Brick", 203, 65, 84, ColorFamily.RED),
            named("Rose", 255, 0, 127, ColorFamily.RED),
            named("Salmon", 250, 128, 114, ColorFamily.RED),
            named("Coral", 255, 127, 80, ColorFamily.RED),
            named("Tomato", 255, 99, 71, ColorFamily.RED),
            named("Vermilion", 227, 66, 52, ColorFamily.RED),
            named("Cardinal", 196, 30, 58, ColorFamily.RED),

            // orange
            named("Orange", 255, 165, 0, ColorFamily.ORANGE),
            named("Tangerine", 255, 159, 0, ColorFamily.ORANGE),
            named("Pumpkin", 255, 117, 24, ColorFamily.ORANGE),
            named("Carrot", 237, 145, 33, ColorFamily.ORANGE),
            named("Apricot", 251, 206, 177, ColorFamily.ORANGE),
            named("Peach", 255, 218, 185, ColorFamily.ORANGE),
            named("Burnt Orange", 204, 85, 0, ColorFamily.ORANGE),
            named("Rust", 183, 65, 14, ColorFamily.ORANGE),
            named("Terracotta", 226, 114, 91, ColorFamily.ORANGE),
            named("Amber", 255, 191, 0, ColorFamily.ORANGE),
            named("Marigold", 234, 162, 33, ColorFamily.ORANGE),
            named("Saffron", 244, 196, 48, ColorFamily.ORANGE),

            // yellow
            named("Yellow", 255, 255, 0, ColorFamily.YELLOW),
            named("Gold", 255, 215, 0, ColorFamily.YELLOW),
            named("Honey", 235, 150, 5, ColorFamily.YELLOW),
            named("Mustard", 255, 219, 88, ColorFamily.YELLOW),
            named("Lemon", 255, 247, 0, ColorFamily.YELLOW),
            named("Canary", 255, 239, 0, ColorFamily.YELLOW),
            named("Butter", 255, 255, 149, ColorFamily.YELLOW),
            named("Cream", 255, 253, 208, ColorFamily.YELLOW),
            named("Champagne", 247, 231, 206, ColorFamily.YELLOW),
            named("Blonde", 250, 240, 190, ColorFamily.YELLOW),
            named("Maize", 251, 236, 93, ColorFamily.YELLOW),
            named("Straw", 228, 217, 111, ColorFamily.YELLOW),

            // green
            named("Green", 0, 128, 0, ColorFamily.GREEN),
            named("Lime", 0, 255, 0, ColorFamily.GREEN),
            named("Emerald", 80, 200, 120, ColorFamily.GREEN),
            named("Jade", 0, 168, 107, ColorFamily.GREEN),
            named("Mint", 152, 255, 152, ColorFamily.GREEN),
            named("Sage", 176, 208, 176, ColorFamily.GREEN),
            named("Forest", 34, 139, 34, ColorFamily.GREEN),
            named("Olive", 128, 128, 0, ColorFamily.GREEN),
            named("Moss", 138, 154, 91, ColorFamily.GREEN),
            named("Grass", 124, 252, 0, ColorFamily.GREEN),
            named("Seafoam", 159, 226, 191, ColorFamily.GREEN),
            named("Teal", 0, 128, 128, ColorFamily.GREEN),
            named("Pine", 1, 121, 111, ColorFamily.GREEN),
            named("Jungle", 41, 171, 135, ColorFamily.GREEN),
            named("Hunter", 53, 94, 59, ColorFamily.GREEN),
            named("Spring", 0, 255, 127, ColorFamily.GREEN),
            named("Pistachio", 147, 197, 114, ColorFamily.GREEN),
            named("Chartreuse", 127, 255, 0, ColorFamily.GREEN),
            named("Olive Drab", 107, 142, 35, ColorFamily.GREEN),
            named("Fern", 79, 121, 66, ColorFamily.GREEN),
            named("Celadon", 172, 225, 175, ColorFamily.GREEN),

            // blue
            named("Blue", 0, 0, 255, ColorFamily.BLUE),
            named("Sky", 135, 206, 235, ColorFamily.BLUE),
            named("Azure", 0, 127, 255, ColorFamily.BLUE),
            named("Navy", 0, 0, 128, ColorFamily.BLUE),
            named("Royal", 65, 105, 225, ColorFamily.BLUE),
            named("Cobalt", 0, 71, 171, ColorFamily.BLUE),
            named("Sapphire", 15, 82, 186, ColorFamily.BLUE),
            named("Ocean", 0, 119, 190, ColorFamily.BLUE),
            named("Cerulean", 0, 123, 167, ColorFamily.BLUE),
            named("Denim", 21, 96, 189, ColorFamily.BLUE),
            named("Steel", 70, 130, 180, ColorFamily.BLUE),
            named("Powder", 176, 224, 230, ColorFamily.BLUE),
            named("Baby Blue", 137, 207, 240, ColorFamily.BLUE),
            named("Ice", 153, 255, 255, ColorFamily.BLUE),
            named("Turquoise", 64, 224, 208, ColorFamily.BLUE),
            named("Aqua", 0, 255, 255, ColorFamily.BLUE),
            named("Cyan", 0, 255, 255, ColorFamily.BLUE),
            named("Midnight", 25, 25, 112, ColorFamily.BLUE),
            named("Cornflower", 100, 149, 237, ColorFamily.BLUE),
            named("Prussian", 0, 49, 83, ColorFamily.BLUE),

            // purple
            named("Purple", 128, 0, 128, ColorFamily.PURPLE),
            named("Violet", 238, 130, 238, ColorFamily.PURPLE),
            named("Lavender", 230, 230, 250, ColorFamily.PURPLE),
            named("Lilac", 200, 162, 200, ColorFamily.PURPLE),
            named("Plum", 142, 69, 133, ColorFamily.PURPLE),
            named("Orchid", 218, 112, 214, ColorFamily.PURPLE),
            named("Grape", 111, 45, 168, ColorFamily.PURPLE),
            named("Amethyst", 153, 102, 204, ColorFamily.PURPLE),
            named("Mauve", 224, 176, 255, ColorFamily.PURPLE),
            named("Indigo", 75, 0, 130, ColorFamily.PURPLE),
            named("Eggplant", 97, 64, 81, ColorFamily.PURPLE),
            named("Magenta", 255, 0, 255, ColorFamily.PURPLE),
            named("Fuchsia", 255, 0, 255, ColorFamily.PURPLE),
            named("Periwinkle", 204, 204, 255, ColorFamily.PURPLE),
            named("Wisteria", 201, 160, 220, ColorFamily.PURPLE),
            named("Byzantium", 112, 41, 99, ColorFamily.PURPLE),

            // pink
            named("Pink", 255, 192, 203, ColorFamily.PINK),
            named("Hot Pink", 255, 105, 180, ColorFamily.PINK),
            named("Blush", 222, 93, 131, ColorFamily.PINK),
            named("Bubblegum", 255, 193, 204, ColorFamily.PINK),
            named("Flamingo", 252, 142, 172, ColorFamily.PINK),
            named("Watermelon", 253, 70, 89, ColorFamily.PINK),
            named("Raspberry", 227, 11, 92, ColorFamily.PINK),
            named("Rouge", 169, 64, 118, ColorFamily.PINK),
            named("Dusty Rose", 194, 137, 162, ColorFamily.PINK),
            named("Carnation", 255, 166, 201, ColorFamily.PINK),
            named("Salmon Pink", 255, 145, 164, ColorFamily.PINK),

            // brown
            named("Brown", 139, 69, 19, ColorFamily.BROWN),
            named("Chocolate", 123, 63, 0, ColorFamily.BROWN),
            named("Coffee", 111, 78, 55, ColorFamily.BROWN),
            named("Mocha", 151, 114, 92, ColorFamily.BROWN),
            named("Chestnut", 149, 69, 53, ColorFamily.BROWN),
            named("Cinnamon", 210, 105, 30, ColorFamily.BROWN),
            named("Caramel", 255, 213, 145, ColorFamily.BROWN),
            named("Tan", 210, 180, 140, ColorFamily.BROWN),
            named("Beige", 245, 245, 220, ColorFamily.BROWN),
            named("Khaki", 195, 176, 145, ColorFamily.BROWN),
            named("Sand", 194, 178, 128, ColorFamily.BROWN),
            named("Taupe", 72, 60, 50, ColorFamily.BROWN),
            named("Umber", 99, 81, 71, ColorFamily.BROWN),
            named("Sienna", 160, 82, 45, ColorFamily.BROWN),
            named("Mahogany", 192, 64, 0, ColorFamily.BROWN),
            named("Auburn", 165, 42, 42, ColorFamily.BROWN),
            named("Copper", 184, 115, 51, ColorFamily.BROWN),
            named("Bronze", 205, 127, 50, ColorFamily.BROWN),
            named("Walnut", 119, 63, 26, ColorFamily.BROWN),

            // neutral
            named("White", 255, 255, 255, ColorFamily.NEUTRAL),
            named("Ivory", 255, 255, 240, ColorFamily.NEUTRAL),
            named("Pearl", 234, 224, 200, ColorFamily.NEUTRAL),
            named("Snow", 255, 250, 250, ColorFamily.NEUTRAL),
            named("Bone", 227, 218, 201, ColorFamily.NEUTRAL),
            named("Linen", 250, 240, 230, ColorFamily.NEUTRAL),
            named("Silver", 192, 192, 192, ColorFamily.NEUTRAL),
            named("Ash", 178, 190, 181, ColorFamily.NEUTRAL),
            named("Slate", 112, 128, 144, ColorFamily.NEUTRAL),
            named("Charcoal", 54, 69, 79, ColorFamily.NEUTRAL),
            named("Smoke", 115, 130, 118, ColorFamily.NEUTRAL),
            named("Fog", 175, 180, 175, ColorFamily.NEUTRAL),
            named("Gray", 128, 128, 128, ColorFamily.NEUTRAL),
            named("Graphite", 65, 65, 65, ColorFamily.NEUTRAL),
            named("Onyx", 53, 56, 57, ColorFamily.NEUTRAL),
            named("Ebony", 33, 36, 33, ColorFamily.NEUTRAL),
            named("Jet", 52, 52, 52, ColorFamily.NEUTRAL),
            named("Black", 0, 0, 0, ColorFamily.NEUTRAL),
            named("Gainsboro", 220, 220, 220, ColorFamily.NEUTRAL),
            named("Dim Gray", 105, 105, 105, ColorFamily.NEUTRAL),

            // metallic
            named("Rose Gold", 183, 110, 121, ColorFamily.METALLIC),
            named("Brass", 181, 166, 66, ColorFamily.METALLIC),
            named("Pewter", 142, 142, 130, ColorFamily.METALLIC),
            named("Platinum", 229, 228, 226, ColorFamily.METALLIC),
            named("Gunmetal", 42, 52, 57, ColorFamily.METALLIC),
            named("Old Gold", 207, 181, 59, ColorFamily.METALLIC)
    );

    private NamedColors() {}

    private static NamedColor named(String name, int r, int g, int b, ColorFamily family) {
        return new NamedColor(name, new Rgb(r, g, b), family);
    }

    /**
     * @return 不可修改的完整字典
     */
    public static List<NamedColor> all() {
        return DICTIONARY;
    }

    public static List<NamedColor> byFamily(ColorFamily family) {
        List<NamedColor> result = new ArrayList<>();
        for (NamedColor color : DICTIONARY) {
            if (color.family() == family) {
                result.add(color);
            }
        }
        return result;
    }

    /**
     * 名稱包含查詢字串 (不分大小寫) 的所有顏色。
     */
    public static List<NamedColor> searchByName(String query) {
        String lowerQuery = query.toLowerCase(Locale.ROOT);
        List<NamedColor> result = new ArrayList<>();
        for (NamedColor color : DICTIONARY) {
            if (color.name().toLowerCase(Locale.ROOT).contains(lowerQuery)) {
                result.add(color);
            }
        }
        return result;
    }
}
