package work.pollochang.palette.naming;

import org.junit.jupiter.api.Test;
import work.pollochang.palette.model.ColorFamily;
import work.pollochang.palette.model.NamedColor;
import work.pollochang.palette.model.Rgb;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ColorNamerTest {

    @Test
    void testExactDictionaryColors_ShouldUsePlainName() {
        assertEquals("Red", ColorNamer.getColorName(new Rgb(255, 0, 0)));
        assertEquals("Navy", ColorNamer.getColorName(new Rgb(0, 0, 128)));
        assertEquals("Black", ColorNamer.getColorName(Rgb.BLACK));
        assertEquals("White", ColorNamer.getColorName(Rgb.WHITE));
    }

    /**
     * 字典中 RGB 相同的兩筆，取先出現者
     */
    @Test
    void testDuplicateEntries_ShouldPreferFirst() {
        assertEquals("Aqua", ColorNamer.getColorName(new Rgb(0, 255, 255)));
        assertEquals("Magenta", ColorNamer.getColorName(new Rgb(255, 0, 255)));
    }

    @Test
    void testNearColor_ShouldUseNearestEntry() {
        NamedColor nearest = ColorNamer.findNearest(new Rgb(2, 0, 250));
        assertEquals("Blue", nearest.name());
        assertEquals(ColorFamily.BLUE, nearest.family());
    }

    @Test
    void testApplyShade_ShouldAddPrefixBeyondOffset() {
        NamedColor red = new NamedColor("Red", new Rgb(255, 0, 0), ColorFamily.RED);

        assertEquals("Dark Red", ColorNamer.applyShade(red, new Rgb(100, 0, 0)));
        assertEquals("Light Red", ColorNamer.applyShade(red, new Rgb(255, 120, 120)));
        assertEquals("Red", ColorNamer.applyShade(red, new Rgb(230, 20, 20)));
    }

    @Test
    void testWeightedDistance_GreenShouldWeighMost() {
        double red = ColorNamer.weightedDistance(new Rgb(100, 100, 100), new Rgb(110, 100, 100));
        double green = ColorNamer.weightedDistance(new Rgb(100, 100, 100), new Rgb(100, 110, 100));
        double blue = ColorNamer.weightedDistance(new Rgb(100, 100, 100), new Rgb(100, 100, 110));

        assertTrue(green > red);
        assertTrue(green > blue);
        assertEquals(0.0, ColorNamer.weightedDistance(Rgb.WHITE, Rgb.WHITE), 1e-12);
    }

    @Test
    void testAnyColor_ShouldHaveName() {
        Random random = new Random(99);
        for (int i = 0; i < 200; i++) {
            String name = ColorNamer.getColorName(new Rgb(random.nextInt(256), random.nextInt(256), random.nextInt(256)));
            assertNotNull(name);
            assertFalse(name.isBlank());
        }
    }
}
