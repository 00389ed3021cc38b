package work.pollochang.palette.core;

import org.junit.jupiter.api.Test;
import work.pollochang.palette.model.Rgb;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PixelSamplerTest {

    /**
     * 建立單色 RGBA 緩衝區
     */
    private byte[] createRgba(int width, int height, int r, int g, int b, int a) {
        byte[] rgba = new byte[width * height * 4];
        for (int i = 0; i < width * height; i++) {
            rgba[i * 4] = (byte) r;
            rgba[i * 4 + 1] = (byte) g;
            rgba[i * 4 + 2] = (byte) b;
            rgba[i * 4 + 3] = (byte) a;
        }
        return rgba;
    }

    @Test
    void testStepFor_ShouldCapSampleGrid() {
        assertEquals(1, PixelSampler.stepFor(0));
        assertEquals(1, PixelSampler.stepFor(40_000));
        assertEquals(1, PixelSampler.stepFor(159_999));
        assertEquals(2, PixelSampler.stepFor(160_000));
        assertEquals(5, PixelSampler.stepFor(1000L * 1000L));
    }

    @Test
    void testSmallImage_ShouldSampleEveryPixel() {
        List<Rgb> samples = PixelSampler.sample(createRgba(10, 10, 200, 100, 50, 255), 10, 10, false);

        assertEquals(100, samples.size());
        assertEquals(new Rgb(200, 100, 50), samples.get(0));
    }

    @Test
    void testLargeImage_ShouldStayWithinBudget() {
        List<Rgb> samples = PixelSampler.sample(createRgba(400, 400, 1, 2, 3, 255), 400, 400, false);

        assertEquals(PixelSampler.MAX_SAMPLE_BUDGET, samples.size());
    }

    /**
     * alpha 127 略過，128 保留
     */
    @Test
    void testAlphaThreshold() {
        byte[] rgba = new byte[]{
                10, 20, 30, (byte) 127,
                40, 50, 60, (byte) 128
        };

        List<Rgb> opaque = PixelSampler.sample(rgba, 2, 1, false);
        assertEquals(List.of(new Rgb(40, 50, 60)), opaque);

        List<Rgb> all = PixelSampler.sample(rgba, 2, 1, true);
        assertEquals(List.of(new Rgb(10, 20, 30), new Rgb(40, 50, 60)), all);
    }

    @Test
    void testFullyTransparent_ShouldReturnEmpty() {
        assertTrue(PixelSampler.sample(createRgba(8, 8, 255, 0, 0, 0), 8, 8, false).isEmpty());
        assertEquals(64, PixelSampler.sample(createRgba(8, 8, 255, 0, 0, 0), 8, 8, true).size());
    }

    @Test
    void testEmptyImage_ShouldReturnEmpty() {
        assertTrue(PixelSampler.sample(new byte[0], 0, 0, false).isEmpty());
    }

    @Test
    void testHighChannelValues_ShouldBeUnsigned() {
        List<Rgb> samples = PixelSampler.sample(createRgba(1, 1, 250, 251, 252, 255), 1, 1, false);
        assertEquals(new Rgb(250, 251, 252), samples.get(0));
    }

    @Test
    void testInvalidArguments_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> PixelSampler.sample(new byte[15], 2, 2, false));
        assertThrows(IllegalArgumentException.class, () -> PixelSampler.sample(new byte[16], -2, 2, false));
        assertThrows(NullPointerException.class, () -> PixelSampler.sample(null, 2, 2, false));
    }
}
