package work.pollochang.palette.core;

import org.junit.jupiter.api.Test;
import work.pollochang.palette.core.MedianCutPartitioner.ColorBucket;
import work.pollochang.palette.model.Rgb;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MedianCutPartitionerTest {

    @Test
    void testDepthFor_ShouldGiveSmallestPowerOfTwoNotBelowTarget() {
        assertEquals(0, MedianCutPartitioner.depthFor(1));
        assertEquals(1, MedianCutPartitioner.depthFor(2));
        assertEquals(2, MedianCutPartitioner.depthFor(3));
        assertEquals(3, MedianCutPartitioner.depthFor(6));
        assertEquals(3, MedianCutPartitioner.depthFor(8));
        assertEquals(4, MedianCutPartitioner.depthFor(12));
        assertEquals(5, MedianCutPartitioner.depthFor(32));
    }

    @Test
    void testPartition_EmptyInput_ShouldReturnNoBuckets() {
        assertTrue(MedianCutPartitioner.partition(List.of(), 3).isEmpty());
    }

    @Test
    void testPartition_DepthZero_ShouldReturnSingleBucket() {
        List<Rgb> colors = List.of(new Rgb(0, 0, 0), new Rgb(255, 255, 255));
        List<ColorBucket> buckets = MedianCutPartitioner.partition(colors, 0);

        assertEquals(1, buckets.size());
        assertEquals(colors, buckets.get(0).colors());
        assertEquals(Rgb.BLACK, buckets.get(0).min());
        assertEquals(Rgb.WHITE, buckets.get(0).max());
    }

    @Test
    void testPartition_SingleColor_ShouldNotSplit() {
        List<ColorBucket> buckets = MedianCutPartitioner.partition(List.of(new Rgb(9, 9, 9)), 4);
        assertEquals(1, buckets.size());
    }

    /**
     * 只有綠色通道有變化時，沿 G 在中位數切開
     */
    @Test
    void testPartition_ShouldSplitOnWidestChannel() {
        List<Rgb> colors = List.of(new Rgb(0, 0, 0), new Rgb(0, 100, 0), new Rgb(0, 200, 0), new Rgb(0, 50, 0));
        List<ColorBucket> buckets = MedianCutPartitioner.partition(colors, 1);

        assertEquals(2, buckets.size());
        assertEquals(List.of(new Rgb(0, 0, 0), new Rgb(0, 50, 0)), buckets.get(0).colors());
        assertEquals(List.of(new Rgb(0, 100, 0), new Rgb(0, 200, 0)), buckets.get(1).colors());
        assertEquals(new Rgb(0, 25, 0), buckets.get(0).centroid());
        assertEquals(new Rgb(0, 150, 0), buckets.get(1).centroid());
    }

    /**
     * R 與 G 範圍相同時，選擇 R
     */
    @Test
    void testPartition_TiedRange_ShouldPreferRed() {
        List<Rgb> colors = List.of(new Rgb(100, 0, 0), new Rgb(0, 100, 0));
        List<ColorBucket> buckets = MedianCutPartitioner.partition(colors, 1);

        assertEquals(List.of(new Rgb(0, 100, 0)), buckets.get(0).colors());
        assertEquals(List.of(new Rgb(100, 0, 0)), buckets.get(1).colors());
    }

    @Test
    void testPartition_ShouldKeepEverySample() {
        Random random = new Random(42);
        List<Rgb> colors = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            colors.add(new Rgb(random.nextInt(256), random.nextInt(256), random.nextInt(256)));
        }

        List<ColorBucket> buckets = MedianCutPartitioner.partition(colors, 4);

        assertEquals(16, buckets.size());
        int total = 0;
        for (ColorBucket bucket : buckets) {
            total += bucket.colors().size();
        }
        assertEquals(500, total);
        assertEquals(buckets, MedianCutPartitioner.partition(colors, 4));
    }

    @Test
    void testCentroid_ShouldRoundMean() {
        assertEquals(new Rgb(1, 1, 1), MedianCutPartitioner.centroid(List.of(new Rgb(0, 0, 0), new Rgb(1, 1, 1))));
        assertEquals(new Rgb(10, 20, 30), MedianCutPartitioner.centroid(List.of(new Rgb(10, 20, 30))));
        assertEquals(Rgb.BLACK, MedianCutPartitioner.centroid(List.of()));
    }
}
