package work.pollochang.palette.core;

import org.junit.jupiter.api.Test;
import work.pollochang.palette.model.ColorCluster;
import work.pollochang.palette.model.Rgb;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClusterDeduplicatorTest {

    private ColorCluster cluster(Rgb centroid, int count, int total) {
        return ColorCluster.of(centroid, Collections.nCopies(count, centroid), total);
    }

    /**
     * 相近群集併入先出現者，保留其中心並累加權重
     */
    @Test
    void testDeduplicate_ShouldMergeIntoFirstAccepted() {
        ColorCluster red = cluster(new Rgb(255, 0, 0), 6, 10);
        ColorCluster blue = cluster(new Rgb(0, 0, 255), 3, 10);
        ColorCluster nearRed = cluster(new Rgb(250, 0, 0), 1, 10);

        List<ColorCluster> result = ClusterDeduplicator.deduplicate(List.of(red, blue, nearRed),
                ClusterDeduplicator.DEFAULT_THRESHOLD);

        assertEquals(2, result.size());
        assertEquals(new Rgb(255, 0, 0), result.get(0).centroid());
        assertEquals(0.7, result.get(0).weight(), 1e-12);
        assertEquals(7, result.get(0).members().size());
        assertEquals(new Rgb(0, 0, 255), result.get(1).centroid());
    }

    @Test
    void testDeduplicate_DistinctClusters_ShouldBeUnchanged() {
        List<ColorCluster> clusters = List.of(
                cluster(new Rgb(255, 0, 0), 4, 10),
                cluster(new Rgb(0, 255, 0), 3, 10),
                cluster(new Rgb(0, 0, 255), 3, 10));

        assertEquals(clusters, ClusterDeduplicator.deduplicate(clusters, ClusterDeduplicator.DEFAULT_THRESHOLD));
    }

    @Test
    void testDeduplicate_AcceptedCentroidsShouldBeFarApart() {
        List<ColorCluster> clusters = List.of(
                cluster(new Rgb(100, 100, 100), 3, 20),
                cluster(new Rgb(104, 100, 100), 3, 20),
                cluster(new Rgb(200, 50, 50), 3, 20),
                cluster(new Rgb(100, 104, 100), 3, 20),
                cluster(new Rgb(20, 20, 200), 3, 20),
                cluster(new Rgb(203, 50, 50), 3, 20));

        List<ColorCluster> result = ClusterDeduplicator.deduplicate(clusters, ClusterDeduplicator.DEFAULT_THRESHOLD);

        assertEquals(3, result.size());
        for (int i = 0; i < result.size(); i++) {
            for (int j = i + 1; j < result.size(); j++) {
                assertTrue(ColorSpace.deltaE(result.get(i).centroid(), result.get(j).centroid()) >= 10);
            }
        }
        double totalWeight = 0;
        for (ColorCluster cluster : result) {
            totalWeight += cluster.weight();
        }
        assertEquals(18.0 / 20, totalWeight, 1e-12);
    }

    @Test
    void testDeduplicate_EmptyInput() {
        assertTrue(ClusterDeduplicator.deduplicate(List.of(), 10).isEmpty());
    }
}
