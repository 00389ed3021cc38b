package work.pollochang.palette.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.palette.model.ColorCluster;

import java.util.ArrayList;
import java.util.List;

/**
 * 以 Delta-E 門檻合併過於相近的群集。
 * <p>
 * 輸入需已依權重遞減排序。先被接受的群集保留其中心作為代表色，後來相近者只累加權重。
 */
@Slf4j
public final class ClusterDeduplicator {

    public static final double DEFAULT_THRESHOLD = 10;

    private ClusterDeduplicator() {}

    public static List<ColorCluster> deduplicate(List<ColorCluster> sortedClusters, double threshold) {
        List<ColorCluster> accepted = new ArrayList<>();

        for (ColorCluster cluster : sortedClusters) {
            int similarIndex = -1;
            for (int i = 0; i < accepted.size(); i++) {
                if (ColorSpace.deltaE(cluster.centroid(), accepted.get(i).centroid()) < threshold) {
                    similarIndex = i;
                    break;
                }
            }

            if (similarIndex >= 0) {
                ColorCluster existing = accepted.get(similarIndex);
                log.trace("合併相近群集 {} -> {}", ColorSpace.rgbToHex(cluster.centroid()), ColorSpace.rgbToHex(existing.centroid()));
                accepted.set(similarIndex, existing.absorb(cluster));
            } else {
                accepted.add(cluster);
            }
        }
        return accepted;
    }
}
