package work.pollochang.palette.core;

import work.pollochang.palette.model.ColorCluster;
import work.pollochang.palette.model.Rgb;

import java.util.ArrayList;
import java.util.List;

/**
 * 固定迭代次數的 k-means，用來修正中位數切割得到的中心。
 * <p>
 * 每一輪都由上一輪的中心快照產生新的不可變快照，不修改輸入。
 * 沒有分配到成員的中心保留原位置；距離相同時取索引較小的中心。
 */
public final class KMeansRefiner {

    public static final int DEFAULT_ITERATIONS = 8;

    private KMeansRefiner() {}

    /**
     * @param samples          取樣色
     * @param initialCentroids 初始中心
     * @param iterations       迭代次數
     * @return 非空的群集，順序與中心索引一致
     */
    public static List<ColorCluster> refine(List<Rgb> samples, List<Rgb> initialCentroids, int iterations) {
        if (samples.isEmpty() || initialCentroids.isEmpty()) {
            return List.of();
        }

        List<Rgb> centroids = List.copyOf(initialCentroids);
        for (int i = 0; i < iterations; i++) {
            centroids = step(samples, centroids);
        }

        // 最後一次分配，建立正式的群集成員
        List<List<Rgb>> assignment = assign(samples, centroids);
        List<ColorCluster> clusters = new ArrayList<>();
        for (int j = 0; j < centroids.size(); j++) {
            List<Rgb> members = assignment.get(j);
            if (!members.isEmpty()) {
                clusters.add(ColorCluster.of(centroids.get(j), members, samples.size()));
            }
        }
        return clusters;
    }

    static List<Rgb> step(List<Rgb> samples, List<Rgb> centroids) {
        List<List<Rgb>> assignment = assign(samples, centroids);
        List<Rgb> next = new ArrayList<>(centroids.size());
        for (int j = 0; j < centroids.size(); j++) {
            List<Rgb> members = assignment.get(j);
            next.add(members.isEmpty() ? centroids.get(j) : MedianCutPartitioner.centroid(members));
        }
        return List.copyOf(next);
    }

    private static List<List<Rgb>> assign(List<Rgb> samples, List<Rgb> centroids) {
        List<List<Rgb>> assignment = new ArrayList<>(centroids.size());
        for (int j = 0; j < centroids.size(); j++) {
            assignment.add(new ArrayList<>());
        }
        for (Rgb color : samples) {
            assignment.get(nearest(color, centroids)).add(color);
        }
        return assignment;
    }

    static int nearest(Rgb color, List<Rgb> centroids) {
        int nearestIndex = 0;
        long minDistance = Long.MAX_VALUE;
        for (int j = 0; j < centroids.size(); j++) {
            long distance = squaredDistance(color, centroids.get(j));
            if (distance < minDistance) {
                minDistance = distance;
                nearestIndex = j;
            }
        }
        return nearestIndex;
    }

    /**
     * RGB 歐氏距離的平方，只用於比較大小。
     */
    static long squaredDistance(Rgb a, Rgb b) {
        long dr = a.r() - b.r();
        long dg = a.g() - b.g();
        long db = a.b() - b.b();
        return dr * dr + dg * dg + db * db;
    }
}
