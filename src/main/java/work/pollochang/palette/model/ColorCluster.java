package work.pollochang.palette.model;

import java.util.ArrayList;
import java.util.List;

/**
 * K-means 產生的群集。
 * @param centroid 群集中心
 * @param members  歸屬此群集的取樣色
 * @param weight   members 數量 / 總取樣數，範圍 [0, 1]
 */
public record ColorCluster(Rgb centroid, List<Rgb> members, double weight) {

    public ColorCluster {
        members = List.copyOf(members);
    }

    public static ColorCluster of(Rgb centroid, List<Rgb> members, int totalSampled) {
        return new ColorCluster(centroid, members, (double) members.size() / totalSampled);
    }

    /**
     * @return 權重換算為百分比
     */
    public double percentage() {
        return weight * 100.0;
    }

    /**
     * 合併另一群集：保留本群集中心，成員與權重相加。
     */
    public ColorCluster absorb(ColorCluster other) {
        List<Rgb> merged = new ArrayList<>(members.size() + other.members.size());
        merged.addAll(members);
        merged.addAll(other.members);
        return new ColorCluster(centroid, merged, weight + other.weight);
    }
}
