package work.pollochang.palette.core;

import work.pollochang.palette.model.Rgb;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 中位數切割：沿範圍最大的通道在中位數處遞迴二分，產生 k-means 的初始中心。
 * <p>
 * 相同輸入必定產生相同輸出。通道範圍相同時依 R、G、B 順序選擇，排序為穩定排序。
 */
public final class MedianCutPartitioner {

    private MedianCutPartitioner() {}

    /**
     * 切割後的一個桶與其各通道的外框。
     */
    public record ColorBucket(List<Rgb> colors, Rgb min, Rgb max) {

        static ColorBucket of(List<Rgb> colors) {
            int minR = 255, minG = 255, minB = 255;
            int maxR = 0, maxG = 0, maxB = 0;
            for (Rgb c : colors) {
                minR = Math.min(minR, c.r());
                minG = Math.min(minG, c.g());
                minB = Math.min(minB, c.b());
                maxR = Math.max(maxR, c.r());
                maxG = Math.max(maxG, c.g());
                maxB = Math.max(maxB, c.b());
            }
            return new ColorBucket(List.copyOf(colors), new Rgb(minR, minG, minB), new Rgb(maxR, maxG, maxB));
        }

        int range(int channel) {
            return max.channel(channel) - min.channel(channel);
        }

        /**
         * @return 範圍最大的通道；相同時取較前面的通道
         */
        int widestChannel() {
            int widest = 0;
            for (int channel = 1; channel < 3; channel++) {
                if (range(channel) > range(widest)) {
                    widest = channel;
                }
            }
            return widest;
        }

        public Rgb centroid() {
            return MedianCutPartitioner.centroid(colors);
        }
    }

    /**
     * 依目標桶數計算遞迴深度，使葉節點數為不小於目標值的最小 2 的冪次。
     * <p>
     * 參數是桶數而非深度：{@link ColorExtractor} 傳入 {@code colorCount * 2}，例如 5 色得到深度 4 (16 桶)。
     * 若把 {@code colorCount * 2} 直接當成遞迴深度，色彩繁雜的圖片會切出遠多於此的初始中心，
     * k-means 收斂後的調色盤也會不同。
     */
    public static int depthFor(int targetBuckets) {
        int depth = 0;
        while ((1 << depth) < targetBuckets) {
            depth++;
        }
        return depth;
    }

    /**
     * 遞迴切割。深度用盡或成員少於 2 時成為葉節點。
     *
     * @param colors 取樣色
     * @param depth  剩餘遞迴深度
     * @return 葉節點桶，依左子樹先於右子樹的順序排列；輸入為空時回傳空列表
     */
    public static List<ColorBucket> partition(List<Rgb> colors, int depth) {
        List<ColorBucket> leaves = new ArrayList<>();
        if (!colors.isEmpty()) {
            split(colors, depth, leaves);
        }
        return leaves;
    }

    private static void split(List<Rgb> colors, int depth, List<ColorBucket> leaves) {
        ColorBucket bucket = ColorBucket.of(colors);
        if (depth == 0 || colors.size() < 2) {
            leaves.add(bucket);
            return;
        }

        final int channel = bucket.widestChannel();
        List<Rgb> sorted = new ArrayList<>(colors);
        sorted.sort(Comparator.comparingInt(c -> c.channel(channel)));

        int mid = sorted.size() / 2;
        split(sorted.subList(0, mid), depth - 1, leaves);
        split(sorted.subList(mid, sorted.size()), depth - 1, leaves);
    }

    /**
     * 各通道算術平均並四捨五入；空集合回傳黑色。
     */
    public static Rgb centroid(List<Rgb> colors) {
        if (colors.isEmpty()) {
            return Rgb.BLACK;
        }
        long rSum = 0, gSum = 0, bSum = 0;
        for (Rgb c : colors) {
            rSum += c.r();
            gSum += c.g();
            bSum += c.b();
        }
        int n = colors.size();
        return Rgb.of((double) rSum / n, (double) gSum / n, (double) bSum / n);
    }
}
