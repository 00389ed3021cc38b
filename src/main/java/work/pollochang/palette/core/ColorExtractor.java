package work.pollochang.palette.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.palette.exception.EmptyImageException;
import work.pollochang.palette.model.Color;
import work.pollochang.palette.model.ColorCluster;
import work.pollochang.palette.model.ExtractionOptions;
import work.pollochang.palette.model.ExtractionResult;
import work.pollochang.palette.model.Rgb;
import work.pollochang.palette.naming.ColorNamer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 從 RGBA 像素緩衝區萃取主色調。
 *
 * <p>流程如下：
 * <ol>
 *   <li>{@link PixelSampler} 以固定步距取樣。</li>
 *   <li>{@link MedianCutPartitioner} 切出約兩倍目標數量的初始桶。</li>
 *   <li>{@link KMeansRefiner} 迭代修正中心。</li>
 *   <li>丟棄佔比不超過 {@value #MIN_CLUSTER_PERCENTAGE}% 的群集，依佔比排序。</li>
 *   <li>{@link ClusterDeduplicator} 合併 Delta-E 過近的群集。</li>
 *   <li>取前 {@code colorCount} 個，轉為具名稱與佔比的 {@link Color}。</li>
 * </ol>
 *
 * <p>回傳的佔比不會重新正規化，被丟棄的小群集不計入，因此總和可能小於 100。</p>
 *
 * <p>整個流程為同步、無共享狀態的純函式，可在任意執行緒呼叫。</p>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class ColorExtractor {

    static final double MIN_CLUSTER_PERCENTAGE = 0.5;

    private ColorExtractor() {}

    /**
     * 萃取主色調。
     *
     * @param rgba    每像素 4 bytes (R, G, B, A) 的緩衝區，需為非 null
     * @param width   寬
     * @param height  高
     * @param options 萃取參數，需為非 null
     * @return 依佔比遞減排序的萃取結果，顏色數量不超過 {@code options.colorCount()}
     * @throws EmptyImageException 取樣後沒有任何可用像素 (空圖或全透明且未納入透明像素)
     */
    public static ExtractionResult extractColors(byte[] rgba, int width, int height, ExtractionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        long startTime = System.currentTimeMillis();

        List<Rgb> samples = PixelSampler.sample(rgba, width, height, options.includeTransparent());
        if (samples.isEmpty()) {
            throw new EmptyImageException(width, height);
        }

        int depth = MedianCutPartitioner.depthFor(options.colorCount() * 2);
        List<Rgb> initialCentroids = new ArrayList<>();
        for (MedianCutPartitioner.ColorBucket bucket : MedianCutPartitioner.partition(samples, depth)) {
            initialCentroids.add(bucket.centroid());
        }
        log.debug("取樣 {} 個像素，切割深度 {}，初始中心 {} 個", samples.size(), depth, initialCentroids.size());

        List<ColorCluster> clusters = KMeansRefiner.refine(samples, initialCentroids, KMeansRefiner.DEFAULT_ITERATIONS);
        List<ColorCluster> significant = significantClusters(clusters);
        List<ColorCluster> distinct = ClusterDeduplicator.deduplicate(significant, ClusterDeduplicator.DEFAULT_THRESHOLD);

        List<Color> colors = new ArrayList<>();
        for (ColorCluster cluster : distinct.subList(0, Math.min(options.colorCount(), distinct.size()))) {
            Rgb rgb = cluster.centroid();
            colors.add(new Color(
                    rgb,
                    ColorSpace.rgbToHsl(rgb),
                    ColorNamer.getColorName(rgb),
                    Math.round(cluster.percentage() * 10) / 10.0
            ));
        }

        long processingTime = System.currentTimeMillis() - startTime;
        log.debug("萃取完成: {} 個群集 -> {} 個顏色，耗時 {} ms", clusters.size(), colors.size(), processingTime);
        return ExtractionResult.of(colors, processingTime);
    }

    /**
     * 過濾過小的群集並依佔比遞減排序 (穩定排序)。
     * 若全部群集都低於門檻，保留最大的一個，確保結果永遠有主色。
     */
    static List<ColorCluster> significantClusters(List<ColorCluster> clusters) {
        List<ColorCluster> sorted = new ArrayList<>(clusters);
        sorted.sort(Comparator.comparingDouble(ColorCluster::weight).reversed());

        List<ColorCluster> significant = new ArrayList<>();
        for (ColorCluster cluster : sorted) {
            if (cluster.percentage() > MIN_CLUSTER_PERCENTAGE) {
                significant.add(cluster);
            }
        }
        if (significant.isEmpty() && !sorted.isEmpty()) {
            log.debug("所有群集佔比皆未超過 {}%，保留最大群集", MIN_CLUSTER_PERCENTAGE);
            significant.add(sorted.get(0));
        }
        return significant;
    }
}
