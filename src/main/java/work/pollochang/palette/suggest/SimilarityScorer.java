package work.pollochang.palette.suggest;

import work.pollochang.palette.core.ColorSpace;
import work.pollochang.palette.model.Color;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 調色盤相似度。
 *
 * <p><b>注意：此分數具方向性。</b>對 A 中每個顏色，只在 B 中找 Delta-E 最小的一個，
 * 換算為 {@code max(0, 100 - ΔE)} 後對 A 取平均。因此 similarity(A, B) 與 similarity(B, A)
 * 可能不同，語意是「A 能被 B 涵蓋的程度」。</p>
 */
public final class SimilarityScorer {

    public static final double MIN_SIMILARITY = 30;

    private SimilarityScorer() {}

    /**
     * @return 0–100；任一方為空時回傳 0
     */
    public static double similarity(List<Color> from, List<Color> to) {
        if (from == null || to == null || from.isEmpty() || to.isEmpty()) {
            return 0;
        }

        double total = 0;
        for (Color c1 : from) {
            double bestMatch = 0;
            for (Color c2 : to) {
                double score = Math.max(0, 100 - ColorSpace.deltaE(c1.rgb(), c2.rgb()));
                bestMatch = Math.max(bestMatch, score);
            }
            total += bestMatch;
        }
        return total / from.size();
    }

    /**
     * 以 {@code query} 對每個候選計分，保留分數高於 {@value #MIN_SIMILARITY} 者，
     * 依分數遞減排序 (同分保留原順序)，最多回傳 {@code limit} 筆。
     */
    public static List<SimilarityMatch> findBestSimilarity(List<Color> query, List<PaletteCandidate> candidates, int limit) {
        if (query == null || query.isEmpty() || candidates == null || limit <= 0) {
            return List.of();
        }

        List<SimilarityMatch> matches = new ArrayList<>();
        for (PaletteCandidate candidate : candidates) {
            if (candidate.colors().isEmpty()) {
                continue;
            }
            double score = similarity(query, candidate.colors());
            if (score > MIN_SIMILARITY) {
                matches.add(new SimilarityMatch(candidate, score));
            }
        }
        matches.sort(Comparator.comparingDouble(SimilarityMatch::similarity).reversed());
        return List.copyOf(matches.subList(0, Math.min(limit, matches.size())));
    }
}
