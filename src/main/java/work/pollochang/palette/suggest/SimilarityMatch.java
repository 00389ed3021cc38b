package work.pollochang.palette.suggest;

/**
 * @param candidate  候選調色盤
 * @param similarity 相似度 0–100
 */
public record SimilarityMatch(PaletteCandidate candidate, double similarity) {}
