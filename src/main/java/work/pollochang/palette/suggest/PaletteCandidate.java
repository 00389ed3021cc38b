package work.pollochang.palette.suggest;

import work.pollochang.palette.model.Color;

import java.util.List;

/**
 * 相似度比對的候選調色盤。
 * @param id     候選識別碼
 * @param colors 候選顏色
 */
public record PaletteCandidate(String id, List<Color> colors) {

    public PaletteCandidate {
        colors = List.copyOf(colors);
    }
}
