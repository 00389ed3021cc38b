package work.pollochang.palette.suggest;

import work.pollochang.palette.model.Color;

/**
 * 補完調色盤的一個建議色。
 * @param type   建議類型
 * @param name   顯示名稱
 * @param color  建議色
 * @param reason 簡短理由
 */
public record PaletteCompletionSuggestion(SuggestionType type, String name, Color color, String reason) {}
