package work.pollochang.palette.suggest;

public enum SuggestionType {
    LIGHTER,
    DARKER,
    SATURATED,
    DESATURATED,
    HARMONY,
    GAP_FILL
}
