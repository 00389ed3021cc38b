package work.pollochang.palette.suggest;

import work.pollochang.palette.model.Color;

import java.util.List;

public record HarmonySuggestion(HarmonyType type, String name, String description, List<Color> colors) {

    public HarmonySuggestion {
        colors = List.copyOf(colors);
    }

    static HarmonySuggestion of(HarmonyType type, List<Color> colors) {
        return new HarmonySuggestion(type, type.getDisplayName(), type.getDescription(), colors);
    }
}
