package work.pollochang.palette.suggest;

import org.junit.jupiter.api.Test;
import work.pollochang.palette.model.Color;
import work.pollochang.palette.model.Hsl;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaletteAdvisorTest {

    private List<SuggestionType> types(List<PaletteCompletionSuggestion> suggestions) {
        List<SuggestionType> types = new ArrayList<>();
        for (PaletteCompletionSuggestion suggestion : suggestions) {
            types.add(suggestion.type());
        }
        return types;
    }

    /**
     * 單一飽和紅色：淺色、深色、低飽和、缺口補色、互補色
     */
    @Test
    void testSingleSaturatedColor() {
        List<PaletteCompletionSuggestion> suggestions = PaletteAdvisor.getPaletteCompletionSuggestions(
                List.of(Color.fromHsl(new Hsl(0, 100, 50))));

        assertEquals(List.of(SuggestionType.LIGHTER, SuggestionType.DARKER, SuggestionType.DESATURATED,
                SuggestionType.GAP_FILL, SuggestionType.HARMONY), types(suggestions));
        assertEquals(new Hsl(0, 100, 70), suggestions.get(0).color().hsl());
        assertEquals(new Hsl(0, 100, 30), suggestions.get(1).color().hsl());
        assertEquals(new Hsl(0, 70, 50), suggestions.get(2).color().hsl());
        assertEquals(new Hsl(180, 100, 50), suggestions.get(3).color().hsl());
        assertEquals(new Hsl(180, 100, 50), suggestions.get(4).color().hsl());
        assertTrue(suggestions.get(3).reason().contains("180"));
    }

    @Test
    void testComplementPresent_ShouldNotSuggestHarmony() {
        List<PaletteCompletionSuggestion> suggestions = PaletteAdvisor.getPaletteCompletionSuggestions(List.of(
                Color.fromHsl(new Hsl(0, 100, 50)),
                Color.fromHsl(new Hsl(180, 100, 50))));

        assertEquals(List.of(SuggestionType.LIGHTER, SuggestionType.DARKER, SuggestionType.DESATURATED,
                SuggestionType.GAP_FILL, SuggestionType.GAP_FILL), types(suggestions));
        assertEquals(90, suggestions.get(3).color().hsl().h());
        assertEquals(270, suggestions.get(4).color().hsl().h());
    }

    @Test
    void testPaleNeutral_ShouldSuggestDarkerAndVibrant() {
        List<PaletteCompletionSuggestion> suggestions = PaletteAdvisor.getPaletteCompletionSuggestions(
                List.of(Color.fromHsl(new Hsl(0, 0, 95))));

        assertEquals(List.of(SuggestionType.DARKER, SuggestionType.SATURATED,
                SuggestionType.GAP_FILL, SuggestionType.HARMONY), types(suggestions));
        assertEquals(new Hsl(0, 20, 95), suggestions.get(1).color().hsl());
    }

    @Test
    void testMaxSuggestions_ShouldTruncate() {
        List<PaletteCompletionSuggestion> suggestions = PaletteAdvisor.getPaletteCompletionSuggestions(
                List.of(Color.fromHsl(new Hsl(0, 100, 50))), 2);

        assertEquals(List.of(SuggestionType.LIGHTER, SuggestionType.DARKER), types(suggestions));
    }

    @Test
    void testWellCoveredPalette_ShouldStayWithinDefaultMaximum() {
        List<Color> colors = new ArrayList<>();
        for (int h = 0; h < 360; h += 45) {
            colors.add(Color.fromHsl(new Hsl(h, 50, 50)));
        }

        List<PaletteCompletionSuggestion> suggestions = PaletteAdvisor.getPaletteCompletionSuggestions(colors);

        assertTrue(suggestions.size() <= PaletteAdvisor.DEFAULT_MAX_SUGGESTIONS);
        assertFalse(types(suggestions).contains(SuggestionType.GAP_FILL));
        assertFalse(types(suggestions).contains(SuggestionType.HARMONY));
    }

    @Test
    void testEmptyPalette_ShouldReturnEmpty() {
        assertTrue(PaletteAdvisor.getPaletteCompletionSuggestions(List.of()).isEmpty());
        assertTrue(PaletteAdvisor.getPaletteCompletionSuggestions(null).isEmpty());
    }
}
