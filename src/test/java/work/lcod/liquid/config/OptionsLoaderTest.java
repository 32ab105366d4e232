package work.lcod.liquid.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.liquid.runtime.FilterRegistry;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.text.TrimmingFlag;
import work.lcod.liquid.text.TrimmingPolicy;

class OptionsLoaderTest {
    private static final Path CONFIG = Path.of("src", "test", "resources", "config");

    @Test
    void readsRenderAndTrimmingTables() {
        var options = OptionsLoader.load(CONFIG.resolve("options.toml"));
        assertEquals(500, options.maxSteps());
        assertEquals(40, options.maxRecursion());
        assertEquals(Locale.forLanguageTag("fr-FR"), options.locale());
        assertEquals(Set.of(TrimmingFlag.TAG_LEFT, TrimmingFlag.TAG_RIGHT), options.trimming().flags());
        assertFalse(options.trimming().greedy());
    }

    @Test
    void keepsBuilderValuesForMissingKeys() {
        var filters = new FilterRegistry();
        var builder = TemplateOptions.builder().filters(filters).maxSteps(7);
        var options = OptionsLoader.parse("[trimming]\noutputRight = true\n", builder);
        assertSame(filters, options.filters());
        assertEquals(7, options.maxSteps());
        assertTrue(options.trimming().has(TrimmingFlag.OUTPUT_RIGHT));
        assertTrue(options.trimming().greedy());
    }

    @Test
    void emptyDocumentsYieldDefaults() {
        var options = OptionsLoader.parse("");
        assertEquals(0, options.maxSteps());
        assertEquals(TemplateOptions.DEFAULT_MAX_RECURSION, options.maxRecursion());
        assertEquals(Locale.ROOT, options.locale());
        assertEquals(TrimmingPolicy.NONE, options.trimming());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> OptionsLoader.load(CONFIG.resolve("invalid-steps.toml")));
        assertThrows(IllegalArgumentException.class, () -> OptionsLoader.parse("[render]\nmaxSteps = -1\n"));
        assertThrows(IllegalArgumentException.class, () -> OptionsLoader.parse("[render]\nmaxRecursion = -1\n"));
        assertThrows(IllegalArgumentException.class, () -> OptionsLoader.parse("[render]\nmaxRecursion = 3000000000\n"));
        assertThrows(IllegalArgumentException.class, () -> OptionsLoader.parse("[trimming]\ngreedy = \"yes\"\n"));
        assertThrows(IllegalArgumentException.class, () -> OptionsLoader.parse("[render\n"));
        assertThrows(IllegalStateException.class, () -> OptionsLoader.load(CONFIG.resolve("missing.toml")));
    }
}
