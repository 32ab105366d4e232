package work.lcod.liquid.filters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.liquid.ast.FilterExpression;
import work.lcod.liquid.ast.LiteralExpression;
import work.lcod.liquid.ast.OutputStatement;
import work.lcod.liquid.flow.AsyncFlow;
import work.lcod.liquid.runtime.FilterRegistries;
import work.lcod.liquid.runtime.InterpretedTemplate;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.values.Arguments;
import work.lcod.liquid.values.NilValue;
import work.lcod.liquid.values.StringValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

class StandardFiltersTest {
    private static Value apply(String name, Object input, Object... arguments) {
        var builder = Arguments.builder();
        for (var argument : arguments) {
            builder.add(Values.create(argument, null));
        }
        var filter = FilterRegistries.create().get(name);
        return AsyncFlow.await(filter.invoke(Values.create(input, null), builder.build(), new TemplateContext()));
    }

    @Test
    void transformsStrings() throws Exception {
        assertEquals("HELLO", apply("upcase", "hello").toStringValue());
        assertEquals("hello", apply("downcase", "HeLLo").toStringValue());
        assertEquals("Hello world", apply("capitalize", "hello world").toStringValue());
        assertEquals("", apply("capitalize", "").toStringValue());
        assertEquals("ab", apply("append", "a", "b").toStringValue());
        assertEquals("ba", apply("prepend", "a", "b").toStringValue());
    }

    @Test
    void measuresSizes() throws Exception {
        assertEquals(5, apply("size", "hello").toNumberValue().intValue());
        assertEquals(3, apply("size", List.of(1, 2, 3)).toNumberValue().intValue());
        assertEquals(2, apply("size", Map.of("a", 1, "b", 2)).toNumberValue().intValue());
        assertEquals(0, apply("size", null).toNumberValue().intValue());
    }

    @Test
    void fallsBackToDefaults() throws Exception {
        assertEquals("none", apply("default", null, "none").toStringValue());
        assertEquals("none", apply("default", false, "none").toStringValue());
        assertEquals("none", apply("default", "", "none").toStringValue());
        assertEquals("set", apply("default", "set", "none").toStringValue());
    }

    @Test
    void computesArithmetic() throws Exception {
        assertEquals("5", apply("plus", 2, 3).toStringValue());
        assertEquals("-1", apply("minus", 2, 3).toStringValue());
        assertEquals("6", apply("times", 2, 3).toStringValue());
    }

    @Test
    void joinsAndPicksItems() throws Exception {
        assertEquals("a b c", apply("join", List.of("a", "b", "c")).toStringValue());
        assertEquals("a-b", apply("join", List.of("a", "b"), "-").toStringValue());
        assertEquals("solo", apply("join", "solo", "-").toStringValue());
        assertEquals("a", apply("first", List.of("a", "b")).toStringValue());
        assertEquals("b", apply("last", List.of("a", "b")).toStringValue());
        assertSame(NilValue.INSTANCE, apply("first", List.of()));
    }

    @Test
    void escapedValuesAreNotEncodedTwice() throws Exception {
        var escaped = apply("escape", "<b>");
        assertEquals("&lt;b&gt;", escaped.toStringValue());
        assertTrue(escaped instanceof StringValue string && !string.encode());

        var template = InterpretedTemplate.of(new OutputStatement(
            new FilterExpression(new LiteralExpression(Values.create("<b>", null)), "escape", List.of())
        ));
        assertEquals("&lt;b&gt;", template.render(new TemplateContext()));
    }
}
