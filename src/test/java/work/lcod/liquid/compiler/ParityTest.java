package work.lcod.liquid.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.liquid.ast.Ast.arg;
import static work.lcod.liquid.ast.Ast.assign;
import static work.lcod.liquid.ast.Ast.binary;
import static work.lcod.liquid.ast.Ast.blank;
import static work.lcod.liquid.ast.Ast.body;
import static work.lcod.liquid.ast.Ast.call;
import static work.lcod.liquid.ast.Ast.empty;
import static work.lcod.liquid.ast.Ast.filter;
import static work.lcod.liquid.ast.Ast.forLoop;
import static work.lcod.liquid.ast.Ast.identifier;
import static work.lcod.liquid.ast.Ast.ifThen;
import static work.lcod.liquid.ast.Ast.index;
import static work.lcod.liquid.ast.Ast.literal;
import static work.lcod.liquid.ast.Ast.member;
import static work.lcod.liquid.ast.Ast.nil;
import static work.lcod.liquid.ast.Ast.output;
import static work.lcod.liquid.ast.Ast.range;
import static work.lcod.liquid.ast.Ast.text;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import work.lcod.liquid.ast.BinaryExpression;
import work.lcod.liquid.ast.BinaryOperator;
import work.lcod.liquid.ast.BreakStatement;
import work.lcod.liquid.ast.CaptureStatement;
import work.lcod.liquid.ast.ContinueStatement;
import work.lcod.liquid.ast.ForStatement;
import work.lcod.liquid.ast.MacroParameter;
import work.lcod.liquid.ast.MacroStatement;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.flow.RecursionLimitExceededException;
import work.lcod.liquid.flow.StepLimitExceededException;
import work.lcod.liquid.runtime.InterpretedTemplate;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.support.TemplateTestSupport;
import work.lcod.liquid.support.TemplateTestSupport.ViewModel;
import work.lcod.liquid.text.TrimmingFlag;
import work.lcod.liquid.text.TrimmingPolicy;

/**
 * Renders the same trees through the interpreter, the generic compiled routine and, for typed
 * models, the typed routine, and expects identical output and step counts.
 */
class ParityTest {
    @Test
    void modelLoopWithForloopAndFilters() {
        Supplier<List<Statement>> template = () -> body(
            text("<ul>"),
            forLoop("f", member("fortunes"),
                ifThen(member("forloop", "first"), text("[")),
                text("<li>"),
                output(member("f", "id")),
                text(" "),
                output(filter(member("f", "message"), "upcase")),
                text("</li>"),
                ifThen(member("forloop", "last"), text("]"))
            ),
            text("</ul>")
        );
        assertParity(template, TemplateTestSupport.fortunes(), TemplateTestSupport.options(), true,
            "<ul>[<li>1 A &lt;B&gt;BOLD&lt;/B&gt; MOVE</li><li>2 PATIENCE &amp; TIME</li>"
                + "<li>3 FORTUNE FAVOURS THE BRAVE</li>]</ul>");
    }

    @Test
    void breakAndContinueInModelLoops() {
        Supplier<List<Statement>> template = () -> body(
            forLoop("f", member("fortunes"),
                ifThen(binary(BinaryOperator.EQUAL, member("f", "id"), literal(2)), ContinueStatement.INSTANCE),
                ifThen(binary(BinaryOperator.EQUAL, member("f", "id"), literal(3)), BreakStatement.INSTANCE),
                output(member("f", "id"))
            ),
            text("|"),
            output(member("title"))
        );
        assertParity(template, TemplateTestSupport.fortunes(), TemplateTestSupport.options(), true, "1|Fortunes");
    }

    @Test
    void assignmentsMacrosAndCaptures() {
        Supplier<List<Statement>> template = () -> body(
            assign("total", literal(0)),
            forLoop("i", range(literal(1), literal(4)),
                assign("total", filter(member("total"), "plus", arg(member("i")))),
                output(member("total")),
                text(",")
            ),
            output(member("total")),
            text(" "),
            new MacroStatement("row", List.of(MacroParameter.of("label"), new MacroParameter("value", literal("-"))),
                body(output(member("label")), text("="), output(member("value")), text(";"))),
            output(member(identifier("row"), call(arg(literal("a")), arg(literal(1))))),
            output(member(identifier("row"), call(arg(literal("b"))))),
            new CaptureStatement("c", body(text("<"), output(member("total")))),
            output(member("c"))
        );
        assertParity(template, Map.of(), TemplateTestSupport.options(), false, "1,3,6,10,0 a=1;b=-;<0");
    }

    @Test
    void loopWindowsOverModelsAndRanges() {
        Supplier<List<Statement>> template = () -> body(
            new ForStatement("f", member("fortunes"), body(output(member("f", "id"))), List.of(), literal(5), literal(1), true),
            text("|"),
            new ForStatement("n", range(literal(1), literal(10)), body(output(member("n"))), List.of(), literal(2), member("start"), false)
        );
        assertParity(template, TemplateTestSupport.fortunes(), TemplateTestSupport.options(), true, "32|12");
    }

    @Test
    void operatorsAndSpecialLiterals() {
        Supplier<List<Statement>> template = () -> body(
            ifThen(new BinaryExpression(BinaryOperator.LOWER_THAN, member("n"), literal(5), false), text("le.")),
            ifThen(new BinaryExpression(BinaryOperator.GREATER_THAN, member("n"), literal(6), false), text("ge.")),
            ifThen(binary(BinaryOperator.STARTS_WITH, member("name"), literal("liq")), text("sw.")),
            ifThen(binary(BinaryOperator.ENDS_WITH, member("name"), literal("uid")), text("ew.")),
            ifThen(binary(BinaryOperator.CONTAINS, member("name"), literal("qu")), text("c.")),
            ifThen(binary(BinaryOperator.CONTAINS, member("list"), literal(2)), text("lc.")),
            ifThen(binary(BinaryOperator.LOWER_THAN, member("n"), literal("9")), text("bad.")),
            ifThen(binary(BinaryOperator.AND,
                binary(BinaryOperator.EQUAL, member("n"), literal(5)),
                binary(BinaryOperator.NOT_EQUAL, member("name"), literal("x"))), text("and.")),
            ifThen(binary(BinaryOperator.EQUAL, nil(), blank()), text("nb.")),
            ifThen(binary(BinaryOperator.EQUAL, member("list"), empty()), text("bad.")),
            ifThen(binary(BinaryOperator.EQUAL, literal(""), empty()), text("ee."))
        );
        var model = Map.of("name", "liquid", "n", 5, "list", List.of(1, 2));
        assertParity(template, model, TemplateTestSupport.options(), false, "le.sw.ew.c.lc.and.nb.ee.");
    }

    @Test
    void navigationAndArrayFilters() {
        Supplier<List<Statement>> template = () -> body(
            output(member(identifier("name"), index(literal(0)))),
            output(member("name", "size")),
            text(" "),
            output(filter(member("list"), "join", arg(literal("-")))),
            text(" "),
            output(member(identifier("list"), index(literal(-1)))),
            output(member("missing", "deeper"))
        );
        var model = Map.of("name", "liquid", "list", List.of(1, 2));
        assertParity(template, model, TemplateTestSupport.options(), false, "l6 1-2 2");
    }

    @Test
    void minimalTrimmingKeepsOneLineBreak() {
        var options = TemplateTestSupport.options().toBuilder()
            .trimming(TrimmingPolicy.of(false, TrimmingFlag.values()))
            .build();
        assertParity(ParityTest::spacedTemplate, Map.of("name", "Ann"), options, false, "Hi  \nAnn\n  !\n  yes  \nend");
    }

    @Test
    void greedyTrimmingRemovesAllWhitespace() {
        var options = TemplateTestSupport.options().toBuilder()
            .trimming(TrimmingPolicy.of(true, TrimmingFlag.values()))
            .build();
        assertParity(ParityTest::spacedTemplate, Map.of("name", "Ann"), options, false, "HiAnn!yesend");
    }

    @Test
    void loopVariablesShadowModelMembersOnlyInsideTheLoop() {
        Supplier<List<Statement>> template = () -> body(
            forLoop("title", member("fortunes"),
                output(member("title", "id")),
                forLoop("n", range(literal(1), literal(2)), output(member("n")), text(",")),
                text(";")
            ),
            output(member("title"))
        );
        assertParity(template, TemplateTestSupport.fortunes(), TemplateTestSupport.options(), true, "11,2,;21,2,;31,2,;Fortunes");
    }

    @Test
    void emptyLoopsRenderTheirElseBody() {
        Supplier<List<Statement>> template = () -> body(
            new ForStatement("x", member("items"), body(output(member("x"))), body(text("none")), null, null, false)
        );
        assertParity(template, Map.of("items", List.of()), TemplateTestSupport.options(), false, "none");
    }

    @Test
    void stepCeilingTripsAtTheSameStatement() {
        var options = TemplateTestSupport.options().toBuilder().maxSteps(4).build();
        Supplier<List<Statement>> template = () -> body(forLoop("f", member("fortunes"), output(member("f", "message"))));

        var interpreted = new TemplateContext(TemplateTestSupport.fortunes(), options);
        assertThrows(StepLimitExceededException.class,
            () -> new InterpretedTemplate(template.get()).render(interpreted));

        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(template.get()), ViewModel.class);
        var context = new TemplateContext(TemplateTestSupport.fortunes(), options);
        assertTrue(compiled.usesTypedRoutine(context));
        assertThrows(StepLimitExceededException.class, () -> compiled.render(context));
        assertEquals(interpreted.steps(), context.steps());
    }

    @Test
    void oversizedLimitsAreClampedAfterTheOffset() {
        Supplier<List<Statement>> maxInt = () -> body(new ForStatement("i", range(literal(1), literal(3)),
            body(output(member("i"))), List.of(), literal(Integer.MAX_VALUE), literal(1), false));
        assertParity(maxInt, Map.of(), TemplateTestSupport.options(), false, "23");

        Supplier<List<Statement>> beyondInt = () -> body(new ForStatement("i", range(literal(1), literal(3)),
            body(output(member("i"))), List.of(), literal(5_000_000_000L), literal(5_000_000_000L), false));
        assertParity(beyondInt, Map.of(), TemplateTestSupport.options(), false, "");
    }

    @Test
    void negativeAndZeroLimitsTakeNothing() {
        for (long limit : new long[] {-1, -2, 0}) {
            Supplier<List<Statement>> template = () -> body(new ForStatement("i", range(literal(1), literal(3)),
                body(output(member("i"))), body(text("none")), literal(limit), null, false));
            assertParity(template, Map.of(), TemplateTestSupport.options(), false, "none");
        }
        Supplier<List<Statement>> nilLimit = () -> body(new ForStatement("i", range(literal(1), literal(3)),
            body(output(member("i"))), List.of(), nil(), literal(-4), true));
        assertParity(nilLimit, Map.of(), TemplateTestSupport.options(), false, "321");
    }

    @Test
    void hugeRangesHitTheStepCeiling() {
        var options = TemplateTestSupport.options().toBuilder().maxSteps(10).build();
        Supplier<List<Statement>> template = () -> body(forLoop("i", range(literal(1), literal(2_000_000_000L)),
            output(member("i"))));

        var interpreted = new TemplateContext(Map.of(), options);
        assertThrows(StepLimitExceededException.class,
            () -> new InterpretedTemplate(template.get()).render(interpreted));

        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(template.get()));
        var context = new TemplateContext(Map.of(), options);
        assertThrows(StepLimitExceededException.class, () -> compiled.render(context));
        assertEquals(interpreted.steps(), context.steps());

        Supplier<List<Statement>> tail = () -> body(new ForStatement("i", range(literal(1), literal(2_000_000_000L)),
            body(output(member("i")), text(",")), List.of(), literal(2), literal(1_999_999_998L), true));
        assertParity(tail, Map.of(), TemplateTestSupport.options(), false, "2000000000,1999999999,");
    }

    @Test
    void runawayMacroRecursionStopsAtTheRecursionCeiling() {
        var options = TemplateTestSupport.options().toBuilder().maxSteps(200_000).build();
        Supplier<List<Statement>> template = () -> body(
            new MacroStatement("m", List.of(), body(output(member(identifier("m"), call())))),
            output(member(identifier("m"), call()))
        );

        var interpreted = new TemplateContext(Map.of(), options);
        assertThrows(RecursionLimitExceededException.class,
            () -> new InterpretedTemplate(template.get()).render(interpreted));
        assertEquals(0, interpreted.scopeDepth());

        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(template.get()));
        var context = new TemplateContext(Map.of(), options);
        assertThrows(RecursionLimitExceededException.class, () -> compiled.render(context));
        assertEquals(0, context.scopeDepth());
        assertEquals(interpreted.steps(), context.steps());
    }

    @Test
    void boundedMacroRecursionFitsTheCeiling() {
        Supplier<List<Statement>> template = () -> body(
            new MacroStatement("countdown", List.of(MacroParameter.of("n")), body(
                ifThen(binary(BinaryOperator.GREATER_THAN, member("n"), literal(0)),
                    output(member("n")),
                    output(member(identifier("countdown"), call(arg(filter(member("n"), "minus", arg(literal(1))))))))
            )),
            output(member(identifier("countdown"), call(arg(literal(3)))))
        );
        var options = TemplateTestSupport.options().toBuilder().maxRecursion(4).build();
        assertParity(template, Map.of(), options, false, "321");

        var shallow = TemplateTestSupport.options().toBuilder().maxRecursion(3).build();
        assertThrows(RecursionLimitExceededException.class,
            () -> new InterpretedTemplate(template.get()).render(new TemplateContext(Map.of(), shallow)));
        var compiled = new TemplateCompiler(shallow).compile(new InterpretedTemplate(template.get()));
        assertThrows(RecursionLimitExceededException.class, () -> compiled.render(new TemplateContext(Map.of(), shallow)));
    }

    private static List<Statement> spacedTemplate() {
        return body(
            text("Hi  \n  "),
            output(member("name")),
            text("  \n  !"),
            ifThen(literal(true), text("\n  yes  \n")),
            text("  end")
        );
    }

    private static void assertParity(
        Supplier<List<Statement>> template,
        Object model,
        TemplateOptions options,
        boolean typed,
        String expected
    ) {
        var interpretedContext = new TemplateContext(model, options);
        assertEquals(expected, new InterpretedTemplate(template.get()).render(interpretedContext));

        var generic = new TemplateCompiler(options).compile(new InterpretedTemplate(template.get()));
        var genericContext = new TemplateContext(model, options);
        assertEquals(expected, generic.render(genericContext));
        assertEquals(interpretedContext.steps(), genericContext.steps());

        if (typed) {
            var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(template.get()), ViewModel.class);
            var typedContext = new TemplateContext(model, options);
            assertTrue(compiled.usesTypedRoutine(typedContext));
            assertEquals(expected, compiled.render(typedContext));
            assertEquals(interpretedContext.steps(), typedContext.steps());
        }
    }
}
