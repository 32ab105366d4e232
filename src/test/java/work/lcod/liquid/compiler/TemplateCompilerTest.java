package work.lcod.liquid.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.liquid.ast.Ast.arg;
import static work.lcod.liquid.ast.Ast.assign;
import static work.lcod.liquid.ast.Ast.body;
import static work.lcod.liquid.ast.Ast.call;
import static work.lcod.liquid.ast.Ast.filter;
import static work.lcod.liquid.ast.Ast.forLoop;
import static work.lcod.liquid.ast.Ast.identifier;
import static work.lcod.liquid.ast.Ast.index;
import static work.lcod.liquid.ast.Ast.literal;
import static work.lcod.liquid.ast.Ast.member;
import static work.lcod.liquid.ast.Ast.output;
import static work.lcod.liquid.ast.Ast.text;

import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import work.lcod.liquid.ast.CustomExpression;
import work.lcod.liquid.ast.CustomStatement;
import work.lcod.liquid.ast.MacroParameter;
import work.lcod.liquid.ast.MacroStatement;
import work.lcod.liquid.ast.MemberExpression;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.flow.AsyncFlow;
import work.lcod.liquid.flow.Completion;
import work.lcod.liquid.runtime.DefaultMemberAccessStrategy;
import work.lcod.liquid.runtime.FilterRegistries;
import work.lcod.liquid.runtime.InterpretedTemplate;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.support.TemplateTestSupport;
import work.lcod.liquid.support.TemplateTestSupport.RecordingFilter;
import work.lcod.liquid.support.TemplateTestSupport.ViewModel;
import work.lcod.liquid.text.TextEncoder;
import work.lcod.liquid.values.StringValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

class TemplateCompilerTest {
    private static final String FORTUNES_HTML = "<h1>Fortunes</h1>"
        + "1:A &lt;b&gt;bold&lt;/b&gt; move;"
        + "2:Patience &amp; time;"
        + "3:Fortune favours the brave;";

    private static List<Statement> fortunesPage() {
        return body(
            text("<h1>"),
            output(member("title")),
            text("</h1>"),
            forLoop("f", member("fortunes"),
                output(member("f", "id")),
                text(":"),
                output(member("f", "message")),
                text(";")
            )
        );
    }

    @Test
    void typedRoutineReadsModelMembersDirectly() throws Exception {
        var options = TemplateTestSupport.options();
        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(fortunesPage()), ViewModel.class);
        var context = new TemplateContext(TemplateTestSupport.fortunes(), options);

        assertTrue(compiled.usesTypedRoutine(context));
        assertEquals(Set.of("fortunes", "title"), compiled.statistics().fastPathRoots());
        assertEquals(ViewModel.class, compiled.modelType());
        assertEquals(FORTUNES_HTML, compiled.render(context));
        assertEquals(FORTUNES_HTML, TemplateTestSupport.interpret(fortunesPage(), TemplateTestSupport.fortunes(), options));
    }

    @Test
    void contextBindingsOverrideTheTypedRoutine() throws Exception {
        var options = TemplateTestSupport.options();
        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(fortunesPage()), ViewModel.class);
        var context = new TemplateContext(TemplateTestSupport.fortunes(), options);
        context.setValue("title", "Override");

        assertFalse(compiled.usesTypedRoutine(context));
        assertTrue(compiled.render(context).startsWith("<h1>Override</h1>1:"));
    }

    @Test
    void otherStrategiesAndModelsUseTheGenericRoutine() throws Exception {
        var options = TemplateTestSupport.options();
        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(fortunesPage()), ViewModel.class);

        var otherStrategy = options.toBuilder()
            .memberAccessStrategy(new DefaultMemberAccessStrategy()
                .register(ViewModel.class)
                .register(TemplateTestSupport.Fortune.class))
            .build();
        var foreign = new TemplateContext(TemplateTestSupport.fortunes(), otherStrategy);
        assertFalse(compiled.usesTypedRoutine(foreign));
        assertEquals(FORTUNES_HTML, compiled.render(foreign));

        var map = Map.of("title", "T", "fortunes", List.of(Map.of("id", 7, "message", "m")));
        var mapContext = new TemplateContext(map, options);
        assertFalse(compiled.usesTypedRoutine(mapContext));
        assertEquals("<h1>T</h1>7:m;", compiled.render(mapContext));
    }

    @Test
    void typedRoutineIsDroppedWithoutModelReads() throws Exception {
        var options = TemplateTestSupport.options();
        var compiled = new TemplateCompiler(options).compile(InterpretedTemplate.of(text("static")), ViewModel.class);
        assertFalse(compiled.usesTypedRoutine(new TemplateContext(TemplateTestSupport.fortunes(), options)));
        assertTrue(compiled.statistics().fastPathRoots().isEmpty());
    }

    @Test
    void boundNamesAreNeverReadFromTheModel() throws Exception {
        var options = TemplateTestSupport.options();
        var template = new InterpretedTemplate(body(
            output(member("title")),
            text("/"),
            assign("title", literal("Local")),
            output(member("title")),
            text("/"),
            output(member("fortunes", "size"))
        ));
        var compiled = new TemplateCompiler(options).compile(template, ViewModel.class);
        assertEquals(Set.of("fortunes"), compiled.statistics().fastPathRoots());
        assertEquals("Fortunes/Local/3", compiled.render(new TemplateContext(TemplateTestSupport.fortunes(), options)));
    }

    @Test
    void customStatementsAreRejected() {
        var template = new InterpretedTemplate(body(text("a"), new NamedStatement("cycle")));
        var error = assertThrows(CompilationException.class, () -> new TemplateCompiler().compile(template));
        assertEquals(CompilationException.CODE, error.code());
        assertEquals("cycle", error.construct());
        assertEquals("The custom statement 'cycle' cannot be compiled", error.getMessage());
    }

    @Test
    void rejectionMessagesFollowTheOptionsLocale() {
        var options = TemplateOptions.builder().locale(Locale.FRENCH).build();
        var template = InterpretedTemplate.of(output(new NamedExpression("now")));
        var error = assertThrows(CompilationException.class, () -> new TemplateCompiler(options).compile(template));
        assertEquals("L'expression personnalisée 'now' ne peut pas être compilée", error.getMessage());
    }

    @Test
    void membersWithoutRootAreRejected() {
        var template = InterpretedTemplate.of(output(new MemberExpression(List.of(index(literal(0))))));
        var error = assertThrows(CompilationException.class, () -> new TemplateCompiler().compile(template));
        assertEquals("The member expression '[]' does not start with an identifier", error.getMessage());
    }

    @Test
    void constantArgumentsAreBundledOnce() throws Exception {
        var recording = new RecordingFilter();
        var options = TemplateOptions.builder()
            .filters(FilterRegistries.create().register("suffix", recording))
            .build();
        var statements = body(forLoop("i", member("items"), output(filter(member("i"), "suffix", arg(literal("!"))))));
        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(statements));
        var model = Map.of("items", List.of("a", "b"));

        assertEquals(1, compiled.statistics().cachedArgumentBundles());
        assertEquals("a!b!", compiled.render(new TemplateContext(model, options)));
        assertEquals("a!b!", compiled.render(new TemplateContext(model, options)));
        assertEquals(4, recording.calls());
        assertEquals(1, recording.distinctBundles());
    }

    @Test
    void dynamicArgumentsAreBuiltPerCall() throws Exception {
        var recording = new RecordingFilter();
        var options = TemplateOptions.builder()
            .filters(FilterRegistries.create().register("suffix", recording))
            .build();
        var statements = body(forLoop("i", member("items"), output(filter(member("i"), "suffix", arg(member("sep"))))));
        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(statements));

        assertEquals(0, compiled.statistics().cachedArgumentBundles());
        assertEquals("a-b-", compiled.render(new TemplateContext(Map.of("items", List.of("a", "b"), "sep", "-"), options)));
        assertEquals(2, recording.distinctBundles());
    }

    @Test
    void rootLiteralAssignmentsFoldToConstants() throws Exception {
        var template = new InterpretedTemplate(body(
            assign("greeting", literal("Hi")),
            output(member("greeting")),
            assign("twice", literal("a")),
            assign("twice", literal("b")),
            output(member("twice"))
        ));
        var compiled = new TemplateCompiler().compile(template);
        assertTrue(compiled.statistics().constants() >= 3);
        assertEquals("Hib", compiled.render(new TemplateContext()));
    }

    @Test
    void macrosAreExtractedAndRedefinitionsResolveDynamically() throws Exception {
        var template = new InterpretedTemplate(body(
            new MacroStatement("pair", List.of(MacroParameter.of("a"), new MacroParameter("b", literal("?"))),
                body(output(member("a")), text("="), output(member("b")))),
            output(member(identifier("pair"), call(arg(literal("x"))))),
            text(";"),
            new MacroStatement("m", List.of(), body(text("1"))),
            output(member(identifier("m"), call())),
            new MacroStatement("m", List.of(), body(text("2"))),
            output(member(identifier("m"), call()))
        ));
        var compiled = new TemplateCompiler().compile(template);
        assertEquals(3, compiled.statistics().macros());
        assertEquals("x=?;12", compiled.render(new TemplateContext()));
    }

    @Test
    void compiledTemplatesRenderConcurrently() throws Exception {
        var options = TemplateTestSupport.options();
        var compiled = new TemplateCompiler(options).compile(new InterpretedTemplate(fortunesPage()), ViewModel.class);
        var pool = Executors.newFixedThreadPool(8);
        try {
            var results = new ArrayList<Future<String>>();
            for (int i = 0; i < 32; i++) {
                results.add(pool.submit(() -> compiled.render(new TemplateContext(TemplateTestSupport.fortunes(), options))));
            }
            for (var result : results) {
                assertEquals(FORTUNES_HTML, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static final class NamedStatement extends CustomStatement {
        private final String name;

        NamedStatement(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CompletableFuture<Completion> writeToAsync(Writer writer, TextEncoder encoder, TemplateContext context) {
            return AsyncFlow.normal();
        }
    }

    private static final class NamedExpression extends CustomExpression {
        private final String name;

        NamedExpression(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CompletableFuture<Value> evaluateAsync(TemplateContext context) {
            return Values.completed(StringValue.create(name));
        }
    }
}
