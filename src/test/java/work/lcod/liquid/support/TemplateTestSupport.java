package work.lcod.liquid.support;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.compiler.TemplateCompiler;
import work.lcod.liquid.runtime.DefaultMemberAccessStrategy;
import work.lcod.liquid.runtime.FilterFunction;
import work.lcod.liquid.runtime.FilterRegistries;
import work.lcod.liquid.runtime.InterpretedTemplate;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.values.Arguments;
import work.lcod.liquid.values.StringValue;
import work.lcod.liquid.values.Value;

/**
 * Shared fixtures for the engine test suites: a small typed view model, options that expose it,
 * and filters that observe how they are called.
 */
public final class TemplateTestSupport {
    private TemplateTestSupport() {}

    public static TemplateOptions options() {
        var strategy = new DefaultMemberAccessStrategy()
            .register(ViewModel.class)
            .register(Fortune.class);
        return TemplateOptions.builder()
            .filters(FilterRegistries.create())
            .memberAccessStrategy(strategy)
            .build();
    }

    public static ViewModel fortunes() {
        return new ViewModel("Fortunes", List.of(
            new Fortune(1, "A <b>bold</b> move"),
            new Fortune(2, "Patience & time"),
            new Fortune(3, "Fortune favours the brave")
        ));
    }

    public static String interpret(List<Statement> statements, Object model, TemplateOptions options) {
        return new InterpretedTemplate(statements).render(new TemplateContext(model, options));
    }

    public static String compile(List<Statement> statements, Object model, TemplateOptions options) {
        var template = new TemplateCompiler(options).compile(new InterpretedTemplate(statements));
        return template.render(new TemplateContext(model, options));
    }

    public static final class Fortune {
        private final int id;
        private final String message;

        public Fortune(int id, String message) {
            this.id = id;
            this.message = message;
        }

        public int getId() {
            return id;
        }

        public String getMessage() {
            return message;
        }
    }

    public static final class ViewModel {
        private final String title;
        private final List<Fortune> fortunes;

        public ViewModel(String title, List<Fortune> fortunes) {
            this.title = title;
            this.fortunes = fortunes;
        }

        public String getTitle() {
            return title;
        }

        public List<Fortune> getFortunes() {
            return fortunes;
        }
    }

    /**
     * Appends its first argument and remembers every argument bundle it received.
     */
    public static final class RecordingFilter implements FilterFunction {
        private final Set<Arguments> bundles = Collections.newSetFromMap(new IdentityHashMap<>());
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public synchronized CompletableFuture<Value> invoke(Value input, Arguments arguments, TemplateContext context) {
            calls.incrementAndGet();
            bundles.add(arguments);
            return CompletableFuture.completedFuture(StringValue.create(input.toStringValue() + arguments.at(0).toStringValue()));
        }

        public int calls() {
            return calls.get();
        }

        public synchronized int distinctBundles() {
            return bundles.size();
        }
    }

    /**
     * Upper-cases its input on another thread after a short delay.
     */
    public static FilterFunction delayedUpcase() {
        return (input, arguments, context) -> CompletableFuture.supplyAsync(
            () -> (Value) StringValue.create(input.toStringValue().toUpperCase(Locale.ROOT)),
            CompletableFuture.delayedExecutor(20, TimeUnit.MILLISECONDS)
        );
    }
}
