package work.lcod.liquid.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import work.lcod.liquid.compiler.CompilationException;
import work.lcod.liquid.compiler.TemplateCompiler;
import work.lcod.liquid.config.OptionsLoader;
import work.lcod.liquid.flow.AsyncFlow;
import work.lcod.liquid.flow.TemplateErrorException;
import work.lcod.liquid.loader.TemplateLoader;
import work.lcod.liquid.runtime.InterpretedTemplate;
import work.lcod.liquid.runtime.LiquidTemplate;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.text.Encoders;

/**
 * Public entry point for rendering a template file against a JSON model. Never throws: every
 * failure is reported in the returned {@link RenderResult}.
 */
public final class RenderRunner {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final String STACK_OVERFLOW = "stack_overflow";

    public RenderResult run(RenderConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("template", configuration.templatePath().toString());
        metadata.put("mode", configuration.mode().label());
        try {
            var template = TemplateLoader.loadFromFile(configuration.templatePath());
            var options = loadOptions(configuration);
            var model = parseModel(configuration.modelPayload());
            var encoder = Encoders.byName(configuration.encoder());
            var context = new TemplateContext(model, options);
            var executable = select(template, options, configuration, metadata);

            configuration.timeout().ifPresent(timeout -> scheduleCancel(context, timeout));
            var writer = new StringWriter();
            AsyncFlow.await(executable.renderAsync(writer, encoder, context));

            metadata.put("output", writer.toString());
            metadata.put("steps", context.steps());
            metadata.put("status", "ok");
            log(configuration, LogLevel.DEBUG, "Rendered " + configuration.templatePath() + " in "
                + Duration.between(started, Instant.now()).toMillis() + "ms (" + context.steps() + " steps)");
            return RenderResult.success(metadata, started);
        } catch (TemplateErrorException ex) {
            metadata.put("errorCode", ex.code());
            return fail(configuration, ex, metadata, started);
        } catch (RuntimeException ex) {
            return fail(configuration, ex, metadata, started);
        } catch (StackOverflowError ex) {
            var error = new TemplateErrorException(STACK_OVERFLOW, "The render exhausted the thread stack", ex);
            metadata.put("errorCode", error.code());
            return fail(configuration, error, metadata, started);
        }
    }

    private RenderResult fail(RenderConfiguration configuration, RuntimeException ex, LinkedHashMap<String, Object> metadata, Instant started) {
        var message = ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getSimpleName() : ex.getMessage();
        metadata.put("error", message);
        log(configuration, LogLevel.ERROR, message);
        if (Boolean.getBoolean("liquid.debug")) {
            ex.printStackTrace();
        }
        return RenderResult.failure(message, metadata, started);
    }

    private LiquidTemplate select(InterpretedTemplate template, TemplateOptions options, RenderConfiguration configuration, LinkedHashMap<String, Object> metadata) {
        return switch (configuration.mode()) {
            case INTERPRET -> template;
            case COMPILE -> new TemplateCompiler(options).compile(template);
            case AUTO -> {
                try {
                    var compiled = new TemplateCompiler(options).compile(template);
                    metadata.put("mode", RenderMode.COMPILE.label());
                    yield compiled;
                } catch (CompilationException ex) {
                    log(configuration, LogLevel.WARN, "Falling back to the interpreter: " + ex.getMessage());
                    metadata.put("mode", RenderMode.INTERPRET.label());
                    yield template;
                }
            }
        };
    }

    private TemplateOptions loadOptions(RenderConfiguration configuration) {
        var builder = TemplateOptions.builder();
        var options = configuration.optionsPath()
            .map(path -> OptionsLoader.load(path, builder))
            .orElseGet(builder::build);
        if (configuration.maxSteps().isPresent()) {
            options = options.toBuilder().maxSteps(configuration.maxSteps().get()).build();
        }
        return options;
    }

    private Object parseModel(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return JSON.readValue(payload, Object.class);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON model payload", ex);
        }
    }

    private static void scheduleCancel(TemplateContext context, Duration timeout) {
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(context::cancel);
    }

    private static void log(RenderConfiguration configuration, LogLevel level, String message) {
        if (configuration.logLevel().enables(level)) {
            System.err.println("[" + level.name() + "] " + message);
        }
    }
}
