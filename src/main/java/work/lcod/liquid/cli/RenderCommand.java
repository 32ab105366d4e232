package work.lcod.liquid.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.liquid.api.LogLevel;
import work.lcod.liquid.api.RenderConfiguration;
import work.lcod.liquid.api.RenderMode;
import work.lcod.liquid.api.RenderResult;
import work.lcod.liquid.api.RenderRunner;
import work.lcod.liquid.shared.DurationParser;

@CommandLine.Command(
    name = "liquid-render",
    description = "Render a Liquid template document against a JSON model.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RenderCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Option(
        names = {"-t", "--template"},
        required = true,
        description = "Template document (.yaml, .yml or .json)."
    )
    private String templatePath;

    @CommandLine.Option(
        names = {"-m", "--model"},
        paramLabel = "PATH|-",
        description = "JSON model file, inline JSON object, or '-' to read from stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String model;

    @CommandLine.Option(
        names = "--options",
        description = "TOML file with render and trimming options.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String optionsPath;

    @CommandLine.Option(
        names = "--mode",
        description = "Execution mode (interpret|compile|auto).",
        defaultValue = "auto"
    )
    private String modeRaw;

    @CommandLine.Option(
        names = "--encoder",
        description = "Output encoder (html|none).",
        defaultValue = "html"
    )
    private String encoder;

    @CommandLine.Option(
        names = "--max-steps",
        description = "Abort the render after this many steps (0 disables the limit).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Long maxSteps;

    @CommandLine.Option(
        names = "--timeout",
        description = "Cancel the render after this duration (e.g. 500ms, 2s, 1m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--json",
        description = "Print the full run result as JSON instead of the rendered text."
    )
    private boolean json;

    @Override
    public Integer call() throws Exception {
        Path template = Paths.get(templatePath).toAbsolutePath().normalize();
        if (!Files.exists(template)) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Template file not found: " + template);
        }
        if (maxSteps != null && maxSteps < 0) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--max-steps must be zero or positive");
        }
        Optional<Duration> timeout = parseTimeout();

        RenderConfiguration configuration = RenderConfiguration.builder()
            .templatePath(template)
            .modelPayload(loadModelPayload())
            .optionsPath(Optional.ofNullable(optionsPath).map(p -> Paths.get(p).toAbsolutePath().normalize()))
            .mode(parseMode())
            .encoder(encoder)
            .maxSteps(Optional.ofNullable(maxSteps))
            .timeout(timeout)
            .logLevel(parseLogLevel())
            .build();

        RenderResult result = new RenderRunner().run(configuration);
        if (json) {
            System.out.println(result.toPrettyJson());
        } else if (result.status() == RenderResult.Status.SUCCESS) {
            System.out.print(result.output());
            System.out.flush();
        } else {
            String code = result.errorCode();
            Object error = result.metadata().get("error");
            System.err.println(code == null ? String.valueOf(error) : code + ": " + error);
        }
        return result.status().exitCode();
    }

    private RenderMode parseMode() {
        try {
            return RenderMode.from(modeRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage());
        }
    }

    private LogLevel parseLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage());
        }
    }

    private Optional<Duration> parseTimeout() {
        try {
            return DurationParser.parse(timeoutRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage());
        }
    }

    private String loadModelPayload() {
        if (model == null || model.isBlank()) {
            return "{}";
        }
        if ("-".equals(model)) {
            String payload = readStdin();
            validateJsonPayload(payload);
            return payload;
        }
        String trimmed = model.trim();
        if (trimmed.startsWith("{")) {
            validateJsonPayload(trimmed);
            return trimmed;
        }
        Path path = Paths.get(model).toAbsolutePath().normalize();
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            validateJsonPayload(content);
            return content;
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Cannot read model file: " + path);
        }
    }

    private void validateJsonPayload(String payload) {
        String trimmed = payload.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        try {
            var node = JSON.readTree(trimmed);
            if (node != null && !node.isObject()) {
                throw new CommandLine.ParameterException(new CommandLine(this), "JSON model must be an object");
            }
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Invalid JSON model: " + ex.getMessage());
        }
    }

    private String readStdin() {
        try {
            byte[] bytes = System.in.readAllBytes();
            if (bytes.length == 0) {
                return "{}";
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(new CommandLine(this), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
