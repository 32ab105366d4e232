package work.lcod.liquid.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one render run.
 */
public record RenderConfiguration(
    Path templatePath,
    String modelPayload,
    Optional<Path> optionsPath,
    RenderMode mode,
    String encoder,
    Optional<Long> maxSteps,
    Optional<Duration> timeout,
    LogLevel logLevel
) {
    public RenderConfiguration {
        Objects.requireNonNull(templatePath, "templatePath");
        Objects.requireNonNull(modelPayload, "modelPayload");
        Objects.requireNonNull(optionsPath, "optionsPath");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(encoder, "encoder");
        Objects.requireNonNull(maxSteps, "maxSteps");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path templatePath;
        private String modelPayload = "{}";
        private Optional<Path> optionsPath = Optional.empty();
        private RenderMode mode = RenderMode.AUTO;
        private String encoder = "html";
        private Optional<Long> maxSteps = Optional.empty();
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder templatePath(Path templatePath) {
            this.templatePath = templatePath;
            return this;
        }

        public Builder modelPayload(String modelPayload) {
            this.modelPayload = modelPayload;
            return this;
        }

        public Builder optionsPath(Optional<Path> optionsPath) {
            this.optionsPath = optionsPath;
            return this;
        }

        public Builder mode(RenderMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder encoder(String encoder) {
            this.encoder = encoder;
            return this;
        }

        public Builder maxSteps(Optional<Long> maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RenderConfiguration build() {
            return new RenderConfiguration(
                templatePath,
                modelPayload,
                optionsPath,
                mode,
                encoder,
                maxSteps,
                timeout,
                logLevel
            );
        }
    }
}
