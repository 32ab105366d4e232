package work.lcod.liquid.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class RenderCommandTest {
    @TempDir
    Path workDir;

    private int execute(String... args) {
        var commandLine = new CommandLine(new RenderCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
        commandLine.setErr(new PrintWriter(new StringWriter()));
        return commandLine.execute(args);
    }

    private String template() throws Exception {
        var template = workDir.resolve("hello.yaml");
        Files.writeString(template, "template:\n  - text: \"Hi \"\n  - output: { member: name }\n");
        return template.toString();
    }

    @Test
    void rendersWithInlineAndFileModels() throws Exception {
        assertEquals(0, execute("--template", template(), "--model", "{\"name\":\"Ann\"}", "--log-level", "fatal"));

        var model = workDir.resolve("model.json");
        Files.writeString(model, "{\"name\":\"Bob\"}");
        assertEquals(0, execute("-t", template(), "-m", model.toString(), "--mode", "interpret", "--json"));
    }

    @Test
    void failedRendersExitWithOne() throws Exception {
        assertEquals(1, execute("-t", template(), "--max-steps", "1", "--log-level", "fatal"));
    }

    @Test
    void invalidArgumentsAreUsageErrors() throws Exception {
        var usage = CommandLine.ExitCode.USAGE;
        assertEquals(usage, execute());
        assertEquals(usage, execute("-t", workDir.resolve("missing.yaml").toString()));
        assertEquals(usage, execute("-t", template(), "--max-steps", "-1"));
        assertEquals(usage, execute("-t", template(), "--model", "{oops"));
        assertEquals(usage, execute("-t", template(), "--mode", "eager"));
        assertEquals(usage, execute("-t", template(), "--timeout", "soon"));
    }
}
