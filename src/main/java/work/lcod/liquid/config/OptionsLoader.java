package work.lcod.liquid.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Locale;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.text.TrimmingFlag;
import work.lcod.liquid.text.TrimmingPolicy;

/**
 * Reads render options from a TOML file with optional {@code [render]} and {@code [trimming]}
 * tables. Keys left out keep the value of the builder passed in.
 */
public final class OptionsLoader {
    private OptionsLoader() {}

    public static TemplateOptions load(Path path) {
        return load(path, TemplateOptions.builder());
    }

    public static TemplateOptions load(Path path, TemplateOptions.Builder builder) {
        try {
            return parse(Files.readString(path), builder);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read options: " + path, ex);
        }
    }

    public static TemplateOptions parse(String content) {
        return parse(content, TemplateOptions.builder());
    }

    public static TemplateOptions parse(String content, TemplateOptions.Builder builder) {
        TomlParseResult result = Toml.parse(content);
        if (result.hasErrors()) {
            var messages = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid options file: " + messages);
        }
        applyRender(result.getTable("render"), builder);
        applyTrimming(result.getTable("trimming"), builder);
        return builder.build();
    }

    private static void applyRender(TomlTable render, TemplateOptions.Builder builder) {
        if (render == null) {
            return;
        }
        if (render.contains("maxSteps")) {
            Long maxSteps = readLong(render, "maxSteps");
            if (maxSteps < 0) {
                throw new IllegalArgumentException("render.maxSteps must be >= 0");
            }
            builder.maxSteps(maxSteps);
        }
        if (render.contains("maxRecursion")) {
            Long maxRecursion = readLong(render, "maxRecursion");
            if (maxRecursion < 0 || maxRecursion > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("render.maxRecursion must be between 0 and " + Integer.MAX_VALUE);
            }
            builder.maxRecursion(maxRecursion.intValue());
        }
        if (render.contains("culture")) {
            var culture = readString(render, "culture");
            builder.locale(culture.isBlank() ? Locale.ROOT : Locale.forLanguageTag(culture.trim()));
        }
    }

    private static void applyTrimming(TomlTable trimming, TemplateOptions.Builder builder) {
        if (trimming == null) {
            return;
        }
        var flags = new ArrayList<TrimmingFlag>();
        addFlag(trimming, "tagLeft", TrimmingFlag.TAG_LEFT, flags);
        addFlag(trimming, "tagRight", TrimmingFlag.TAG_RIGHT, flags);
        addFlag(trimming, "outputLeft", TrimmingFlag.OUTPUT_LEFT, flags);
        addFlag(trimming, "outputRight", TrimmingFlag.OUTPUT_RIGHT, flags);
        boolean greedy = !trimming.contains("greedy") || readBoolean(trimming, "greedy");
        builder.trimming(TrimmingPolicy.of(greedy, flags.toArray(new TrimmingFlag[0])));
    }

    private static void addFlag(TomlTable table, String key, TrimmingFlag flag, ArrayList<TrimmingFlag> flags) {
        if (table.contains(key) && readBoolean(table, key)) {
            flags.add(flag);
        }
    }

    private static Long readLong(TomlTable table, String key) {
        if (!table.isLong(key)) {
            throw new IllegalArgumentException(key + " must be an integer");
        }
        return table.getLong(key);
    }

    private static String readString(TomlTable table, String key) {
        if (!table.isString(key)) {
            throw new IllegalArgumentException(key + " must be a string");
        }
        return table.getString(key);
    }

    private static boolean readBoolean(TomlTable table, String key) {
        if (!table.isBoolean(key)) {
            throw new IllegalArgumentException(key + " must be a boolean");
        }
        return table.getBoolean(key);
    }
}
