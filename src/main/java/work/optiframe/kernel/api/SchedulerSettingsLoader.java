package work.optiframe.kernel.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link SchedulerSettings} from the {@code [scheduler]} table of a TOML document.
 *
 * <pre>{@code
 * [scheduler]
 * duplicate_outputs = "reject"
 * parallelism = 4
 * }</pre>
 *
 * Absent files, tables and keys fall back to {@link SchedulerSettings#DEFAULTS}.
 */
public final class SchedulerSettingsLoader {
    static final String TABLE = "scheduler";
    static final String DUPLICATE_OUTPUTS = "duplicate_outputs";
    static final String PARALLELISM = "parallelism";

    private SchedulerSettingsLoader() {}

    public static SchedulerSettings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return SchedulerSettings.DEFAULTS;
        }
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read scheduler settings: " + path, ex);
        }
    }

    public static SchedulerSettings parse(String toml) {
        return parse(toml, "<inline>");
    }

    private static SchedulerSettings parse(String toml, String source) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid TOML in " + source + ": " + errors);
        }
        return fromToml(result.getTable(TABLE), source);
    }

    private static SchedulerSettings fromToml(TomlTable table, String source) {
        var builder = SchedulerSettings.builder();
        if (table == null || table.isEmpty()) {
            return builder.build();
        }
        Object policy = table.get(DUPLICATE_OUTPUTS);
        if (policy != null) {
            if (!(policy instanceof String raw)) {
                throw new IllegalArgumentException(key(DUPLICATE_OUTPUTS) + " in " + source + " must be a string");
            }
            builder.duplicateOutputs(DuplicateOutputPolicy.from(raw));
        }
        Object parallelism = table.get(PARALLELISM);
        if (parallelism != null) {
            if (!(parallelism instanceof Long value) || value < 1 || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(key(PARALLELISM) + " in " + source + " must be a positive integer");
            }
            builder.parallelism(value.intValue());
        }
        return builder.build();
    }

    private static String key(String name) {
        return TABLE + "." + name;
    }
}
