package dev.issuebench.results;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/** Reads and writes benchmark runs as JSON. */
@Slf4j
public final class BenchmarkRunSerializer {
    private static final ObjectMapper JSON_MAPPER = createObjectMapper();
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    public static String toJson(BenchmarkRun run) {
        try {
            return JSON_MAPPER.writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize run of " + run.corpusName(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid benchmark run
     */
    public static BenchmarkRun fromJson(String json) {
        try {
            return JSON_MAPPER.readValue(json, BenchmarkRun.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Invalid benchmark run: " + e.getOriginalMessage(), e);
        }
    }

    public static void save(BenchmarkRun run, Path path) {
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON_MAPPER.writeValue(path.toFile(), run);
            log.debug("Saved run of {} to {}", run.corpusName(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write " + path, e);
        }
    }

    public static BenchmarkRun load(Path path) {
        try {
            return JSON_MAPPER.readValue(path.toFile(), BenchmarkRun.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + path, e);
        }
    }

    /**
     * Writes one attempt as {@code <config>_<issue>.json} under {@code dir}, characters unsafe in
     * file names replaced by {@code _}.
     *
     * @return the written file
     */
    public static Path saveAttempt(AttemptResult result, Path dir) {
        var fileName =
                safeFileName(result.configName()) + "_" + safeFileName(result.issueId()) + ".json";
        var path = dir.resolve(fileName);
        try {
            Files.createDirectories(dir);
            JSON_MAPPER.writeValue(path.toFile(), result);
            return path;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write " + path, e);
        }
    }

    public static AttemptResult loadAttempt(Path path) {
        try {
            return JSON_MAPPER.readValue(path.toFile(), AttemptResult.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + path, e);
        }
    }

    static String safeFileName(String name) {
        return UNSAFE_FILE_CHARS.matcher(name).replaceAll("_");
    }

    private static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private BenchmarkRunSerializer() {}
}
