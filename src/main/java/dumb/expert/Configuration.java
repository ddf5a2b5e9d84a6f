package dumb.expert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.expert.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Front-end settings. Missing fields take their defaults.
 *
 * @param verbose     print the banner and rule summary before results
 * @param color       ANSI colors for results in the interactive shell
 * @param formal      include formal-notation lines in explanations
 * @param suggestions maximum number of facts the shell's {@code suggest} command lists
 */
public record Configuration(
        @JsonProperty("verbose") boolean verbose,
        @JsonProperty("color") boolean color,
        @JsonProperty("formal") boolean formal,
        @JsonProperty("suggestions") int suggestions
) {
    public static final String RESOURCE = "/expert.json";
    static final boolean DEFAULT_VERBOSE = true, DEFAULT_COLOR = false, DEFAULT_FORMAL = true;
    static final int DEFAULT_SUGGESTIONS = 26;

    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

    @JsonCreator
    public Configuration(
            @JsonProperty("verbose") @Nullable Boolean verbose,
            @JsonProperty("color") @Nullable Boolean color,
            @JsonProperty("formal") @Nullable Boolean formal,
            @JsonProperty("suggestions") @Nullable Integer suggestions
    ) {
        this(
                verbose != null ? verbose : DEFAULT_VERBOSE,
                color != null ? color : DEFAULT_COLOR,
                formal != null ? formal : DEFAULT_FORMAL,
                suggestions != null ? suggestions : DEFAULT_SUGGESTIONS
        );
    }

    public Configuration() {
        this(DEFAULT_VERBOSE, DEFAULT_COLOR, DEFAULT_FORMAL, DEFAULT_SUGGESTIONS);
    }

    public Configuration {
        if (suggestions < 0) throw new IllegalArgumentException("suggestions must be >= 0: " + suggestions);
    }

    /** The bundled {@value #RESOURCE}, or defaults when it is absent or unreadable. */
    public static Configuration load() {
        try (var in = Configuration.class.getResourceAsStream(RESOURCE)) {
            if (in == null) return new Configuration();
            return Json.obj(in, Configuration.class);
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", RESOURCE, e.getMessage());
            return new Configuration();
        }
    }

    public static Configuration load(Path file) throws IOException {
        return Json.obj(file, Configuration.class);
    }
}
