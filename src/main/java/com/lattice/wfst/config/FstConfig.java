package com.lattice.wfst.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Process-level tunables of the FST core.
 *
 * <p>
 * Instances are passed explicitly to read/write entry points, handles and
 * tools; nothing in the core consults global state. A config can be built
 * from defaults, a JSON file, or {@code --key=value} command-line flags.
 *
 * <pre>
 * { "fst_read_mode": "map", "fst_align": true, "v": 1 }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FstConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final Set<String> KNOWN_FLAGS = Set.of(
            "fst_read_mode", "fst_verify_properties", "fst_default_cache_gc",
            "fst_default_cache_gc_limit", "fst_align", "v");

    /** "read" copies persisted FSTs into memory, "map" memory-maps them where supported. */
    @JsonProperty("fst_read_mode")
    private String readMode = "read";

    /** Recompute queried properties and compare them with the cached ones. */
    @JsonProperty("fst_verify_properties")
    private boolean verifyProperties;

    @JsonProperty("fst_default_cache_gc")
    private boolean defaultCacheGc = true;

    /** Cache byte size that triggers garbage collection in lazy FSTs. */
    @JsonProperty("fst_default_cache_gc_limit")
    private long defaultCacheGcLimit = 1L << 20;

    /** Write FST data aligned where the encoding supports it. */
    @JsonProperty("fst_align")
    private boolean align;

    /** Log verbosity; above zero enables debug logging of the core. */
    @JsonProperty("v")
    private int verbosity;

    public static FstConfig defaults() {
        return new FstConfig();
    }

    public static FstConfig load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), FstConfig.class);
    }

    /**
     * Splits command-line arguments into config flags, other flags and
     * positional arguments.
     *
     * <p>
     * Flags take the forms {@code --name=value}, {@code --name} (true) and
     * {@code --noname} (false). {@code --config=file.json} loads a base config
     * before the remaining flags are applied. A lone {@code -} is positional
     * and {@code --} ends flag parsing.
     *
     * @throws IllegalArgumentException if a config flag has an unparseable value.
     */
    public static ParsedArgs parseArgs(String[] args) throws IOException {
        Map<String, String> configFlags = new LinkedHashMap<>();
        Map<String, String> otherFlags = new LinkedHashMap<>();
        List<String> positional = new ArrayList<>();
        String configFile = null;
        boolean flagsDone = false;

        for (String arg : args) {
            if (flagsDone || !arg.startsWith("-") || arg.equals("-")) {
                positional.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                flagsDone = true;
                continue;
            }
            String body = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
            String name;
            String value;
            int eq = body.indexOf('=');
            if (eq >= 0) {
                name = body.substring(0, eq);
                value = body.substring(eq + 1);
            } else if (body.startsWith("no") && KNOWN_FLAGS.contains(body.substring(2))) {
                name = body.substring(2);
                value = "false";
            } else {
                name = body;
                value = "true";
            }
            if (name.equals("config"))
                configFile = value;
            else if (KNOWN_FLAGS.contains(name))
                configFlags.put(name, value);
            else
                otherFlags.put(name, value);
        }

        FstConfig config = configFile != null ? load(Path.of(configFile)) : defaults();
        try {
            MAPPER.updateValue(config, configFlags);
        } catch (IllegalArgumentException | JsonMappingException e) {
            throw new IllegalArgumentException("Invalid flag value in " + configFlags, e);
        }
        return new ParsedArgs(config, Collections.unmodifiableMap(otherFlags),
                Collections.unmodifiableList(positional));
    }

    /** Raises the core's log level according to {@link #getVerbosity()}. */
    public void applyVerbosity() {
        if (verbosity > 1)
            Configurator.setLevel("com.lattice.wfst", Level.TRACE);
        else if (verbosity > 0)
            Configurator.setLevel("com.lattice.wfst", Level.DEBUG);
    }

    /** Result of {@link #parseArgs(String[])}. */
    public record ParsedArgs(FstConfig config, Map<String, String> flags, List<String> positional) {

        public String flag(String name, String def) {
            return flags.getOrDefault(name, def);
        }
    }
}
