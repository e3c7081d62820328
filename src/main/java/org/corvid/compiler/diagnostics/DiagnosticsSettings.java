package org.corvid.compiler.diagnostics;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Process-wide diagnostics settings, read once at startup.
 * <p>
 * Configuration structure:
 * <pre>
 * diagnostics {
 *   ansi-enabled = false   # color the warning prefix
 *   stream = "stderr"      # "stderr" or "stdout"
 * }
 * </pre>
 *
 * @param ansiEnabled Whether warnings are printed with ANSI colors.
 * @param stream The stream diagnostics are written to.
 */
public record DiagnosticsSettings(boolean ansiEnabled, Stream stream) {

    private static final String DIAGNOSTICS_CONFIG_PATH = "diagnostics";
    private static final String ANSI_ENABLED_KEY = "ansi-enabled";
    private static final String STREAM_KEY = "stream";

    /** The standard stream diagnostics are written to. */
    public enum Stream {
        STDERR,
        STDOUT
    }

    /** Settings used when no configuration is available: no colors, standard error. */
    public static final DiagnosticsSettings DEFAULTS = new DiagnosticsSettings(false, Stream.STDERR);

    /**
     * Reads the {@code diagnostics} block of the given configuration. Missing keys fall back to {@link #DEFAULTS}.
     *
     * @param config The application configuration.
     * @return The settings.
     * @throws ConfigException.BadValue if {@code stream} names an unknown stream.
     */
    public static DiagnosticsSettings fromConfig(Config config) {
        if (!config.hasPath(DIAGNOSTICS_CONFIG_PATH)) {
            return DEFAULTS;
        }
        Config diagnostics = config.getConfig(DIAGNOSTICS_CONFIG_PATH);
        boolean ansiEnabled = diagnostics.hasPath(ANSI_ENABLED_KEY)
                ? diagnostics.getBoolean(ANSI_ENABLED_KEY)
                : DEFAULTS.ansiEnabled();
        Stream stream = DEFAULTS.stream();
        if (diagnostics.hasPath(STREAM_KEY)) {
            String name = diagnostics.getString(STREAM_KEY);
            try {
                stream = Stream.valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(diagnostics.origin(), STREAM_KEY,
                        "expected \"stderr\" or \"stdout\" but got \"" + name + "\"", e);
            }
        }
        return new DiagnosticsSettings(ansiEnabled, stream);
    }

    /**
     * Returns the configured standard stream as currently installed in {@link System}, so that
     * {@link System#setErr} and {@link System#setOut} redirections are honored. The stream is shared
     * and must not be closed by the caller.
     * @return {@link System#err} or {@link System#out}.
     */
    public PrintStream printStream() {
        return stream == Stream.STDOUT ? System.out : System.err;
    }
}
