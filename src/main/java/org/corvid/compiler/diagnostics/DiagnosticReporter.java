package org.corvid.compiler.diagnostics;

import org.corvid.compiler.api.CompilationException;
import org.corvid.compiler.api.DiagnosticKind;
import org.corvid.compiler.api.SourceLocation;
import org.corvid.compiler.diagnostics.normalize.ErrorPrefix;
import org.corvid.compiler.diagnostics.normalize.ParseErrorNormalizer;
import org.corvid.compiler.diagnostics.normalize.RawErrorFragment;
import org.corvid.compiler.util.SourcePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Reports the diagnostics of one compilation unit.
 * <p>
 * Errors are fatal: every error entry point throws a {@link CompilationException} and never returns
 * normally. The exception's stack trace starts at the caller of this class. Nothing is written to the
 * diagnostic stream for errors; presenting them is up to whoever catches the exception.
 * <p>
 * Warnings are printed to the diagnostic stream immediately and, if the compilation has a
 * {@link CompilationSession}, forwarded to it. Warning entry points never throw.
 * <p>
 * A reporter holds no mutable state, so compilation units running on different threads may use
 * their own reporters concurrently.
 */
public class DiagnosticReporter {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticReporter.class);

    static final String WARNING_PREFIX = "warning: ";
    static final String ANSI_WARNING_PREFIX = "\u001B[33mwarning: \u001B[0m";

    private final DiagnosticsSettings settings;
    private final PrintStream out;
    private final CompilationSession session;

    /**
     * Creates a reporter for a compilation with a session.
     * @param settings The process-wide diagnostics settings.
     * @param out The diagnostic stream.
     * @param session The session of the compilation, or {@code null} if there is none.
     */
    public DiagnosticReporter(DiagnosticsSettings settings, PrintStream out, CompilationSession session) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.out = Objects.requireNonNull(out, "out");
        this.session = session;
    }

    /**
     * Creates a reporter for a compilation without a session.
     * @param settings The process-wide diagnostics settings.
     * @param out The diagnostic stream.
     */
    public DiagnosticReporter(DiagnosticsSettings settings, PrintStream out) {
        this(settings, out, null);
    }

    /**
     * Creates a reporter writing to the stream named in the settings.
     * @param settings The process-wide diagnostics settings.
     * @param session The session of the compilation, or {@code null} if there is none.
     * @return The reporter.
     */
    public static DiagnosticReporter create(DiagnosticsSettings settings, CompilationSession session) {
        return new DiagnosticReporter(settings, settings.printStream(), session);
    }

    // region Errors

    /**
     * Raises a compile error for a node, with the message produced by a pass's formatter.
     *
     * @param meta The node metadata, may be {@code null}.
     * @param file The file being compiled.
     * @param formatter The formatter of the reporting pass.
     * @param description The pass-specific description.
     * @param <D> The description type.
     * @throws CompilationException always.
     */
    public <D> void formError(LocationMeta meta, String file, ErrorFormatter<D> formatter, D description) {
        compileError(meta, file, formatter.formatError(description));
    }

    /**
     * Raises a compile error for a node.
     *
     * @param meta The node metadata, may be {@code null}.
     * @param file The file being compiled.
     * @param message The message.
     * @throws CompilationException always.
     */
    public void compileError(LocationMeta meta, String file, String message) {
        SourceLocation location = LocationResolver.resolve(meta, file);
        raise(location.lineNumber(), location.fileName(), DiagnosticKind.COMPILE_ERROR, message);
    }

    /**
     * Raises a compile error for a node with a message built from a {@link String#format} pattern.
     *
     * @param meta The node metadata, may be {@code null}.
     * @param file The file being compiled.
     * @param format The message pattern.
     * @param args The pattern arguments.
     * @throws CompilationException always.
     */
    public void compileError(LocationMeta meta, String file, String format, Object... args) {
        compileError(meta, file, String.format(Locale.ROOT, format, args));
    }

    /**
     * Raises the diagnostic for a raw lexer or parser failure.
     *
     * @param line The line of the failure, {@code null} if unknown.
     * @param file The file being parsed.
     * @param prefix The error text the token is appended to.
     * @param token The offending token, empty if the input ended.
     * @throws CompilationException always.
     */
    public void parseError(Integer line, String file, String prefix, String token) {
        parseError(line, file, ErrorPrefix.of(prefix), token);
    }

    /**
     * Raises the diagnostic for a raw lexer or parser failure.
     *
     * @param line The line of the failure, {@code null} if unknown.
     * @param file The file being parsed.
     * @param prefix The error text, or the prefix and suffix the token is inserted between.
     * @param token The offending token, empty if the input ended.
     * @throws CompilationException always.
     * @throws org.corvid.compiler.frontend.term.TermDecodingException if a structured token is malformed.
     */
    public void parseError(Integer line, String file, ErrorPrefix prefix, String token) {
        Diagnostic diagnostic = ParseErrorNormalizer.normalize(lineOrZero(line), file, new RawErrorFragment(prefix, token));
        raise(diagnostic);
    }

    /**
     * Raises a diagnostic.
     *
     * @param line The line, {@code null} if unknown.
     * @param file The file.
     * @param kind The kind of diagnostic.
     * @param message The message.
     * @throws CompilationException always.
     */
    public void raise(Integer line, String file, DiagnosticKind kind, String message) {
        raise(new Diagnostic(kind, message, file, lineOrZero(line)));
    }

    private void raise(Diagnostic diagnostic) {
        LOG.debug("Raising {} at {}: {}", diagnostic.kind().displayName(), diagnostic.location(), diagnostic.message());
        CompilationException exception = new CompilationException(diagnostic);
        exception.setStackTrace(callerFrames(exception.getStackTrace()));
        throw exception;
    }

    private static StackTraceElement[] callerFrames(StackTraceElement[] trace) {
        String ownClass = DiagnosticReporter.class.getName();
        int first = 0;
        while (first < trace.length && ownClass.equals(trace[first].getClassName())) {
            first++;
        }
        return Arrays.copyOfRange(trace, first, trace.length);
    }

    // endregion

    // region Warnings

    /**
     * Reports a warning for a node, with the message produced by a pass's formatter.
     *
     * @param meta The node metadata, may be {@code null}.
     * @param file The file being compiled.
     * @param formatter The formatter of the reporting pass.
     * @param description The pass-specific description.
     * @param <D> The description type.
     */
    public <D> void formWarn(LocationMeta meta, String file, ErrorFormatter<D> formatter, D description) {
        SourceLocation location = LocationResolver.resolve(meta, file);
        warn(location.lineNumber(), location.fileName(), formatter.formatError(description));
    }

    /**
     * Reports a located warning. The session, if any, receives a {@link WarningEvent}; the warning is
     * then printed followed by an indented {@code file[:line]} line and a blank line.
     *
     * @param line The line, {@code null} if unknown.
     * @param file The file.
     * @param text The warning text.
     */
    public void warn(Integer line, String file, String text) {
        int resolvedLine = lineOrZero(line);
        if (session != null) {
            WarningEvent event = new WarningEvent(file, resolvedLine, text);
            notifySession(() -> session.notifyWarning(event));
        }
        String location = new SourceLocation(SourcePaths.relativeToCwd(file), resolvedLine).describe();
        warn(text + "\n  " + location + "\n");
    }

    /**
     * Reports a warning without a location. The session, if any, has its warning count incremented.
     *
     * @param text The warning text.
     */
    public void warn(String text) {
        if (session != null) {
            notifySession(session::registerWarning);
        }
        String prefix = settings.ansiEnabled() ? ANSI_WARNING_PREFIX : WARNING_PREFIX;
        out.print(prefix + text + "\n");
        out.flush();
    }

    private void notifySession(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            LOG.warn("Compilation session rejected a warning notification: {}", e.getMessage(), e);
        }
    }

    // endregion

    private static int lineOrZero(Integer line) {
        if (line == null) {
            return SourceLocation.NO_LINE;
        }
        if (line < 0) {
            throw new IllegalArgumentException("Line number must not be negative: " + line);
        }
        return line;
    }
}
