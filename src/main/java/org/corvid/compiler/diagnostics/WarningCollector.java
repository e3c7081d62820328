package org.corvid.compiler.diagnostics;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * A {@link CompilationSession} that collects the warnings of one compilation in memory.
 * <p>
 * Notifications are appended to a lock-free queue so reporting threads never wait on readers.
 */
public class WarningCollector implements CompilationSession {

    private final Queue<WarningEvent> warnings = new ConcurrentLinkedQueue<>();
    private final AtomicInteger registeredWarnings = new AtomicInteger();

    @Override
    public void notifyWarning(WarningEvent event) {
        warnings.offer(event);
    }

    @Override
    public void registerWarning() {
        registeredWarnings.incrementAndGet();
    }

    /**
     * Returns a snapshot of the located warnings received so far, in arrival order.
     *
     * @return An unmodifiable list of warnings.
     */
    public List<WarningEvent> getWarnings() {
        return List.copyOf(warnings);
    }

    /**
     * @return The number of warnings printed during the compilation.
     */
    public int warningCount() {
        return registeredWarnings.get();
    }

    public boolean hasWarnings() {
        return warningCount() > 0;
    }

    /**
     * Returns all located warnings as a single, formatted string.
     *
     * @return One {@code file[:line]: text} line per warning.
     */
    public String summary() {
        return warnings.stream()
                .map(w -> w.location().describe() + ": " + w.text())
                .collect(Collectors.joining("\n"));
    }
}
