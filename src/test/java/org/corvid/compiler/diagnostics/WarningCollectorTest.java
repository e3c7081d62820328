package org.corvid.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class WarningCollectorTest {

    @Test
    void collectsLocatedWarningsInArrivalOrder() {
        WarningCollector collector = new WarningCollector();

        collector.notifyWarning(new WarningEvent("lib/a.ex", 3, "unused variable x"));
        collector.notifyWarning(new WarningEvent("lib/b.ex", 0, "unused module attribute"));

        assertThat(collector.getWarnings()).extracting(WarningEvent::fileName).containsExactly("lib/a.ex", "lib/b.ex");
        assertThat(collector.summary()).isEqualTo("lib/a.ex:3: unused variable x\nlib/b.ex: unused module attribute");
        assertThat(collector.hasWarnings()).isFalse();
    }

    @Test
    void countsRegisteredWarnings() {
        WarningCollector collector = new WarningCollector();

        collector.registerWarning();
        collector.registerWarning();

        assertThat(collector.warningCount()).isEqualTo(2);
        assertThat(collector.hasWarnings()).isTrue();
        assertThat(collector.getWarnings()).isEmpty();
    }

    @Test
    void reportersOnSeveralThreadsShareOneCollector() throws Exception {
        WarningCollector collector = new WarningCollector();
        DiagnosticReporter reporter = new DiagnosticReporter(DiagnosticsSettings.DEFAULTS,
                new PrintStream(OutputStream.nullOutputStream()), collector);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int thread = 0; thread < 4; thread++) {
                final int id = thread;
                futures.add(executor.submit(() -> {
                    for (int i = 1; i <= 250; i++) {
                        reporter.warn(i, "lib/t" + id + ".ex", "warning " + i);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(collector.warningCount()).isEqualTo(1000);
        assertThat(collector.getWarnings()).hasSize(1000);
    }
}
