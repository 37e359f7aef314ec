package org.javai.result.ops;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MisuseReporterTest {

    private static final Misuse MISUSE =
            new Misuse("unwrap", "boom", "java.lang.String", "main", Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void composite_reportsToEachInOrder() {
        List<String> calls = new ArrayList<>();
        MisuseReporter composite = MisuseReporter.composite(
                m -> calls.add("first:" + m.operation()),
                m -> calls.add("second:" + m.operation()));

        composite.report(MISUSE);

        assertThat(calls).containsExactly("first:unwrap", "second:unwrap");
    }

    @Test
    void composite_failingReporter_doesNotStopOthers() {
        List<Misuse> received = new ArrayList<>();
        MisuseReporter composite = MisuseReporter.composite(
                m -> { throw new IllegalStateException("reporter broken"); },
                received::add);

        assertThatCode(() -> composite.report(MISUSE)).doesNotThrowAnyException();
        assertThat(received).containsExactly(MISUSE);
    }

    @Test
    void noOp_acceptsAnything() {
        assertThatCode(() -> MisuseReporter.noOp().report(MISUSE)).doesNotThrowAnyException();
    }
}
