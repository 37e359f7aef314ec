package org.javai.result.ops;

import java.util.List;
import org.apache.logging.log4j.LogManager;

/**
 * Receives misuse failures caught by {@link MisuseExceptionHandler}.
 */
@FunctionalInterface
public interface MisuseReporter {

    void report(Misuse misuse);

    static MisuseReporter noOp() {
        return misuse -> {};
    }

    /**
     * Sends each misuse to every reporter in order. A reporter that throws is logged and skipped.
     */
    static MisuseReporter composite(MisuseReporter... reporters) {
        List<MisuseReporter> targets = List.of(reporters);
        return misuse -> {
            for (MisuseReporter target : targets) {
                try {
                    target.report(misuse);
                } catch (RuntimeException e) {
                    LogManager.getLogger(MisuseReporter.class)
                            .error("Misuse reporter {} failed", target.getClass().getName(), e);
                }
            }
        };
    }
}
