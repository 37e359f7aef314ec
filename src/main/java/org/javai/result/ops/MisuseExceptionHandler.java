package org.javai.result.ops;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import org.javai.result.UnwrapException;

/**
 * Reports an {@link UnwrapException} that escapes to the top of a thread, then passes the throwable on.
 *
 * <p>The library never catches its own misuse failures, so they surface here like any other defect,
 * possibly wrapped by application code. The first {@code UnwrapException} in the cause chain is reported.
 * Every throwable, misuse or not, is then forwarded to the delegate handler when there is one.</p>
 *
 * <pre>{@code
 * MisuseExceptionHandler.install(new Log4jMisuseReporter());
 * }</pre>
 */
public final class MisuseExceptionHandler implements UncaughtExceptionHandler {

    private final MisuseReporter reporter;
    private final UncaughtExceptionHandler delegate;

    public MisuseExceptionHandler(MisuseReporter reporter) {
        this(reporter, null);
    }

    /**
     * @param delegate handler that receives every throwable after reporting; may be null
     */
    public MisuseExceptionHandler(MisuseReporter reporter, UncaughtExceptionHandler delegate) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.delegate = delegate;
    }

    /**
     * Makes a new handler the JVM-wide default, delegating to whatever default was installed before.
     */
    public static MisuseExceptionHandler install(MisuseReporter reporter) {
        MisuseExceptionHandler handler =
                new MisuseExceptionHandler(reporter, Thread.getDefaultUncaughtExceptionHandler());
        Thread.setDefaultUncaughtExceptionHandler(handler);
        return handler;
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        UnwrapException misuse = findMisuse(throwable);
        if (misuse != null) {
            reporter.report(Misuse.from(misuse, thread));
        }
        if (delegate != null) {
            delegate.uncaughtException(thread, throwable);
        }
    }

    static UnwrapException findMisuse(Throwable throwable) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = throwable; current != null && visited.add(current); current = current.getCause()) {
            if (current instanceof UnwrapException unwrap) {
                return unwrap;
            }
        }
        return null;
    }
}
