package com.rotalog;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finds the application code that called into the logging facade, skipping the facade's
 * own frames.
 */
final class CallerLocator {

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private final Class<?> facade;

    CallerLocator(Class<?> facade) {
        this.facade = facade;
    }

    /**
     * @return file and line of the first frame outside the facade
     */
    SourceLocation locate() {
        Optional<StackWalker.StackFrame> caller = WALKER.walk(frames -> frames
                .dropWhile(this::isInternal)
                .findFirst());
        return caller.map(CallerLocator::toLocation).orElse(SourceLocation.UNKNOWN);
    }

    /**
     * @return the current thread's stack, starting at the caller of the facade
     */
    String stackTrace() {
        String frames = WALKER.walk(stream -> stream
                .dropWhile(this::isInternal)
                .map(frame -> "\tat " + frame.toStackTraceElement())
                .collect(Collectors.joining("\n")));
        return "Stack trace of thread \"" + Thread.currentThread().getName() + "\":\n" + frames;
    }

    private boolean isInternal(StackWalker.StackFrame frame) {
        Class<?> type = frame.getDeclaringClass();
        return type == CallerLocator.class || type == facade;
    }

    private static SourceLocation toLocation(StackWalker.StackFrame frame) {
        String fileName = frame.getFileName();
        return new SourceLocation(fileName != null ? fileName : SourceLocation.UNKNOWN.fileName(), frame.getLineNumber());
    }
}
