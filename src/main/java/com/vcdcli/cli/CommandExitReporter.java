package com.vcdcli.cli;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringBootExceptionReporter;

import java.util.OptionalInt;

/**
 * Keeps Spring Boot from logging a failed single-shot command as a failed application start.
 * <p>
 * Spring Shell ends a non-interactive run by throwing an exception that carries the command's
 * exit code. By then {@link CommandFailureResolver} (or the shell itself, for parse errors) has
 * already written the error line, so the exception is reported as handled. Registered in
 * {@code META-INF/spring.factories}.
 */
public class CommandExitReporter implements SpringBootExceptionReporter {

    @Override
    public boolean reportException(Throwable failure) {
        return exitCodeOf(failure).isPresent();
    }

    /**
     * Finds the exit code carried by a failure or one of its causes.
     */
    public static OptionalInt exitCodeOf(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof ExitCodeGenerator generator) {
                return OptionalInt.of(generator.getExitCode());
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return OptionalInt.empty();
    }
}
