package com.vcdcli.cli;

import com.vcdcli.exception.CommandFailedException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.shell.command.CommandExceptionResolver;
import org.springframework.shell.command.CommandHandlingResult;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * The single place where a failed network command becomes output and an exit status: the
 * message goes to the error stream as one line and the exit code follows its
 * {@link com.vcdcli.exception.ErrorKind}. Other exceptions are left to the shell's defaults.
 */
@Component
public class CommandFailureResolver implements CommandExceptionResolver {

    private final OutcomeRenderer renderer;
    private final PrintStream errorStream;

    @Autowired
    public CommandFailureResolver(OutcomeRenderer renderer) {
        this(renderer, System.err);
    }

    CommandFailureResolver(OutcomeRenderer renderer, PrintStream errorStream) {
        this.renderer = renderer;
        this.errorStream = errorStream;
    }

    @Override
    public CommandHandlingResult resolve(Exception ex) {
        if (ex instanceof CommandFailedException failure) {
            errorStream.println(renderer.renderError(failure.getMessage()));
            errorStream.flush();
            return CommandHandlingResult.of("", failure.getKind().exitCode());
        }
        return null;
    }
}
