package com.vcdcli.cli.ui;

import com.vcdcli.service.api.ConfirmationPrompt;
import lombok.extern.slf4j.Slf4j;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * A {@link ConfirmationPrompt} that asks on the terminal through JLine.
 * Only {@code y} or {@code yes} (any case) confirms; end of input or Ctrl-C declines.
 */
@Component
@Slf4j
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {

    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_RESET = "\u001B[0m";

    private final LineReader lineReader;

    public ConsoleConfirmationPrompt(@Lazy LineReader lineReader) {
        this.lineReader = lineReader;
    }

    @Override
    public boolean confirm(String prompt) {
        try {
            String answer = lineReader.readLine(ANSI_CYAN + prompt + " [y/N]: " + ANSI_RESET);
            if (answer == null) {
                return false;
            }
            String trimmed = answer.trim();
            return "y".equalsIgnoreCase(trimmed) || "yes".equalsIgnoreCase(trimmed);
        } catch (EndOfFileException | UserInterruptException e) {
            log.debug("Confirmation prompt closed without an answer: {}", e.toString());
            return false;
        }
    }
}
