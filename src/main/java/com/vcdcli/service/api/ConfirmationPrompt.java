package com.vcdcli.service.api;

/**
 * Asks the user to confirm a destructive operation.
 */
public interface ConfirmationPrompt {

    /**
     * @param prompt The question to display.
     * @return {@code true} only for an explicit affirmative answer.
     */
    boolean confirm(String prompt);
}
