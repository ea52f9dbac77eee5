package com.vcdcli;

import com.vcdcli.cli.CommandExitReporter;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.OptionalInt;

@SpringBootApplication
public class VcdCliApplication {

	public static void main(String[] args) {
        System.exit(run(new SpringApplication(VcdCliApplication.class), args));
	}

    /**
     * Runs the shell and returns the process exit status. A failed command ends the run with an
     * exception carrying its exit code; its message has already been written to stderr.
     */
    static int run(SpringApplication app, String... args) {
        app.setWebApplicationType(WebApplicationType.NONE);
        try {
            return SpringApplication.exit(app.run(args));
        } catch (RuntimeException e) {
            OptionalInt exitCode = CommandExitReporter.exitCodeOf(e);
            if (exitCode.isEmpty()) {
                throw e;
            }
            return exitCode.getAsInt();
        }
    }
}
