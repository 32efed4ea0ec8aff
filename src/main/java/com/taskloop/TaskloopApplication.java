package com.taskloop;

import com.taskloop.dispatch.cli.CliFailures;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class TaskloopApplication {

    public static final String VERSION = "0.1.0";

    /** Exit status for configuration and credential errors raised while the context starts. */
    private static final int EXIT_STARTUP_FAILURE = 2;

    public static void main(String[] args) {
        // CLI-only: no web server, stdout reserved for command output
        SpringApplicationBuilder builder = new SpringApplicationBuilder(TaskloopApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                );

        ApplicationContext ctx;
        try {
            ctx = builder.run(args);
        } catch (RuntimeException e) {
            System.err.println("taskloop: " + CliFailures.describe(e));
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }

        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
