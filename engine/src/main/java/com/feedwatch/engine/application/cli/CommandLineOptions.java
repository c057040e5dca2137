package com.feedwatch.engine.application.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.DefaultApplicationArguments;

/**
 * {@code --config=<file> [--log-dir=<dir>] [--verbose]}. Other arguments are passed to Spring
 * unchanged, so any {@code --feedwatch.*} property may also be given on the command line.
 */
public record CommandLineOptions(String config, String logDir, boolean verbose) {

    public static final String USAGE = "Usage: feedwatch --config=<file.yml> [--log-dir=<dir>] [--verbose]";

    public static Optional<CommandLineOptions> parse(String... args) {
        var arguments = new DefaultApplicationArguments(args);
        var config = first(arguments.getOptionValues("config"));
        if (config == null || config.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new CommandLineOptions(
                config, first(arguments.getOptionValues("log-dir")), arguments.containsOption("verbose")));
    }

    public String[] toSpringArguments(String... args) {
        List<String> result = new ArrayList<>(List.of(args));
        result.add("--spring.config.import=file:" + config);
        if (logDir != null && !logDir.isBlank()) {
            result.add("--logging.file.path=" + logDir);
        }
        if (verbose) {
            result.add("--logging.level.com.feedwatch=DEBUG");
        }
        return result.toArray(String[]::new);
    }

    private static String first(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
