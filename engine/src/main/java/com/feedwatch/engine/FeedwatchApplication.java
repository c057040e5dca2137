package com.feedwatch.engine;

import com.feedwatch.engine.application.cli.CommandLineOptions;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class FeedwatchApplication {

    public static void main(String[] args) {
        var options = CommandLineOptions.parse(args);
        if (options.isEmpty()) {
            System.err.println(CommandLineOptions.USAGE);
            System.exit(2);
        }
        new SpringApplicationBuilder(FeedwatchApplication.class)
                .web(WebApplicationType.NONE)
                .run(options.get().toSpringArguments(args));
    }
}
