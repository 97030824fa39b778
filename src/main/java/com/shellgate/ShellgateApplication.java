package com.shellgate;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class ShellgateApplication {

    public static void main(String[] args) {
        // MCP clients launch the binary with no arguments; that means "serve".
        if (args.length == 0) {
            args = new String[]{"serve"};
        }

        // stdout is the MCP transport in serve mode, so no banner and no web server
        ApplicationContext ctx = new SpringApplicationBuilder(ShellgateApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
