package com.pmatrix.encoder;

import com.pmatrix.encoder.cli.EncoderCommandRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

/**
 * Runs as an HTTP service by default. When the first argument is a command
 * ({@code emit}, {@code validate}, {@code validate-stream}) the application
 * starts without a web server, executes the command once, and exits with the
 * command's exit code.
 */
@SpringBootApplication
public class EncoderServiceApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(EncoderServiceApplication.class);
        if (EncoderCommandRunner.isCommand(args)) {
            app.setWebApplicationType(WebApplicationType.NONE);
            app.setBannerMode(Banner.Mode.OFF);
            app.setDefaultProperties(Map.of("logging.level.root", "WARN"));
            System.exit(SpringApplication.exit(app.run(args)));
        }
        app.run(args);
    }
}
