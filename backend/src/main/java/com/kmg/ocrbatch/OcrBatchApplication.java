package com.kmg.ocrbatch;

import com.kmg.ocrbatch.cli.CliArguments;
import com.kmg.ocrbatch.config.OcrBatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point. {@code cli ...} runs one batch from the command line; anything else (or {@code api}) starts the
 * HTTP service.
 */
@SpringBootApplication
@EnableConfigurationProperties(OcrBatchProperties.class)
public class OcrBatchApplication {
    public static void main(String[] args) {
        if (args.length > 0 && "cli".equals(args[0])) {
            ConfigurableApplicationContext context = new SpringApplicationBuilder(OcrBatchApplication.class)
                    .web(WebApplicationType.NONE)
                    .properties("ocr.mode=cli")
                    .run(CliArguments.toSpringArgs(Arrays.copyOfRange(args, 1, args.length)));
            System.exit(SpringApplication.exit(context));
        }

        String[] apiArgs = args.length > 0 && "api".equals(args[0])
                ? Arrays.copyOfRange(args, 1, args.length)
                : args;
        SpringApplication.run(OcrBatchApplication.class, apiArgs);
    }
}
