package com.kmg.ocrbatch.cli;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "ocr.mode", havingValue = "cli")
public class CliRunner implements ApplicationRunner, ExitCodeGenerator {
    private final OcrCliCommand command;
    private int exitCode;

    public CliRunner(OcrCliCommand command) {
        this.command = command;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = command.commandLine().execute(CliArguments.toCommandArgs(args.getSourceArgs()));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
