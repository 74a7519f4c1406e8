package com.kmg.ocrbatch.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits {@code cli} mode arguments between Spring and picocli.
 *
 * <p>Spring property overrides ({@code --logging.file.name=app.log}, {@code --ocr.batch.max-attempts=5}) reach
 * the environment but are hidden from picocli. {@code -l/--log-file} is also forwarded to Spring as
 * {@code logging.file.name}, since the log file must be known before logging starts.</p>
 */
public final class CliArguments {
    static final String LOG_FILE_PROPERTY = "--logging.file.name=";

    private CliArguments() {
    }

    public static String[] toSpringArgs(String[] cliArgs) {
        List<String> springArgs = new ArrayList<>(Arrays.asList(cliArgs));
        for (int i = 0; i < cliArgs.length; i++) {
            String arg = cliArgs[i];
            if ((arg.equals("-l") || arg.equals("--log-file")) && i + 1 < cliArgs.length) {
                springArgs.add(LOG_FILE_PROPERTY + cliArgs[i + 1]);
            } else if (arg.startsWith("--log-file=")) {
                springArgs.add(LOG_FILE_PROPERTY + arg.substring("--log-file=".length()));
            } else if (arg.startsWith("-l=")) {
                springArgs.add(LOG_FILE_PROPERTY + arg.substring(3));
            }
        }
        return springArgs.toArray(String[]::new);
    }

    public static String[] toCommandArgs(String[] sourceArgs) {
        return Arrays.stream(sourceArgs)
                .filter(arg -> !isPropertyOverride(arg))
                .toArray(String[]::new);
    }

    static boolean isPropertyOverride(String arg) {
        if (!arg.startsWith("--")) {
            return false;
        }
        int equals = arg.indexOf('=');
        String name = equals < 0 ? arg.substring(2) : arg.substring(2, equals);
        return name.contains(".");
    }
}
