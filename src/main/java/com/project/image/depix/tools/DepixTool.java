package com.project.image.depix.tools;

import com.project.image.depix.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Command-line front end: {@code depix}, {@code pixelate} and {@code show-boxes}.
 * Exit codes: 0 success, 1 runtime failure, 2 rejected input.
 */
@Command(name = "depix-tool",
        mixinStandardHelpOptions = true,
        description = "Recover plaintext from pixelized screenshots.",
        subcommands = {DepixCommand.class, PixelateCommand.class, ShowBoxesCommand.class})
public class DepixTool implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DepixTool.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_INPUT = 2;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new DepixTool());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof InvalidInputException) {
                log.error("Invalid input: {}", ex.getMessage());
                return EXIT_INVALID_INPUT;
            }
            log.error("Error during {}: {}", cmd.getCommandName(), ex.getMessage(), ex);
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
