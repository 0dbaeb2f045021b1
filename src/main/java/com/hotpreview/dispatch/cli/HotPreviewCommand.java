package com.hotpreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for HotPreview.
 */
@Command(
        name = "hotpreview",
        mixinStandardHelpOptions = true,
        version = "HotPreview 0.1.0",
        description = "Hot-reloading per-project development preview server",
        subcommands = {
                ServeCommand.class,
                ProjectsCommand.class,
                RegisterCommand.class,
                UnregisterCommand.class,
                RebuildCommand.class,
                WatchCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HotPreviewCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
