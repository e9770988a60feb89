package com.lsnp.peer;

import com.lsnp.peer.command.RunCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "lsnp",
        description = "Local Social Networking Protocol peer",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                RunCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
