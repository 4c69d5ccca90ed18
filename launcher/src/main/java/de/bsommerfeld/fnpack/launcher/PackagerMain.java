package de.bsommerfeld.fnpack.launcher;

import picocli.CommandLine;

/**
 * Command line entry point.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@code 0}: archive written</li>
 * <li>{@code 1}: packaging failed, the cause is logged</li>
 * <li>{@code 2}: invalid command line, usage printed</li>
 * </ul>
 */
public final class PackagerMain {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private PackagerMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        return commandLine().execute(args);
    }

    static CommandLine commandLine() {
        return new CommandLine(new PackageCommand())
                .setParameterExceptionHandler((ex, args) -> {
                    CommandLine cmd = ex.getCommandLine();
                    cmd.getErr().println(ex.getMessage());
                    cmd.usage(cmd.getErr());
                    return EXIT_USAGE;
                });
    }
}
