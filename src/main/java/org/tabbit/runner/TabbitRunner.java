package org.tabbit.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tabbit.compute.TabbitException;
import org.tabbit.store.JsonFileTournamentRepository;
import org.tabbit.store.ObjectMapperFactory;
import org.tabbit.store.TournamentNotFoundException;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Command-line access to a tournament data directory.
 *
 * <p>Invocation:
 * <pre>
 * java -cp tabbit.jar org.tabbit.runner.TabbitRunner standings --data ./data --tournament wudc
 * java -cp tabbit.jar org.tabbit.runner.TabbitRunner draw --data ./data --tournament wudc --round 3 --commit
 * </pre>
 *
 * <p>Results are printed to stdout as JSON. Without {@code --commit}, {@code draw} only previews.
 */
public class TabbitRunner {

    /**
     * Parsed command line.
     */
    record CliOptions(String command, Path dataDir, String tournamentId, Integer round, boolean commit) {}

    public static void main(String[] args) {
        int status = execute(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one command and reports failures on {@code err}.
     *
     * @return 0 on success, 1 for a usage error, 2 when the command fails
     */
    static int execute(String[] args, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 1;
        }

        try {
            run(options, out);
            return 0;
        } catch (TabbitException | TournamentNotFoundException | UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    static void run(CliOptions options, PrintStream out) {
        ObjectMapper mapper = ObjectMapperFactory.create();
        JsonFileTournamentRepository repository = new JsonFileTournamentRepository(options.dataDir(), mapper);
        RoundManager rounds = new RoundManager(repository, new TournamentLocks(), RoundEventListener.NONE);

        Object result = switch (options.command()) {
            case "standings" -> rounds.standings(options.tournamentId());
            case "speakers" -> rounds.speakerStandings(options.tournamentId());
            case "history" -> rounds.history(options.tournamentId());
            case "draw" -> options.commit()
                ? rounds.drawRound(options.tournamentId(), options.round())
                : rounds.previewDraw(options.tournamentId(), options.round());
            default -> throw new IllegalArgumentException("Unknown command: " + options.command());
        };

        try {
            out.println(ObjectMapperFactory.prettyWriter(mapper).writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render " + options.command() + " output", e);
        }
    }

    /**
     * Parses CLI arguments.
     *
     * @throws IllegalArgumentException if the command or a required option is missing
     */
    static CliOptions parseArgs(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("Missing command");
        }
        String command = args[0];
        if (!command.equals("standings") && !command.equals("speakers")
            && !command.equals("history") && !command.equals("draw")) {
            throw new IllegalArgumentException("Unknown command: " + command);
        }

        Path dataDir = Path.of("./data");
        String tournamentId = null;
        Integer round = null;
        boolean commit = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--data" -> dataDir = Path.of(value(args, ++i, "--data"));
                case "--tournament" -> tournamentId = value(args, ++i, "--tournament");
                case "--round" -> {
                    String raw = value(args, ++i, "--round");
                    try {
                        round = Integer.parseInt(raw);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--round expects a number, got " + raw, e);
                    }
                }
                case "--commit" -> commit = true;
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (tournamentId == null) {
            throw new IllegalArgumentException("Missing required argument: --tournament");
        }
        if (command.equals("draw") && round == null) {
            throw new IllegalArgumentException("draw requires --round");
        }
        if (commit && !command.equals("draw")) {
            throw new IllegalArgumentException("--commit only applies to draw");
        }
        return new CliOptions(command, dataDir, tournamentId, round, commit);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: TabbitRunner <command> --tournament <id> [options]");
        err.println();
        err.println("Commands:");
        err.println("  standings      Team standings after completed rounds");
        err.println("  speakers       Speaker standings after completed rounds");
        err.println("  history        Pairing, judging and bye history");
        err.println("  draw           Draw and allocate panels for a pending round");
        err.println();
        err.println("Options:");
        err.println("  --data <dir>           Data directory (default: ./data)");
        err.println("  --tournament <id>      Tournament id (required)");
        err.println("  --round <n>            Round sequence (required for draw)");
        err.println("  --commit               Save the draw instead of previewing it");
    }
}
