package com.paircraft.engine.runner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paircraft.engine.config.ConfigRequestValidator;
import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.config.TiebreakConfig;
import com.paircraft.engine.config.dto.PairingConfigRequest;
import com.paircraft.engine.error.ExhaustedSearchException;
import com.paircraft.engine.error.PairingEngineException;
import com.paircraft.engine.model.GameResult;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.ResultEntry;
import com.paircraft.engine.model.TournamentState;
import com.paircraft.engine.pairing.Deviation;
import com.paircraft.engine.pairing.PairingOutcome;
import com.paircraft.engine.service.RecomputedState;
import com.paircraft.engine.service.TournamentEngineService;
import com.paircraft.engine.team.TeamStanding;
import com.paircraft.engine.tiebreak.RankedStanding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line driver. Reads a tournament snapshot (and settings) from JSON, runs one engine
 * operation and writes the results into an output directory.
 *
 * <p>Invocation:
 * <pre>
 * java -jar paircraft-pairing-engine.jar pair --state tournament.json --config settings.json --output ./out
 * java -jar paircraft-pairing-engine.jar record --state out/tournament.json --round 1 --results results.json
 * java -jar paircraft-pairing-engine.jar correct --state out/tournament.json --round 1 --pairing Open-R1-B2 --result 0-1
 * java -jar paircraft-pairing-engine.jar standings --state out/tournament.json --tiebreaks buchholz,sonnebornBerger
 * </pre>
 */
@Component
public class PairingRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PairingRunner.class);

    enum Command { PAIR, RECORD, CORRECT, STANDINGS }

    /**
     * Parsed command line.
     */
    record Options(Command command, Path state, Path config, Path output, Integer round, Path results,
                   String pairingId, String result, List<String> tiebreaks, String section) {}

    private final TournamentEngineService engine;
    private final ConfigRequestValidator configValidator;
    private final ObjectMapper objectMapper;
    private int exitCode;

    public PairingRunner(TournamentEngineService engine, ConfigRequestValidator configValidator,
                         ObjectMapper objectMapper) {
        this.engine = engine;
        this.configValidator = configValidator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            printUsage();
            exitCode = 1;
            return;
        }
        try {
            Options options = parseArgs(args);
            switch (options.command()) {
                case PAIR -> pair(options);
                case RECORD -> record(options);
                case CORRECT -> correct(options);
                case STANDINGS -> standings(options);
            }
        } catch (ExhaustedSearchException e) {
            System.err.println("Pairing needs review: " + e.getMessage());
            printDeviations(e.bestEffort().deviations());
            exitCode = 2;
        } catch (PairingEngineException | IllegalArgumentException | IOException e) {
            log.debug("Command failed", e);
            System.err.println("Failed: " + e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void pair(Options options) throws IOException {
        TournamentState state = readState(options.state());
        PairingConfig config = readConfig(options.config());
        int round = options.round() != null ? options.round() : state.rounds().size() + 1;
        PairingOutcome outcome = engine.generatePairings(state, round, config);

        RoundFileWriter writer = new RoundFileWriter(options.output(), objectMapper);
        if (writer.roundExists(round)) {
            log.warn("Replacing existing {} in {}", RoundFileWriter.roundFileName(round), options.output());
        }
        writer.writeRound(outcome);
        writer.writeState(state.withRound(outcome.toRound()));
        printPairings(outcome);
        printDeviations(outcome.deviations());
        System.out.printf("Round %d %s. Files written to %s%n", round, outcome.status(), options.output());
    }

    private void record(Options options) throws IOException {
        TournamentState state = readState(options.state());
        List<ResultEntry> results = objectMapper.readValue(options.results().toFile(),
            new TypeReference<List<ResultEntry>>() {});
        TournamentState updated = engine.recordResults(state, options.round(), results);
        new RoundFileWriter(options.output(), objectMapper).writeState(updated);
        System.out.printf("Recorded %d results for round %d (%s)%n", results.size(), options.round(),
            updated.round(options.round()).orElseThrow().status());
    }

    private void correct(Options options) throws IOException {
        TournamentState state = readState(options.state());
        PairingConfig config = options.config() != null ? readConfig(options.config()) : null;
        RecomputedState recomputed = engine.correctResult(state, options.round(), options.pairingId(),
            GameResult.fromNotation(options.result()), config);
        new RoundFileWriter(options.output(), objectMapper).writeState(recomputed.state());
        System.out.printf("Corrected %s to %s; recomputed rounds %s, regenerated rounds %s%n",
            options.pairingId(), options.result(), recomputed.affectedRounds(), recomputed.regeneratedRounds());
    }

    private void standings(Options options) throws IOException {
        TournamentState state = readState(options.state());
        TiebreakConfig tiebreaks;
        if (options.config() != null) {
            tiebreaks = readConfig(options.config()).tiebreaks();
        } else if (!options.tiebreaks().isEmpty()) {
            tiebreaks = TiebreakConfig.fromKeys(options.tiebreaks());
        } else {
            tiebreaks = TiebreakConfig.defaults();
        }

        Map<String, List<RankedStanding>> standings;
        if (options.section() != null) {
            standings = new LinkedHashMap<>();
            standings.put(options.section(), engine.computeStandings(state, options.section(), tiebreaks));
        } else {
            standings = engine.computeAllStandings(state, tiebreaks);
        }
        Path written = new RoundFileWriter(options.output(), objectMapper).writeStandings(standings);
        standings.forEach(this::printStandings);
        if (!state.teams().isEmpty()) {
            printTeamStandings(engine.computeTeamStandings(state, tiebreaks));
        }
        System.out.printf("Standings written to %s%n", written);
    }

    private TournamentState readState(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), TournamentState.class);
    }

    private PairingConfig readConfig(Path path) throws IOException {
        return configValidator.toPairingConfig(objectMapper.readValue(path.toFile(), PairingConfigRequest.class));
    }

    /**
     * Parses CLI arguments.
     *
     * @throws IllegalArgumentException if the command is unknown or required arguments are missing
     */
    static Options parseArgs(String[] args) {
        Command command;
        try {
            command = Command.valueOf(args[0].toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown command: " + args[0], e);
        }
        Path state = null;
        Path config = null;
        Path output = Path.of("./data");
        Integer round = null;
        Path results = null;
        String pairingId = null;
        String result = null;
        List<String> tiebreaks = new ArrayList<>();
        String section = null;

        for (int i = 1; i < args.length; i++) {
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + args[i]);
            }
            switch (args[i]) {
                case "--state" -> state = Path.of(args[++i]);
                case "--config" -> config = Path.of(args[++i]);
                case "--output" -> output = Path.of(args[++i]);
                case "--round" -> round = Integer.parseInt(args[++i]);
                case "--results" -> results = Path.of(args[++i]);
                case "--pairing" -> pairingId = args[++i];
                case "--result" -> result = args[++i];
                case "--tiebreaks" -> tiebreaks.addAll(Arrays.asList(args[++i].split(",")));
                case "--section" -> section = args[++i];
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (state == null) {
            throw new IllegalArgumentException("Missing required argument: --state");
        }
        switch (command) {
            case PAIR -> require(config != null, "pair needs --config");
            case RECORD -> require(round != null && results != null, "record needs --round and --results");
            case CORRECT -> require(round != null && pairingId != null && result != null,
                "correct needs --round, --pairing and --result");
            case STANDINGS -> {
                // everything optional
            }
        }
        return new Options(command, state, config, output, round, results, pairingId, result,
            List.copyOf(tiebreaks), section);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    private static void printPairings(PairingOutcome outcome) {
        System.out.printf("%-6s %-5s %-20s %-20s%n", "Sect.", "Board", "White", "Black");
        for (Pairing pairing : outcome.pairings()) {
            String black = pairing.isBye() ? "BYE (" + pairing.byeType() + ")" : pairing.blackId();
            System.out.printf("%-6s %5d %-20s %-20s%n", pairing.section(), pairing.board(), pairing.whiteId(), black);
        }
    }

    private static void printDeviations(List<Deviation> deviations) {
        for (Deviation deviation : deviations) {
            System.out.printf("  ! %s %s: %s%n", deviation.section(), deviation.kind(), deviation.message());
        }
    }

    private void printStandings(String section, List<RankedStanding> standings) {
        System.out.printf("%nSection %s%n", section);
        System.out.printf("%-5s %-25s %6s %6s  %s%n", "Rank", "Player", "Rating", "Score", "Tiebreaks");
        for (RankedStanding standing : standings) {
            String rank = standing.rank() + (standing.sharedRank() ? "=" : "");
            System.out.printf("%-5s %-25s %6s %6.1f  %s%n", rank, standing.name(),
                standing.rating() == null ? "unr." : standing.rating(), standing.score(), standing.tiebreaks());
        }
    }

    private static void printTeamStandings(List<TeamStanding> standings) {
        System.out.printf("%nTeams%n");
        for (TeamStanding standing : standings) {
            System.out.printf("%-5s %-25s MP %3d  GP %5.1f%n", standing.rank() + (standing.sharedRank() ? "=" : ""),
                standing.name(), standing.matchPoints(), standing.gamePoints());
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar paircraft-pairing-engine.jar <command> --state <file> [options]");
        System.err.println();
        System.err.println("Commands:");
        System.err.println("  pair        Pair the next round            (--config required, --round optional)");
        System.err.println("  record      Record results for a round     (--round, --results required)");
        System.err.println("  correct     Correct one recorded result    (--round, --pairing, --result required)");
        System.err.println("  standings   Compute standings              (--tiebreaks, --section optional)");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --state <file>         Tournament snapshot JSON (required)");
        System.err.println("  --config <file>        Settings JSON with rounds, pairingMethod, tiebreaks ...");
        System.err.println("  --output <dir>         Output directory (default: ./data)");
        System.err.println("  --round <n>            Round number");
        System.err.println("  --results <file>       JSON list of {pairingId, result}");
        System.err.println("  --pairing <id>         Pairing id, e.g. Open-R3-B2");
        System.err.println("  --result <notation>    1-0, 0-1, 1/2-1/2, 1-0F, 0-1F, 0-0F");
        System.err.println("  --tiebreaks <list>     Comma-separated criteria, e.g. buchholz,sonnebornBerger");
        System.err.println("  --section <name>       Only this section");
    }
}
