package com.paircraft.engine.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paircraft.engine.config.ObjectMapperFactory;
import com.paircraft.engine.model.TournamentState;
import com.paircraft.engine.pairing.PairingOutcome;
import com.paircraft.engine.tiebreak.RankedStanding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/**
 * Writes generated rounds, the updated tournament snapshot and standings to an output directory.
 * Every file is written to a temporary sibling first and moved into place atomically.
 */
public class RoundFileWriter {

    static final String STATE_FILE = "tournament.json";
    static final String STANDINGS_FILE = "standings.json";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public RoundFileWriter(Path outputDir) {
        this(outputDir, ObjectMapperFactory.create());
    }

    public RoundFileWriter(Path outputDir, ObjectMapper objectMapper) {
        this.outputDir = outputDir;
        this.objectMapper = objectMapper;
    }

    /**
     * Writes a round-NN.json file with the pairings, deviations and acceleration decisions.
     */
    public Path writeRound(PairingOutcome outcome) throws IOException {
        return write(roundFileName(outcome.round()), outcome);
    }

    public Path writeState(TournamentState state) throws IOException {
        return write(STATE_FILE, state);
    }

    public Path writeStandings(Map<String, List<RankedStanding>> standings) throws IOException {
        return write(STANDINGS_FILE, standings);
    }

    public boolean roundExists(int roundNumber) {
        return Files.exists(outputDir.resolve(roundFileName(roundNumber)));
    }

    static String roundFileName(int roundNumber) {
        return String.format("round-%02d.json", roundNumber);
    }

    private Path write(String filename, Object value) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(filename);
        Path temp = outputDir.resolve(filename + ".tmp");
        objectMapper.writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }
}
