package com.paircraft.engine.service;

import com.google.common.util.concurrent.Striped;
import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.config.PairingConfigValidator;
import com.paircraft.engine.config.TiebreakConfig;
import com.paircraft.engine.error.DataIntegrityException;
import com.paircraft.engine.error.ExhaustedSearchException;
import com.paircraft.engine.error.ValidationException;
import com.paircraft.engine.history.HistoryTracker;
import com.paircraft.engine.history.PlayerRegistry;
import com.paircraft.engine.history.TournamentHistory;
import com.paircraft.engine.model.GameResult;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.ResultEntry;
import com.paircraft.engine.model.Round;
import com.paircraft.engine.model.TournamentState;
import com.paircraft.engine.pairing.Deviation;
import com.paircraft.engine.pairing.PairingGenerator;
import com.paircraft.engine.pairing.PairingGenerators;
import com.paircraft.engine.pairing.PairingOutcome;
import com.paircraft.engine.pairing.PairingStatus;
import com.paircraft.engine.pairing.SearchBudget;
import com.paircraft.engine.pairing.SectionInput;
import com.paircraft.engine.pairing.SectionPairing;
import com.paircraft.engine.team.TeamAggregator;
import com.paircraft.engine.team.TeamStanding;
import com.paircraft.engine.tiebreak.RankedStanding;
import com.paircraft.engine.tiebreak.TiebreakCalculator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.stream.IntStream;

/**
 * Entry point for pairing, result recording, corrections and standings.
 *
 * <p>Every operation works on a snapshot and returns a new one; nothing here stores tournaments.
 * Pairing, recording and corrections are serialized per tournament id. Standings are read-only
 * and computed for all sections in parallel.
 *
 * <p>A history that fails to replay halts pairing for that tournament until
 * {@link #resolveIntegrity(String)} is called or a correction replays cleanly.
 */
@Service
public class TournamentEngineService {

    private static final Logger log = LoggerFactory.getLogger(TournamentEngineService.class);

    private final long maxIterations;
    private final long timeBudgetMillis;
    private final ExecutorService standingsExecutor;
    private final Striped<Lock> locks = Striped.lock(64);
    private final Set<String> halted = ConcurrentHashMap.newKeySet();
    private final List<PairingListener> listeners = new CopyOnWriteArrayList<>();

    public TournamentEngineService(
            @Value("${pairing.search.max-iterations:200000}") long maxIterations,
            @Value("${pairing.search.time-budget-ms:2000}") long timeBudgetMillis,
            @Value("${pairing.standings.threads:4}") int standingsThreads) {
        this.maxIterations = maxIterations;
        this.timeBudgetMillis = timeBudgetMillis;
        this.standingsExecutor = Executors.newFixedThreadPool(Math.max(1, standingsThreads));
    }

    public void registerListener(PairingListener listener) {
        listeners.add(listener);
    }

    /**
     * Pairs the next round of every section.
     *
     * @throws com.paircraft.engine.error.InvalidConfigurationException for a bad configuration
     * @throws ValidationException      if {@code roundNumber} is not the next round or the previous round is pending
     * @throws DataIntegrityException   if the history does not replay or the tournament is halted
     * @throws ExhaustedSearchException if best-effort fallback is disabled and some rule had to be broken
     */
    public PairingOutcome generatePairings(TournamentState state, int roundNumber, PairingConfig config) {
        PairingConfigValidator.validate(config);
        PairingOutcome outcome;
        Lock lock = locks.get(state.id());
        lock.lock();
        try {
            outcome = generate(state, roundNumber, config);
        } finally {
            lock.unlock();
        }
        if (!config.bestEffortFallback() && config.method().isSwiss() && outcome.status() == PairingStatus.BEST_EFFORT) {
            throw new ExhaustedSearchException("Round " + roundNumber + " of " + state.id()
                + " could not be paired without " + outcome.deviations().size() + " rule deviation(s)", outcome);
        }
        notifyListeners(state.id(), outcome);
        return outcome;
    }

    private PairingOutcome generate(TournamentState state, int roundNumber, PairingConfig config) {
        if (halted.contains(state.id())) {
            throw new DataIntegrityException("Pairing for tournament " + state.id()
                + " is halted until its history is corrected");
        }
        int expected = state.rounds().size() + 1;
        if (roundNumber != expected) {
            throw new ValidationException("Tournament " + state.id() + " can only pair round " + expected
                + ", not round " + roundNumber);
        }
        if (roundNumber > config.rounds()) {
            throw new ValidationException("Tournament " + state.id() + " is planned for " + config.rounds()
                + " rounds; round " + roundNumber + " cannot be paired");
        }
        state.round(roundNumber - 1).ifPresent(previous -> {
            if (!previous.isComplete()) {
                throw new ValidationException("Round " + previous.number() + " of " + state.id()
                    + " still has pending results");
            }
        });

        TournamentHistory history = replay(state);
        PlayerRegistry registry = history.registry();
        PairingGenerator generator = PairingGenerators.forMethod(config.method());
        List<SectionPairing> sections = new ArrayList<>();
        for (String section : registry.sections()) {
            SectionInput input = new SectionInput(section, roundNumber, registry.section(section),
                registry.teamsInSection(section), state, history, config,
                new SearchBudget(maxIterations, timeBudgetMillis));
            sections.add(generator.generate(input));
        }
        PairingOutcome outcome = PairingOutcome.combine(state.id(), roundNumber, sections);

        log.info("Tournament {} round {} paired with {}: {} boards in {} sections, status {}", state.id(),
            roundNumber, config.method().key(), outcome.pairings().size(), sections.size(), outcome.status());
        for (Deviation deviation : outcome.deviations()) {
            log.warn("Tournament {} round {} section {}: {} ({})", state.id(), roundNumber, deviation.section(),
                deviation.kind(), deviation.message());
        }
        return outcome;
    }

    /**
     * Applies results to a round that is still open. Either every entry is applied or none is.
     *
     * @throws ValidationException for an unknown round or pairing, a bye, a game that already
     *                             has a result, or a pending or bye result
     */
    public TournamentState recordResults(TournamentState state, int roundNumber, List<ResultEntry> results) {
        Lock lock = locks.get(state.id());
        lock.lock();
        try {
            Round round = state.round(roundNumber)
                .orElseThrow(() -> new ValidationException("Round " + roundNumber + " does not exist in " + state.id()));
            if (round.isComplete()) {
                throw new ValidationException("Round " + roundNumber + " of " + state.id()
                    + " is finalized; use a correction to change it");
            }
            Set<String> seen = new HashSet<>();
            Round updated = round;
            for (ResultEntry entry : results) {
                if (!seen.add(entry.pairingId())) {
                    throw new ValidationException("Pairing " + entry.pairingId() + " appears twice in the results");
                }
                Pairing pairing = gameFor(round, entry.pairingId());
                if (!pairing.isPending()) {
                    throw new ValidationException("Pairing " + pairing.id() + " already has result "
                        + pairing.result().notation() + "; use a correction to change it");
                }
                requireDecidedResult(entry.result(), pairing);
                updated = updated.withPairing(pairing.withResult(entry.result()));
            }
            log.info("Tournament {} round {}: recorded {} results, round is now {}", state.id(), roundNumber,
                results.size(), updated.status());
            return state.withRoundReplaced(updated);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Changes one result and replays the whole history. Later rounds are kept.
     */
    public RecomputedState correctResult(TournamentState state, int roundNumber, String pairingId,
                                         GameResult newResult) {
        return correctResult(state, roundNumber, pairingId, newResult, null);
    }

    /**
     * Changes one result and replays the whole history. With a configuration, a later round that
     * has no recorded results yet is discarded and paired again from the corrected history.
     */
    public RecomputedState correctResult(TournamentState state, int roundNumber, String pairingId,
                                         GameResult newResult, PairingConfig config) {
        if (config != null) {
            PairingConfigValidator.validate(config);
        }
        List<PairingOutcome> regenerated = new ArrayList<>();
        RecomputedState recomputed;
        Lock lock = locks.get(state.id());
        lock.lock();
        try {
            Round round = state.round(roundNumber)
                .orElseThrow(() -> new ValidationException("Round " + roundNumber + " does not exist in " + state.id()));
            Pairing pairing = gameFor(round, pairingId);
            requireDecidedResult(newResult, pairing);
            TournamentState corrected = state.withRoundReplaced(round.withPairing(pairing.withResult(newResult)));

            replay(corrected);
            if (halted.remove(state.id())) {
                log.info("Tournament {} history replays cleanly after correction; pairing resumed", state.id());
            }

            int lastRound = corrected.rounds().size();
            List<Integer> regeneratedRounds = new ArrayList<>();
            if (config != null && lastRound > roundNumber
                    && !corrected.rounds().get(lastRound - 1).hasRecordedResults()) {
                corrected = corrected.truncatedAfter(lastRound - 1);
                PairingOutcome outcome = generate(corrected, lastRound, config);
                corrected = corrected.withRound(outcome.toRound());
                regenerated.add(outcome);
                regeneratedRounds.add(lastRound);
            }
            List<Integer> affected = IntStream.rangeClosed(roundNumber, lastRound).boxed().toList();
            log.info("Tournament {} round {} pairing {} corrected to {}; rounds {} recomputed, {} regenerated",
                state.id(), roundNumber, pairingId, newResult.notation(), affected, regeneratedRounds);
            recomputed = new RecomputedState(corrected, affected, regeneratedRounds);
        } finally {
            lock.unlock();
        }
        regenerated.forEach(outcome -> notifyListeners(state.id(), outcome));
        return recomputed;
    }

    /**
     * Standings of one section.
     *
     * @throws ValidationException if the section has no players
     */
    public List<RankedStanding> computeStandings(TournamentState state, String section, TiebreakConfig config) {
        return TiebreakCalculator.compute(state, replay(state), section, config);
    }

    /**
     * Standings of every section, keyed by section name in sorted order.
     */
    public Map<String, List<RankedStanding>> computeAllStandings(TournamentState state, TiebreakConfig config) {
        TournamentHistory history = replay(state);
        Map<String, Future<List<RankedStanding>>> futures = new LinkedHashMap<>();
        for (String section : history.registry().sections()) {
            futures.put(section, standingsExecutor.submit(
                () -> TiebreakCalculator.compute(state, history, section, config)));
        }
        Map<String, List<RankedStanding>> standings = new LinkedHashMap<>();
        for (Map.Entry<String, Future<List<RankedStanding>>> entry : futures.entrySet()) {
            try {
                standings.put(entry.getKey(), entry.getValue().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while computing standings for " + state.id(), e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Standings for section " + entry.getKey() + " failed", e.getCause());
            }
        }
        return standings;
    }

    public List<TeamStanding> computeTeamStandings(TournamentState state, TiebreakConfig config) {
        return TeamAggregator.standings(state, replay(state), config);
    }

    /**
     * Lifts a data-integrity halt after an administrator has repaired the history.
     */
    public void resolveIntegrity(String tournamentId) {
        if (halted.remove(tournamentId)) {
            log.info("Tournament {}: integrity halt cleared", tournamentId);
        }
    }

    public boolean isHalted(String tournamentId) {
        return halted.contains(tournamentId);
    }

    private TournamentHistory replay(TournamentState state) {
        try {
            return HistoryTracker.replay(state);
        } catch (DataIntegrityException e) {
            halted.add(state.id());
            log.warn("Tournament {} halted: {}", state.id(), e.getMessage());
            throw e;
        }
    }

    private static Pairing gameFor(Round round, String pairingId) {
        Pairing pairing = round.pairing(pairingId)
            .orElseThrow(() -> new ValidationException("Round " + round.number() + " has no pairing " + pairingId));
        if (pairing.isBye()) {
            throw new ValidationException("Pairing " + pairingId + " is a bye and takes no result");
        }
        return pairing;
    }

    private static void requireDecidedResult(GameResult result, Pairing pairing) {
        if (result == null || result == GameResult.PENDING || result == GameResult.BYE) {
            throw new ValidationException("Result " + result + " cannot be recorded on game " + pairing.id());
        }
    }

    private void notifyListeners(String tournamentId, PairingOutcome outcome) {
        for (PairingListener listener : listeners) {
            try {
                listener.onPairingsGenerated(tournamentId, outcome);
            } catch (RuntimeException e) {
                // the round stands even when a listener fails
                log.warn("Pairing listener failed for tournament {} round {}: {}", tournamentId,
                    outcome.round(), e.getMessage(), e);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        standingsExecutor.shutdown();
        try {
            if (!standingsExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                standingsExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            standingsExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
