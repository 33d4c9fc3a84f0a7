package org.tabbit.runner;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Striped;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes writes per tournament and per round.
 * Rounds of different tournaments, and different rounds of one tournament, proceed in parallel.
 * Creating or deleting a tournament takes a single registry lock, since it changes the set of ids.
 */
public class TournamentLocks {

    private final Striped<Lock> stripes;
    private final Lock registry = new ReentrantLock();

    public TournamentLocks() {
        this(64);
    }

    public TournamentLocks(int stripeCount) {
        this.stripes = Striped.lazyWeakLock(stripeCount);
    }

    /**
     * Runs {@code action} holding the lock over the set of tournament ids.
     */
    public <T> T withRegistry(Supplier<T> action) {
        return with(registry, action);
    }

    /**
     * Runs {@code action} holding the lock for the tournament's registration data and round list.
     */
    public <T> T withTournament(String tournamentId, Supplier<T> action) {
        return with(stripes.get(tournamentId), action);
    }

    /**
     * Runs {@code action} holding the lock for one round of a tournament.
     */
    public <T> T withRound(String tournamentId, int sequence, Supplier<T> action) {
        return with(stripes.get(tournamentId + "#" + sequence), action);
    }

    /**
     * Runs {@code action} holding both the tournament lock and the lock for one of its rounds.
     * The two are taken in stripe order, so callers cannot deadlock each other.
     */
    public <T> T withTournamentAndRound(String tournamentId, int sequence, Supplier<T> action) {
        List<Lock> ordered = new ArrayList<>();
        for (Lock lock : stripes.bulkGet(List.of(tournamentId, tournamentId + "#" + sequence))) {
            if (!ordered.contains(lock)) {
                ordered.add(lock);
            }
        }
        ordered.forEach(Lock::lock);
        try {
            return action.get();
        } finally {
            for (Lock lock : Lists.reverse(ordered)) {
                lock.unlock();
            }
        }
    }

    private static <T> T with(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
