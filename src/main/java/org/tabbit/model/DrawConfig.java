package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Draw and allocation settings of a tournament.
 *
 * <p>JSON input goes through {@link #fromSettings}, so a stored or submitted config that leaves
 * out a setting gets the default for it rather than {@code 0} or {@code false}.
 *
 * @param sidesPerRoom            teams per debate, 2 for two-sided formats and 4 for British Parliamentary
 * @param panelSize               adjudicators per room, chair included
 * @param avoidInstitutionClash   keep teams of the same institution apart
 * @param byePolicy               treatment of leftover teams
 * @param seeding                 placement of ranked teams into rooms
 * @param tieBreak                last standings key
 * @param tieBreakSeed            seed for {@link Seeding#RANDOM} and {@link TieBreak#SEEDED}, or null
 * @param maxSwapDistance         furthest rank distance a conflict swap may reach
 * @param avoidJudgedInstitutions keep adjudicators away from institutions they have judged
 */
public record DrawConfig(
    @JsonProperty("sidesPerRoom") int sidesPerRoom,
    @JsonProperty("panelSize") int panelSize,
    @JsonProperty("avoidInstitutionClash") boolean avoidInstitutionClash,
    @JsonProperty("byePolicy") ByePolicy byePolicy,
    @JsonProperty("seeding") Seeding seeding,
    @JsonProperty("tieBreak") TieBreak tieBreak,
    @JsonProperty("tieBreakSeed") Long tieBreakSeed,
    @JsonProperty("maxSwapDistance") int maxSwapDistance,
    @JsonProperty("avoidJudgedInstitutions") boolean avoidJudgedInstitutions
) {

    public static final int DEFAULT_MAX_SWAP_DISTANCE = 8;

    public DrawConfig {
        byePolicy = byePolicy == null ? ByePolicy.LOWEST_RANK_BYE : byePolicy;
        seeding = seeding == null ? Seeding.ADJACENT : seeding;
        tieBreak = tieBreak == null ? TieBreak.TEAM_ID : tieBreak;
    }

    /**
     * Two-sided debates, single adjudicators, institution clashes avoided.
     */
    public static DrawConfig defaults() {
        return of(2, 1);
    }

    /**
     * Builds a configuration from optional settings; a null setting takes its value from {@link #defaults()}.
     */
    @JsonCreator
    public static DrawConfig fromSettings(
        @JsonProperty("sidesPerRoom") Integer sidesPerRoom,
        @JsonProperty("panelSize") Integer panelSize,
        @JsonProperty("avoidInstitutionClash") Boolean avoidInstitutionClash,
        @JsonProperty("byePolicy") ByePolicy byePolicy,
        @JsonProperty("seeding") Seeding seeding,
        @JsonProperty("tieBreak") TieBreak tieBreak,
        @JsonProperty("tieBreakSeed") Long tieBreakSeed,
        @JsonProperty("maxSwapDistance") Integer maxSwapDistance,
        @JsonProperty("avoidJudgedInstitutions") Boolean avoidJudgedInstitutions) {
        DrawConfig defaults = defaults();
        return new DrawConfig(
            sidesPerRoom != null ? sidesPerRoom : defaults.sidesPerRoom(),
            panelSize != null ? panelSize : defaults.panelSize(),
            avoidInstitutionClash != null ? avoidInstitutionClash : defaults.avoidInstitutionClash(),
            byePolicy,
            seeding,
            tieBreak,
            tieBreakSeed,
            maxSwapDistance != null ? maxSwapDistance : defaults.maxSwapDistance(),
            avoidJudgedInstitutions != null ? avoidJudgedInstitutions : defaults.avoidJudgedInstitutions());
    }

    public static DrawConfig of(int sidesPerRoom, int panelSize) {
        return new DrawConfig(sidesPerRoom, panelSize, true, ByePolicy.LOWEST_RANK_BYE,
            Seeding.ADJACENT, TieBreak.TEAM_ID, null, DEFAULT_MAX_SWAP_DISTANCE, false);
    }

    public DrawConfig withAvoidInstitutionClash(boolean avoid) {
        return new DrawConfig(sidesPerRoom, panelSize, avoid, byePolicy, seeding, tieBreak,
            tieBreakSeed, maxSwapDistance, avoidJudgedInstitutions);
    }

    public DrawConfig withByePolicy(ByePolicy policy) {
        return new DrawConfig(sidesPerRoom, panelSize, avoidInstitutionClash, policy, seeding, tieBreak,
            tieBreakSeed, maxSwapDistance, avoidJudgedInstitutions);
    }

    public DrawConfig withSeeding(Seeding rule) {
        return new DrawConfig(sidesPerRoom, panelSize, avoidInstitutionClash, byePolicy, rule, tieBreak,
            tieBreakSeed, maxSwapDistance, avoidJudgedInstitutions);
    }

    public DrawConfig withTieBreak(TieBreak rule, Long seed) {
        return new DrawConfig(sidesPerRoom, panelSize, avoidInstitutionClash, byePolicy, seeding, rule,
            seed, maxSwapDistance, avoidJudgedInstitutions);
    }

    public DrawConfig withMaxSwapDistance(int distance) {
        return new DrawConfig(sidesPerRoom, panelSize, avoidInstitutionClash, byePolicy, seeding, tieBreak,
            tieBreakSeed, distance, avoidJudgedInstitutions);
    }

    public DrawConfig withAvoidJudgedInstitutions(boolean avoid) {
        return new DrawConfig(sidesPerRoom, panelSize, avoidInstitutionClash, byePolicy, seeding, tieBreak,
            tieBreakSeed, maxSwapDistance, avoid);
    }

    /**
     * Lists every setting that makes this configuration unusable; empty when valid.
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (sidesPerRoom <= 0) {
            problems.add("sidesPerRoom must be positive, was " + sidesPerRoom);
        }
        if (panelSize <= 0) {
            problems.add("panelSize must be positive, was " + panelSize);
        }
        if (maxSwapDistance < 0) {
            problems.add("maxSwapDistance must not be negative, was " + maxSwapDistance);
        }
        if (seeding == Seeding.RANDOM && tieBreakSeed == null) {
            problems.add("seeding RANDOM requires a tieBreakSeed");
        }
        if (tieBreak == TieBreak.SEEDED && tieBreakSeed == null) {
            problems.add("tieBreak SEEDED requires a tieBreakSeed");
        }
        return problems;
    }
}
