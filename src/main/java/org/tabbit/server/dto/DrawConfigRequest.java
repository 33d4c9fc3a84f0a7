package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tabbit.model.ByePolicy;
import org.tabbit.model.DrawConfig;
import org.tabbit.model.Seeding;
import org.tabbit.model.TieBreak;

/**
 * Draw settings for a new tournament; omitted fields take their defaults.
 * Range checks happen in {@link org.tabbit.compute.ConfigurationException#requireValid}.
 */
public record DrawConfigRequest(
    @JsonProperty("sidesPerRoom") Integer sidesPerRoom,
    @JsonProperty("panelSize") Integer panelSize,
    @JsonProperty("avoidInstitutionClash") Boolean avoidInstitutionClash,
    @JsonProperty("byePolicy") ByePolicy byePolicy,
    @JsonProperty("seeding") Seeding seeding,
    @JsonProperty("tieBreak") TieBreak tieBreak,
    @JsonProperty("tieBreakSeed") Long tieBreakSeed,
    @JsonProperty("maxSwapDistance") Integer maxSwapDistance,
    @JsonProperty("avoidJudgedInstitutions") Boolean avoidJudgedInstitutions
) {

    public DrawConfig toConfig() {
        return DrawConfig.fromSettings(sidesPerRoom, panelSize, avoidInstitutionClash, byePolicy, seeding,
            tieBreak, tieBreakSeed, maxSwapDistance, avoidJudgedInstitutions);
    }
}
