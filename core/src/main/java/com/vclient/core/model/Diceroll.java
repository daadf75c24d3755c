package com.vclient.core.model;

import java.time.OffsetDateTime;
import java.util.List;

public record Diceroll(
        String id,
        OffsetDateTime dateCreated,
        OffsetDateTime dateModified,
        int diceSize,
        Integer difficulty,
        int numDice,
        int numDesperationDice,
        String comment,
        List<String> traitIds,
        String userId,
        String characterId,
        String campaignId,
        String companyId,
        DiceRollResult result) {

    public Diceroll {
        traitIds = (traitIds == null) ? List.of() : List.copyOf(traitIds);
    }
}
