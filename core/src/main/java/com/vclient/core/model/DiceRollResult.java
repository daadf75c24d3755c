package com.vclient.core.model;

import java.util.List;

public record DiceRollResult(
        Integer totalResult,
        String totalResultType,
        String totalResultHumanized,
        List<Integer> totalDiceRoll,
        List<Integer> playerRoll,
        List<Integer> desperationRoll) {

    public DiceRollResult {
        totalDiceRoll = (totalDiceRoll == null) ? List.of() : List.copyOf(totalDiceRoll);
        playerRoll = (playerRoll == null) ? List.of() : List.copyOf(playerRoll);
        desperationRoll = (desperationRoll == null) ? List.of() : List.copyOf(desperationRoll);
    }
}
