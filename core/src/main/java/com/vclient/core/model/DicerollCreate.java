package com.vclient.core.model;

import java.util.ArrayList;
import java.util.List;

/** Body of {@code POST .../dicerolls}. */
public final class DicerollCreate implements Validatable {
    public static final List<Integer> DICE_SIZES = List.of(4, 6, 8, 10, 20, 100);

    private Integer diceSize;
    private Integer difficulty;
    private Integer numDice;
    private int numDesperationDice = 0;
    private String comment;
    private List<String> traitIds = new ArrayList<>();
    private String characterId;
    private String campaignId;

    public DicerollCreate diceSize(int v) { this.diceSize = v; return this; }
    public DicerollCreate difficulty(Integer v) { this.difficulty = v; return this; }
    public DicerollCreate numDice(int v) { this.numDice = v; return this; }
    public DicerollCreate numDesperationDice(int v) { this.numDesperationDice = v; return this; }
    public DicerollCreate comment(String v) { this.comment = v; return this; }
    public DicerollCreate traitIds(List<String> v) { this.traitIds = (v == null) ? new ArrayList<>() : new ArrayList<>(v); return this; }
    public DicerollCreate characterId(String v) { this.characterId = v; return this; }
    public DicerollCreate campaignId(String v) { this.campaignId = v; return this; }

    public Integer getDiceSize() { return diceSize; }
    public Integer getDifficulty() { return difficulty; }
    public Integer getNumDice() { return numDice; }
    public int getNumDesperationDice() { return numDesperationDice; }
    public String getComment() { return comment; }
    public List<String> getTraitIds() { return List.copyOf(traitIds); }
    public String getCharacterId() { return characterId; }
    public String getCampaignId() { return campaignId; }

    @Override
    public void validate() {
        new RequestChecks()
                .required("dice_size", diceSize)
                .oneOf("dice_size", diceSize, DICE_SIZES)
                .required("num_dice", numDice)
                .range("num_desperation_dice", numDesperationDice, 0, Integer.MAX_VALUE)
                .throwIfAny();
    }
}
