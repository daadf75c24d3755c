package com.vclient.core.model;

import java.util.ArrayList;
import java.util.List;

/** Body of {@code POST .../campaigns}. Desperation and danger run 0..5. */
public final class CampaignCreate implements Validatable {
    private String name;
    private String description;
    private List<String> assetIds = new ArrayList<>();
    private int desperation = 0;
    private int danger = 0;

    public CampaignCreate name(String v) { this.name = v; return this; }
    public CampaignCreate description(String v) { this.description = v; return this; }
    public CampaignCreate assetIds(List<String> v) { this.assetIds = (v == null) ? new ArrayList<>() : new ArrayList<>(v); return this; }
    public CampaignCreate desperation(int v) { this.desperation = v; return this; }
    public CampaignCreate danger(int v) { this.danger = v; return this; }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<String> getAssetIds() { return List.copyOf(assetIds); }
    public int getDesperation() { return desperation; }
    public int getDanger() { return danger; }

    @Override
    public void validate() {
        new RequestChecks()
                .required("name", name)
                .length("name", name, 3, 50)
                .length("description", description, 3, -1)
                .range("desperation", desperation, 0, 5)
                .range("danger", danger, 0, 5)
                .throwIfAny();
    }
}
