package com.vclient.core.model;

import java.util.List;

/** Body of {@code PATCH .../campaigns/{id}}. Unset fields are left unchanged. */
public final class CampaignUpdate implements Validatable {
    private String name;
    private String description;
    private List<String> assetIds;
    private Integer desperation;
    private Integer danger;

    public CampaignUpdate name(String v) { this.name = v; return this; }
    public CampaignUpdate description(String v) { this.description = v; return this; }
    public CampaignUpdate assetIds(List<String> v) { this.assetIds = (v == null) ? null : List.copyOf(v); return this; }
    public CampaignUpdate desperation(Integer v) { this.desperation = v; return this; }
    public CampaignUpdate danger(Integer v) { this.danger = v; return this; }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<String> getAssetIds() { return assetIds; }
    public Integer getDesperation() { return desperation; }
    public Integer getDanger() { return danger; }

    @Override
    public void validate() {
        new RequestChecks()
                .length("name", name, 3, 50)
                .length("description", description, 3, -1)
                .range("desperation", desperation, 0, 5)
                .range("danger", danger, 0, 5)
                .throwIfAny();
    }
}
