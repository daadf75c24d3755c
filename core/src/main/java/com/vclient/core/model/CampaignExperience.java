package com.vclient.core.model;

/** Experience a user holds in one campaign. */
public record CampaignExperience(String campaignId, int xpCurrent, int xpTotal, int coolPoints) {
}
