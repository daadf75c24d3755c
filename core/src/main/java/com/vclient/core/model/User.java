package com.vclient.core.model;

import java.time.OffsetDateTime;
import java.util.List;

public record User(
        String id,
        OffsetDateTime dateCreated,
        OffsetDateTime dateModified,
        String nameFirst,
        String nameLast,
        String username,
        String email,
        String role,
        String companyId,
        DiscordProfile discordProfile,
        List<CampaignExperience> campaignExperience,
        List<String> assetIds) {

    public User {
        campaignExperience = (campaignExperience == null) ? List.of() : List.copyOf(campaignExperience);
        assetIds = (assetIds == null) ? List.of() : List.copyOf(assetIds);
    }
}
