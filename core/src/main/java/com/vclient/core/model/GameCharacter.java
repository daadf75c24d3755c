package com.vclient.core.model;

import java.time.OffsetDateTime;

/** Player or non-player character inside a campaign. Class-specific attributes are not mapped. */
public record GameCharacter(
        String id,
        OffsetDateTime dateCreated,
        OffsetDateTime dateModified,
        OffsetDateTime dateKilled,
        String characterClass,
        String type,
        String gameVersion,
        String status,
        int startingPoints,
        String nameFirst,
        String nameLast,
        String nameNick,
        String name,
        String nameFull,
        Integer age,
        String biography,
        String demeanor,
        String nature,
        String concept,
        String userCreatorId,
        String userPlayerId,
        String companyId,
        String campaignId) {
}
