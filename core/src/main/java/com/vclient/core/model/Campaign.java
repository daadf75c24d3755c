package com.vclient.core.model;

import java.time.OffsetDateTime;
import java.util.List;

public record Campaign(
        String id,
        OffsetDateTime dateCreated,
        OffsetDateTime dateModified,
        String name,
        String description,
        List<String> assetIds,
        int desperation,
        int danger,
        String companyId) {

    public Campaign {
        assetIds = (assetIds == null) ? List.of() : List.copyOf(assetIds);
    }
}
