package com.vclient.core.model;

import java.time.OffsetDateTime;
import java.util.List;

public record Company(
        String id,
        OffsetDateTime dateCreated,
        OffsetDateTime dateModified,
        String name,
        String description,
        String email,
        List<String> userIds,
        CompanySettings settings) {

    public Company {
        userIds = (userIds == null) ? List.of() : List.copyOf(userIds);
    }
}
