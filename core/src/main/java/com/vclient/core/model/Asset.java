package com.vclient.core.model;

import java.time.OffsetDateTime;

/** Uploaded file stored by the API. */
public record Asset(
        String id,
        OffsetDateTime dateCreated,
        OffsetDateTime dateModified,
        String fileType,
        String originalFilename,
        String publicUrl,
        String parentType,
        String parentId,
        String uploadedBy,
        String companyId) {
}
