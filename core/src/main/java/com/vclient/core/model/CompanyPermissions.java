package com.vclient.core.model;

/** Developer access level on one company, as confirmed by the server. */
public record CompanyPermissions(String companyId, String name, String permission) {
}
