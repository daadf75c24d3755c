package com.vclient.core.model;

/** A created company together with the admin user provisioned for it. */
public record NewCompanyResponse(Company company, User adminUser) {
}
