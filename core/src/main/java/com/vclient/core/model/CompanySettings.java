package com.vclient.core.model;

/** Per-company game settings. Every field is optional on update. */
public record CompanySettings(
        Integer characterAutogenXpCost,
        Integer characterAutogenNumChoices,
        String permissionManageCampaign,
        String permissionGrantXp,
        String permissionFreeTraitChanges) {
}
