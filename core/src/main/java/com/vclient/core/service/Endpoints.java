package com.vclient.core.service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/** API paths relative to the configured base URL. Ids are URL-encoded as single path segments. */
public final class Endpoints {
    private Endpoints() {}

    public static final String BASE = "/api/v1";

    public static final String HEALTH = BASE + "/health";
    public static final String COMPANIES = BASE + "/companies";

    public static String company(String companyId) {
        return COMPANIES + "/" + seg(companyId);
    }

    public static String companyAccess(String companyId) {
        return company(companyId) + "/access";
    }

    public static String users(String companyId) {
        return company(companyId) + "/users";
    }

    public static String user(String companyId, String userId) {
        return users(companyId) + "/" + seg(userId);
    }

    public static String userAssets(String companyId, String userId) {
        return user(companyId, userId) + "/assets";
    }

    public static String userAsset(String companyId, String userId, String assetId) {
        return userAssets(companyId, userId) + "/" + seg(assetId);
    }

    public static String userAssetUpload(String companyId, String userId) {
        return userAssets(companyId, userId) + "/upload";
    }

    public static String userExperience(String companyId, String userId, String campaignId) {
        return user(companyId, userId) + "/experience/" + seg(campaignId);
    }

    /** {@code action} is one of {@code xp/add}, {@code xp/remove}, {@code cp/add}. */
    static String userExperienceChange(String companyId, String userId, String action) {
        return user(companyId, userId) + "/experience/" + action;
    }

    public static String campaigns(String companyId, String userId) {
        return user(companyId, userId) + "/campaigns";
    }

    public static String campaign(String companyId, String userId, String campaignId) {
        return campaigns(companyId, userId) + "/" + seg(campaignId);
    }

    public static String characters(String companyId, String userId, String campaignId) {
        return campaign(companyId, userId, campaignId) + "/characters";
    }

    public static String character(String companyId, String userId, String campaignId, String characterId) {
        return characters(companyId, userId, campaignId) + "/" + seg(characterId);
    }

    public static String dicerolls(String companyId, String userId) {
        return user(companyId, userId) + "/dicerolls";
    }

    public static String diceroll(String companyId, String userId, String dicerollId) {
        return dicerolls(companyId, userId) + "/" + seg(dicerollId);
    }

    private static String seg(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("path id must not be blank");
        return URLEncoder.encode(id, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
