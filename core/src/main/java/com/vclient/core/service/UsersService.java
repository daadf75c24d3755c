package com.vclient.core.service;

import com.vclient.core.VClient;
import com.vclient.core.http.FilePayload;
import com.vclient.core.http.PaginationCursor;
import com.vclient.core.model.Asset;
import com.vclient.core.model.CampaignExperience;
import com.vclient.core.model.Page;
import com.vclient.core.model.RequestChecks;
import com.vclient.core.model.User;
import com.vclient.core.model.UserCreate;
import com.vclient.core.model.UserRole;
import com.vclient.core.model.UserUpdate;
import com.vclient.core.model.Validatable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/** Users of one company. */
public final class UsersService extends BaseService {
    private final String companyId;

    public UsersService(VClient client, String companyId) {
        super(client);
        this.companyId = Objects.requireNonNull(companyId, "companyId");
    }

    public String getCompanyId() { return companyId; }

    /** @param role optional filter, null for every role */
    public Page<User> getPage(UserRole role, int limit, int offset) {
        return getPaginated(Endpoints.users(companyId), User.class, limit, offset, buildParams("user_role", role));
    }

    public Page<User> getPage() {
        return getPage(null, PaginationCursor.DEFAULT_PAGE_LIMIT, 0);
    }

    public List<User> listAll(UserRole role) {
        return getAll(Endpoints.users(companyId), User.class, buildParams("user_role", role));
    }

    public Stream<User> iterAll(UserRole role, int limit) {
        return streamAll(Endpoints.users(companyId), User.class, limit, buildParams("user_role", role));
    }

    public User get(String userId) {
        return parse(doGet(Endpoints.user(companyId, userId)), User.class);
    }

    public User create(UserCreate request) {
        return parse(doPost(Endpoints.users(companyId), RequestOptions.json(request)), User.class);
    }

    public User update(String userId, UserUpdate request) {
        return parse(doPatch(Endpoints.user(companyId, userId), RequestOptions.json(request)), User.class);
    }

    /** The user is detached from the company and archived server-side. */
    public void delete(String userId, String requestingUserId) {
        doDelete(Endpoints.user(companyId, userId),
                RequestOptions.params(buildParams("requesting_user_id", requestingUserId)));
    }

    public Page<Asset> getAssetsPage(String userId, int limit, int offset) {
        return getPaginated(Endpoints.userAssets(companyId, userId), Asset.class, limit, offset, null);
    }

    public List<Asset> listAllAssets(String userId) {
        return getAll(Endpoints.userAssets(companyId, userId), Asset.class, null);
    }

    public Asset getAsset(String userId, String assetId) {
        return parse(doGet(Endpoints.userAsset(companyId, userId, assetId)), Asset.class);
    }

    public void deleteAsset(String userId, String assetId) {
        doDelete(Endpoints.userAsset(companyId, userId, assetId));
    }

    public Asset uploadAsset(String userId, FilePayload file) {
        return parse(doPostFile(Endpoints.userAssetUpload(companyId, userId), file, null), Asset.class);
    }

    // ---------- experience ----------

    /** The server creates an empty record on first read. */
    public CampaignExperience getExperience(String userId, String campaignId) {
        return parse(doGet(Endpoints.userExperience(companyId, userId, campaignId)), CampaignExperience.class);
    }

    /** Adds to both the spendable and the lifetime XP. */
    public CampaignExperience addXp(String userId, String campaignId, int amount) {
        return changeExperience("xp/add", userId, campaignId, amount);
    }

    /** Spends XP; a 400 {@code ValidationException} when the user has too little. */
    public CampaignExperience removeXp(String userId, String campaignId, int amount) {
        return changeExperience("xp/remove", userId, campaignId, amount);
    }

    /** Cool points convert to XP at the company's configured rate. */
    public CampaignExperience addCoolPoints(String userId, String campaignId, int amount) {
        return changeExperience("cp/add", userId, campaignId, amount);
    }

    private CampaignExperience changeExperience(String action, String userId, String campaignId, int amount) {
        ExperienceChange body = validateRequest(new ExperienceChange(amount, userId, campaignId));
        return parse(doPost(Endpoints.userExperienceChange(companyId, userId, action), RequestOptions.json(body)),
                CampaignExperience.class);
    }

    /** Body of the {@code experience/xp|cp} POSTs. */
    static final class ExperienceChange implements Validatable {
        private final int amount;
        private final String userId;
        private final String campaignId;

        ExperienceChange(int amount, String userId, String campaignId) {
            this.amount = amount;
            this.userId = userId;
            this.campaignId = campaignId;
        }

        public int getAmount() { return amount; }
        public String getUserId() { return userId; }
        public String getCampaignId() { return campaignId; }

        @Override
        public void validate() {
            new RequestChecks()
                    .required("user_id", userId)
                    .required("campaign_id", campaignId)
                    .throwIfAny();
        }
    }
}
