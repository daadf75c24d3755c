package com.vclient.core.service;

import com.vclient.core.VClient;
import com.vclient.core.http.PaginationCursor;
import com.vclient.core.model.Campaign;
import com.vclient.core.model.CampaignCreate;
import com.vclient.core.model.CampaignUpdate;
import com.vclient.core.model.Page;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/** Campaigns of one company, acting as one user. */
public final class CampaignsService extends BaseService {
    private final String companyId;
    private final String userId;

    public CampaignsService(VClient client, String companyId, String userId) {
        super(client);
        this.companyId = Objects.requireNonNull(companyId, "companyId");
        this.userId = Objects.requireNonNull(userId, "userId");
    }

    public Page<Campaign> getPage(int limit, int offset) {
        return getPaginated(path(), Campaign.class, limit, offset, null);
    }

    public Page<Campaign> getPage() {
        return getPage(PaginationCursor.DEFAULT_PAGE_LIMIT, 0);
    }

    public List<Campaign> listAll() {
        return getAll(path(), Campaign.class, null);
    }

    public Stream<Campaign> iterAll(int limit) {
        return streamAll(path(), Campaign.class, limit, null);
    }

    public Campaign get(String campaignId) {
        return parse(doGet(Endpoints.campaign(companyId, userId, campaignId)), Campaign.class);
    }

    public Campaign create(CampaignCreate request) {
        return parse(doPost(path(), RequestOptions.json(request)), Campaign.class);
    }

    public Campaign update(String campaignId, CampaignUpdate request) {
        return parse(doPatch(Endpoints.campaign(companyId, userId, campaignId), RequestOptions.json(request)), Campaign.class);
    }

    public void delete(String campaignId) {
        doDelete(Endpoints.campaign(companyId, userId, campaignId));
    }

    private String path() {
        return Endpoints.campaigns(companyId, userId);
    }
}
