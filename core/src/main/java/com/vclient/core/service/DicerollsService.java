package com.vclient.core.service;

import com.vclient.core.VClient;
import com.vclient.core.http.PaginationCursor;
import com.vclient.core.model.Diceroll;
import com.vclient.core.model.DicerollCreate;
import com.vclient.core.model.Page;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/** Dice rolls recorded under one company and user. */
public final class DicerollsService extends BaseService {
    private final String companyId;
    private final String userId;

    public DicerollsService(VClient client, String companyId, String userId) {
        super(client);
        this.companyId = Objects.requireNonNull(companyId, "companyId");
        this.userId = Objects.requireNonNull(userId, "userId");
    }

    /** Any filter may be null. */
    public Page<Diceroll> getPage(String filterUserId, String characterId, String campaignId, int limit, int offset) {
        return getPaginated(path(), Diceroll.class, limit, offset, filters(filterUserId, characterId, campaignId));
    }

    public Page<Diceroll> getPage() {
        return getPage(null, null, null, PaginationCursor.DEFAULT_PAGE_LIMIT, 0);
    }

    public List<Diceroll> listAll(String filterUserId, String characterId, String campaignId) {
        return getAll(path(), Diceroll.class, filters(filterUserId, characterId, campaignId));
    }

    public Stream<Diceroll> iterAll(String filterUserId, String characterId, String campaignId, int limit) {
        return streamAll(path(), Diceroll.class, limit, filters(filterUserId, characterId, campaignId));
    }

    public Diceroll get(String dicerollId) {
        return parse(doGet(Endpoints.diceroll(companyId, userId, dicerollId)), Diceroll.class);
    }

    public Diceroll create(DicerollCreate request) {
        return parse(doPost(path(), RequestOptions.json(request)), Diceroll.class);
    }

    private static Map<String, Object> filters(String filterUserId, String characterId, String campaignId) {
        return buildParams("userid", filterUserId, "characterid", characterId, "campaignid", campaignId);
    }

    private String path() {
        return Endpoints.dicerolls(companyId, userId);
    }
}
