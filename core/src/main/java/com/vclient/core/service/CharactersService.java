package com.vclient.core.service;

import com.vclient.core.VClient;
import com.vclient.core.http.PaginationCursor;
import com.vclient.core.model.GameCharacter;
import com.vclient.core.model.Page;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/** Characters of one campaign. Read and delete only. */
public final class CharactersService extends BaseService {
    private final String companyId;
    private final String userId;
    private final String campaignId;

    public CharactersService(VClient client, String companyId, String userId, String campaignId) {
        super(client);
        this.companyId = Objects.requireNonNull(companyId, "companyId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.campaignId = Objects.requireNonNull(campaignId, "campaignId");
    }

    /** Filter for character listings. Null fields are not sent. */
    public static final class Filter {
        private String userPlayerId;
        private String userCreatorId;
        private String characterClass;
        private String characterType;
        private String status;

        public Filter userPlayerId(String v) { this.userPlayerId = v; return this; }
        public Filter userCreatorId(String v) { this.userCreatorId = v; return this; }
        public Filter characterClass(String v) { this.characterClass = v; return this; }
        public Filter characterType(String v) { this.characterType = v; return this; }
        public Filter status(String v) { this.status = v; return this; }

        Map<String, Object> toParams() {
            return buildParams(
                    "user_player_id", userPlayerId,
                    "user_creator_id", userCreatorId,
                    "character_class", characterClass,
                    "character_type", characterType,
                    "status", status);
        }
    }

    public Page<GameCharacter> getPage(Filter filter, int limit, int offset) {
        return getPaginated(path(), GameCharacter.class, limit, offset, params(filter));
    }

    public Page<GameCharacter> getPage() {
        return getPage(null, PaginationCursor.DEFAULT_PAGE_LIMIT, 0);
    }

    public List<GameCharacter> listAll(Filter filter) {
        return getAll(path(), GameCharacter.class, params(filter));
    }

    public Stream<GameCharacter> iterAll(Filter filter, int limit) {
        return streamAll(path(), GameCharacter.class, limit, params(filter));
    }

    public GameCharacter get(String characterId) {
        return parse(doGet(Endpoints.character(companyId, userId, campaignId, characterId)), GameCharacter.class);
    }

    public void delete(String characterId) {
        doDelete(Endpoints.character(companyId, userId, campaignId, characterId));
    }

    private static Map<String, Object> params(Filter filter) {
        return (filter == null) ? Map.of() : filter.toParams();
    }

    private String path() {
        return Endpoints.characters(companyId, userId, campaignId);
    }
}
