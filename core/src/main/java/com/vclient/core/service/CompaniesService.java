package com.vclient.core.service;

import com.vclient.core.VClient;
import com.vclient.core.http.PaginationCursor;
import com.vclient.core.model.Company;
import com.vclient.core.model.CompanyCreate;
import com.vclient.core.model.CompanyPermissions;
import com.vclient.core.model.CompanyUpdate;
import com.vclient.core.model.NewCompanyResponse;
import com.vclient.core.model.Page;
import com.vclient.core.model.PermissionLevel;
import com.vclient.core.model.RequestChecks;
import com.vclient.core.model.Validatable;

import java.util.List;
import java.util.stream.Stream;

/** Companies visible to the API key. */
public final class CompaniesService extends BaseService {

    public CompaniesService(VClient client) {
        super(client);
    }

    public Page<Company> getPage(int limit, int offset) {
        return getPaginated(Endpoints.COMPANIES, Company.class, limit, offset, null);
    }

    public Page<Company> getPage() {
        return getPage(PaginationCursor.DEFAULT_PAGE_LIMIT, 0);
    }

    public List<Company> listAll() {
        return getAll(Endpoints.COMPANIES, Company.class, null);
    }

    /** Lazy; pages of {@code limit} are fetched as the stream is consumed. */
    public Stream<Company> iterAll(int limit) {
        return streamAll(Endpoints.COMPANIES, Company.class, limit, null);
    }

    public Company get(String companyId) {
        return parse(doGet(Endpoints.company(companyId)), Company.class);
    }

    /** The caller is granted OWNER on the new company. */
    public NewCompanyResponse create(CompanyCreate request) {
        return parse(doPost(Endpoints.COMPANIES, RequestOptions.json(request)), NewCompanyResponse.class);
    }

    public Company update(String companyId, CompanyUpdate request) {
        return parse(doPatch(Endpoints.company(companyId), RequestOptions.json(request)), Company.class);
    }

    public void delete(String companyId) {
        doDelete(Endpoints.company(companyId));
    }

    /** Sets a developer's access level; {@link PermissionLevel#REVOKE} removes it. */
    public CompanyPermissions grantAccess(String companyId, String developerId, PermissionLevel permission) {
        GrantAccess body = validateRequest(new GrantAccess(developerId, permission));
        return parse(doPost(Endpoints.companyAccess(companyId), RequestOptions.json(body)), CompanyPermissions.class);
    }

    /** Body of {@code POST /companies/{id}/access}. */
    static final class GrantAccess implements Validatable {
        private final String developerId;
        private final PermissionLevel permission;

        GrantAccess(String developerId, PermissionLevel permission) {
            this.developerId = developerId;
            this.permission = permission;
        }

        public String getDeveloperId() { return developerId; }
        public PermissionLevel getPermission() { return permission; }

        @Override
        public void validate() {
            new RequestChecks()
                    .required("developer_id", developerId)
                    .required("permission", permission)
                    .throwIfAny();
        }
    }
}
