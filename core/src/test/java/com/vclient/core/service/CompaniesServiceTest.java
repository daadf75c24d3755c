package com.vclient.core.service;

import com.vclient.core.error.NotFoundException;
import com.vclient.core.error.RequestValidationException;
import com.vclient.core.http.ApiRequest;
import com.vclient.core.http.HttpVerb;
import com.vclient.core.model.ApiResponse;
import com.vclient.core.model.Company;
import com.vclient.core.model.CompanyCreate;
import com.vclient.core.model.CompanyPermissions;
import com.vclient.core.model.CompanyUpdate;
import com.vclient.core.model.NewCompanyResponse;
import com.vclient.core.model.Page;
import com.vclient.core.model.PermissionLevel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CompaniesServiceTest extends ServiceTestSupport {

    private static final String ACME = "{\"id\":\"c1\",\"name\":\"Acme\",\"email\":\"a@acme.test\",\"user_ids\":[]}";

    @Test
    void get_page_uses_default_limit() {
        transport.respond(200, page("[" + ACME + "]", 10, 0, 1));

        Page<Company> page = client().companies().getPage();

        assertThat(page.getItems()).extracting(Company::name).containsExactly("Acme");
        ApiRequest sent = transport.lastRequest();
        assertThat(sent.getPath()).isEqualTo("/api/v1/companies");
        assertThat(sent.getQuery()).containsEntry("limit", "10").containsEntry("offset", "0");
    }

    @Test
    void list_all_pages_with_max_limit() {
        transport.route(req -> {
            int offset = Integer.parseInt(req.getQuery().get("offset"));
            String item = "{\"id\":\"c" + offset + "\",\"name\":\"Co" + offset + "\"}";
            return ApiResponse.of(200, Map.of(), page("[" + item + "]", 1, offset, 3));
        });

        List<Company> all = client().companies().listAll();

        assertThat(all).extracting(Company::id).containsExactly("c0", "c1", "c2");
        assertThat(transport.requests).extracting(r -> r.getQuery().get("limit")).containsOnly("100");
    }

    @Test
    void iter_all_streams_lazily() {
        transport.respond(200, page("[" + ACME + "," + ACME + "]", 2, 0, 2));

        List<String> names = client().companies().iterAll(2).map(Company::name).collect(Collectors.toList());

        assertThat(names).containsExactly("Acme", "Acme");
        assertThat(transport.calls()).isEqualTo(1);
    }

    @Test
    void get_reads_one_company() {
        transport.respond(200, ACME);

        assertThat(client().companies().get("c1").email()).isEqualTo("a@acme.test");
        assertThat(transport.lastRequest().getPath()).isEqualTo("/api/v1/companies/c1");
    }

    @Test
    void missing_company_is_not_found() {
        transport.respond(404, "{\"detail\":\"Company not found\"}");

        NotFoundException e = assertThrows(NotFoundException.class, () -> client().companies().get("nope"));
        assertThat(e.getMessage()).isEqualTo("Company not found");
    }

    @Test
    void create_posts_snake_case_body() {
        transport.respond(201, "{\"company\":" + ACME + ",\"admin_user\":{\"id\":\"u1\",\"username\":\"admin\"}}");

        NewCompanyResponse created = client().companies()
                .create(new CompanyCreate().name("Acme").email("a@acme.test"));

        assertThat(created.company().id()).isEqualTo("c1");
        assertThat(created.adminUser().username()).isEqualTo("admin");
        ApiRequest sent = transport.lastRequest();
        assertThat(sent.getVerb()).isEqualTo(HttpVerb.POST);
        assertThat(sent.getJsonBody()).isInstanceOf(CompanyCreate.class);
    }

    @Test
    void create_rejects_short_name_locally() {
        assertThrows(RequestValidationException.class,
                () -> client().companies().create(new CompanyCreate().name("A").email("a@acme.test")));
        assertThat(transport.calls()).isZero();
    }

    @Test
    void update_patches_and_delete_deletes() {
        transport.respond(200, ACME).respond(204, "");
        var companies = client().companies();

        companies.update("c1", new CompanyUpdate().description("Makers of things"));
        companies.delete("c1");

        assertThat(transport.requests).extracting(ApiRequest::getVerb).containsExactly(HttpVerb.PATCH, HttpVerb.DELETE);
        assertThat(transport.requests).extracting(ApiRequest::getPath).containsOnly("/api/v1/companies/c1");
    }

    @Test
    void grant_access_posts_to_access_endpoint() {
        transport.respond(200, "{\"company_id\":\"c1\",\"name\":\"Acme\",\"permission\":\"ADMIN\"}");

        CompanyPermissions perms = client().companies().grantAccess("c1", "dev-9", PermissionLevel.ADMIN);

        assertThat(perms.permission()).isEqualTo("ADMIN");
        assertThat(transport.lastRequest().getPath()).isEqualTo("/api/v1/companies/c1/access");
    }

    @Test
    void grant_access_needs_a_developer() {
        assertThrows(RequestValidationException.class,
                () -> client().companies().grantAccess("c1", null, PermissionLevel.USER));
        assertThat(transport.calls()).isZero();
    }
}
