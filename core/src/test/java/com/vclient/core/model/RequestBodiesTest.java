package com.vclient.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vclient.core.util.JsonUtil;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestBodiesTest {

    private final ObjectMapper mapper = JsonUtil.newMapper();

    @Test
    void campaign_create_checks_lengths_and_ranges() {
        assertThatCode(() -> new CampaignCreate().name("Night Court").danger(5).validate()).doesNotThrowAnyException();

        assertThatThrownBy(() -> new CampaignCreate().name("ab").desperation(6).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name: should have at least 3 characters")
                .hasMessageContaining("desperation: must be between 0 and 5");
    }

    @Test
    void missing_required_fields_are_all_reported() {
        assertThatThrownBy(() -> new UserCreate().validate())
                .hasMessageContaining("username: field required")
                .hasMessageContaining("email: field required")
                .hasMessageContaining("role: field required")
                .hasMessageContaining("requesting_user_id: field required");
    }

    @Test
    void updates_only_check_what_is_set() {
        assertThatCode(() -> new CampaignUpdate().validate()).doesNotThrowAnyException();
        assertThatCode(() -> new CompanyUpdate().validate()).doesNotThrowAnyException();
        assertThatThrownBy(() -> new CompanyUpdate().description("x").validate())
                .hasMessage("description: should have at least 3 characters");
    }

    @Test
    void diceroll_needs_a_known_die() {
        assertThatCode(() -> new DicerollCreate().diceSize(10).numDice(3).validate()).doesNotThrowAnyException();
        assertThatThrownBy(() -> new DicerollCreate().diceSize(7).numDice(3).validate())
                .hasMessageContaining("dice_size: must be one of");
    }

    @Test
    void bodies_serialize_snake_case_without_nulls() {
        JsonNode json = mapper.valueToTree(new UserCreate()
                .nameFirst("Ada").username("ada").email("ada@example.com")
                .role(UserRole.PLAYER).requestingUserId("u-1"));

        assertThat(json.path("name_first").asText()).isEqualTo("Ada");
        assertThat(json.path("requesting_user_id").asText()).isEqualTo("u-1");
        assertThat(json.path("role").asText()).isEqualTo("PLAYER");
        assertThat(json.has("name_last")).isFalse();
        assertThat(json.has("discord_profile")).isFalse();
    }

    @Test
    void campaign_defaults_are_sent() {
        JsonNode json = mapper.valueToTree(new CampaignCreate().name("Night Court"));

        assertThat(json.path("desperation").asInt(-1)).isZero();
        assertThat(json.path("danger").asInt(-1)).isZero();
        assertThat(json.path("asset_ids").isArray()).isTrue();
    }
}
