package com.vclient.core.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointsTest {

    @Test
    void nested_paths_build_from_parents() {
        assertThat(Endpoints.character("c", "u", "k", "ch"))
                .isEqualTo("/api/v1/companies/c/users/u/campaigns/k/characters/ch");
        assertThat(Endpoints.diceroll("c", "u", "d")).isEqualTo("/api/v1/companies/c/users/u/dicerolls/d");
        assertThat(Endpoints.userAssetUpload("c", "u")).isEqualTo("/api/v1/companies/c/users/u/assets/upload");
    }

    @Test
    void ids_are_single_encoded_segments() {
        assertThat(Endpoints.company("a/b c")).isEqualTo("/api/v1/companies/a%2Fb%20c");
    }

    @Test
    void blank_ids_are_rejected() {
        assertThatThrownBy(() -> Endpoints.company(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Endpoints.user("c", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
