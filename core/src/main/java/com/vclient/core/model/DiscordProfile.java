package com.vclient.core.model;

public record DiscordProfile(
        String id,
        String username,
        String globalName,
        String avatarId,
        String avatarUrl,
        String discriminator,
        String email,
        Boolean verified) {
}
