package com.vclient.core.model;

/** Body of {@code POST /companies/{c}/users}. */
public final class UserCreate implements Validatable {
    private String nameFirst;
    private String nameLast;
    private String username;
    private String email;
    private UserRole role;
    private DiscordProfile discordProfile;
    private String requestingUserId;

    public UserCreate nameFirst(String v) { this.nameFirst = v; return this; }
    public UserCreate nameLast(String v) { this.nameLast = v; return this; }
    public UserCreate username(String v) { this.username = v; return this; }
    public UserCreate email(String v) { this.email = v; return this; }
    public UserCreate role(UserRole v) { this.role = v; return this; }
    public UserCreate discordProfile(DiscordProfile v) { this.discordProfile = v; return this; }
    public UserCreate requestingUserId(String v) { this.requestingUserId = v; return this; }

    public String getNameFirst() { return nameFirst; }
    public String getNameLast() { return nameLast; }
    public String getUsername() { return username; }
    public String getEmail() { return email; }
    public UserRole getRole() { return role; }
    public DiscordProfile getDiscordProfile() { return discordProfile; }
    public String getRequestingUserId() { return requestingUserId; }

    @Override
    public void validate() {
        new RequestChecks()
                .length("name_first", nameFirst, 3, 50)
                .length("name_last", nameLast, 3, 50)
                .required("username", username)
                .length("username", username, 3, 50)
                .required("email", email)
                .required("role", role)
                .required("requesting_user_id", requestingUserId)
                .throwIfAny();
    }
}
