package com.vclient.core.model;

/** Body of {@code PATCH /companies/{id}}. Unset fields are left unchanged. */
public final class CompanyUpdate implements Validatable {
    private String name;
    private String email;
    private String description;
    private CompanySettings settings;

    public CompanyUpdate name(String name) { this.name = name; return this; }
    public CompanyUpdate email(String email) { this.email = email; return this; }
    public CompanyUpdate description(String description) { this.description = description; return this; }
    public CompanyUpdate settings(CompanySettings settings) { this.settings = settings; return this; }

    public String getName() { return name; }
    public String getEmail() { return email; }
    public String getDescription() { return description; }
    public CompanySettings getSettings() { return settings; }

    @Override
    public void validate() {
        new RequestChecks()
                .length("name", name, 3, 50)
                .length("description", description, 3, -1)
                .throwIfAny();
    }
}
