package com.vclient.core.model;

/** Body of {@code POST /companies}. */
public final class CompanyCreate implements Validatable {
    private String name;
    private String email;
    private String description;
    private CompanySettings settings;

    public CompanyCreate name(String name) { this.name = name; return this; }
    public CompanyCreate email(String email) { this.email = email; return this; }
    public CompanyCreate description(String description) { this.description = description; return this; }
    public CompanyCreate settings(CompanySettings settings) { this.settings = settings; return this; }

    public String getName() { return name; }
    public String getEmail() { return email; }
    public String getDescription() { return description; }
    public CompanySettings getSettings() { return settings; }

    @Override
    public void validate() {
        new RequestChecks()
                .required("name", name)
                .length("name", name, 3, 50)
                .required("email", email)
                .length("description", description, 3, -1)
                .throwIfAny();
    }
}
