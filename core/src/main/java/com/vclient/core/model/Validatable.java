package com.vclient.core.model;

/** Request body that checks its own field constraints before it is sent. */
public interface Validatable {
    /** @throws IllegalArgumentException describing every violated constraint */
    void validate();
}
