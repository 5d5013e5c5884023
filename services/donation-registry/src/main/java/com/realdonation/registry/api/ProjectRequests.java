package com.realdonation.registry.api;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * Request bodies of {@link ProjectController}. Only presence is validated here; length and amount
 * bounds are enforced by the registry so that they fail with the registry's error codes.
 */
public final class ProjectRequests {

    private ProjectRequests() {
    }

    public record CreateProject(@NotNull String name, String description) {

        public CreateProject {
            description = description == null ? "" : description;
        }
    }

    public record ModifyDescription(@NotNull String description) {
    }

    public record Donate(@NotNull BigInteger amount, String message) {

        public Donate {
            message = message == null ? "" : message;
        }
    }
}
