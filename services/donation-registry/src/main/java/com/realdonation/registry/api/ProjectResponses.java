package com.realdonation.registry.api;

import com.realdonation.registry.domain.Project;
import com.realdonation.security.Address;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Response bodies of {@link ProjectController}.
 */
public final class ProjectResponses {

    private ProjectResponses() {
    }

    public record CreatedProject(String id) {
    }

    /**
     * A stored project. An absent or ceased project is reported with {@code exists=false} and the
     * zero values, not as an error.
     */
    public record ProjectView(String id, String creator, String name, Instant createTime, boolean exists) {

        static ProjectView of(Project project) {
            return new ProjectView(
                    project.id().toHex(),
                    project.creator().toHex(),
                    project.name(),
                    project.createTime(),
                    project.exists());
        }
    }

    public record DescriptionView(String id, String description) {
    }

    public record DonatedAmount(String id, String donor, BigInteger amount) {

        static DonatedAmount of(String id, Address donor, BigInteger amount) {
            return new DonatedAmount(id, donor.toHex(), amount);
        }
    }

    public record Balance(String address, BigInteger balance) {
    }
}
