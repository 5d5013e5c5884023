package com.realdonation.registry.domain;

import com.realdonation.security.Address;

import java.time.Instant;
import java.util.Objects;

/**
 * A funding target as held in the registry.
 * <p>
 * The description is not part of this record; it lives only in the event journal. A project
 * whose creator is the zero address does not exist, and {@link #EMPTY} is what every lookup of an
 * absent or ceased id returns.
 *
 * @param id         derived project id
 * @param creator    the registering account; receives every donation
 * @param name       display name, 1–64 UTF-8 bytes
 * @param createTime time of the creating call, second precision
 */
public record Project(ProjectId id, Address creator, String name, Instant createTime) {

    /** The zero-valued project. */
    public static final Project EMPTY = new Project(ProjectId.ZERO, Address.ZERO, "", Instant.EPOCH);

    public Project {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createTime, "createTime");
    }

    /** True unless this is the zero-valued record. */
    public boolean exists() {
        return !creator.isZero();
    }
}
