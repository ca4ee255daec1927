/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.config;

/**
 * Connection details of a DHIS2 source instance, as declared under {@code dhis2-instances}.
 *
 * @param name
 *            registry key referenced by schedules
 * @param url
 *            API base URL (for example {@code https://play.dhis2.org/40/api})
 * @param username
 *            basic auth user
 * @param password
 *            basic auth password
 */
public record Dhis2Instance(String name, String url, String username, String password) {

    @Override
    public String toString() {
        return "Dhis2Instance[name=" + name + ", url=" + url + ", username=" + username + "]";
    }
}
