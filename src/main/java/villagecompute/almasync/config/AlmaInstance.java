/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.config;

/**
 * Connection details of an ALMA target instance, as declared under {@code alma-instances}.
 *
 * @param name
 *            registry key referenced by schedules
 * @param url
 *            ALMA API base URL
 * @param username
 *            login user
 * @param password
 *            login password
 * @param backend
 *            backend identifier sent with the session request
 */
public record AlmaInstance(String name, String url, String username, String password, String backend) {

    @Override
    public String toString() {
        return "AlmaInstance[name=" + name + ", url=" + url + ", username=" + username + ", backend=" + backend + "]";
    }
}
