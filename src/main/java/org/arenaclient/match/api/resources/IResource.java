package org.arenaclient.match.api.resources;

/**
 * A resource shared by match sessions, such as the port pool or the result log.
 */
public interface IResource {

    /**
     * Coarse usage state reported for health checks.
     */
    enum UsageState {
        /** The resource can serve requests. */
        ACTIVE,
        /** The resource is exhausted and callers would have to wait or be rejected. */
        WAITING,
        /** The resource is broken. */
        FAILED
    }

    /**
     * @return the configured name of this resource.
     */
    String getResourceName();

    /**
     * @return the current usage state.
     */
    UsageState getUsageState();
}
