package org.arenaclient.node.spi;

/**
 * Implemented by processes that expose a service object to processes which {@code require} them.
 */
public interface IServiceProvider {

    /**
     * Returns the object injected into dependent processes under their {@code require} key.
     *
     * @return the exposed service, never {@code null}.
     */
    Object getExposedService();
}
