package org.arenaclient.match.resources;

import org.arenaclient.match.api.resources.IResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for shared resources configured from a HOCON block.
 */
public abstract class AbstractResource implements IResource {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    private final String name;
    protected final Config options;

    protected AbstractResource(String name, Config options) {
        this.name = name;
        this.options = options;
    }

    @Override
    public String getResourceName() {
        return name;
    }
}
