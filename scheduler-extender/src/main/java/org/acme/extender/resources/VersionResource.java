package org.acme.extender.resources;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.acme.extender.config.ExtenderConfig;

@Path("/version")
public class VersionResource {

    @Inject
    ExtenderConfig config;

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    public String version() {
        return config.version();
    }
}
