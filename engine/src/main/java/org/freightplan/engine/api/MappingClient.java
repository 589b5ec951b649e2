package org.freightplan.engine.api;

import java.util.List;

/**
 * Client interface for the external mapping service.
 */
public interface MappingClient {

    /**
     * Get driving distances and times between every pair of locations in one call.
     *
     * @param locations addresses or place names
     * @return matrices indexed like {@code locations}
     * @throws MappingServiceException if the service fails for any reason
     */
    RouteMatrix routeMatrix(List<String> locations);
}
