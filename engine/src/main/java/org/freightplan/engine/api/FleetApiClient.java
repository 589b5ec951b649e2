package org.freightplan.engine.api;

import org.freightplan.engine.domain.model.Trailer;
import org.freightplan.engine.domain.model.Truck;

import java.util.List;

/**
 * Client interface for the fleet registry (telematics) API.
 */
public interface FleetApiClient {

    /**
     * Get trucks currently available for dispatch.
     * GET fleet/vehicles?vehicleStatus=available&types=truck
     *
     * @return available trucks, empty when the registry cannot be reached
     */
    List<Truck> getAvailableTrucks();

    /**
     * Get trailers currently available for loading.
     * GET fleet/vehicles?vehicleStatus=available&types=trailer
     *
     * @return available trailers, empty when the registry cannot be reached
     */
    List<Trailer> getAvailableTrailers();
}
