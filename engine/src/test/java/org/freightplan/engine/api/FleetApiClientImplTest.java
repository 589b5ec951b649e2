package org.freightplan.engine.api;

import okhttp3.MediaType;
import okhttp3.ResponseBody;
import org.freightplan.engine.api.dto.FleetVehicleDto;
import org.freightplan.engine.api.dto.FleetVehiclesResponseDto;
import org.freightplan.engine.domain.model.Trailer;
import org.freightplan.engine.domain.model.Truck;
import org.junit.jupiter.api.Test;
import retrofit2.Call;
import retrofit2.Response;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FleetApiClientImplTest {

    private final FleetApiClientImpl.FleetApiService api = mock(FleetApiClientImpl.FleetApiService.class);
    private final FleetApiClientImpl client = new FleetApiClientImpl(api);

    @Test
    @SuppressWarnings("unchecked")
    void mapsTrucksAndDefaultsMissingDutyLimit() throws IOException {
        FleetVehicleDto withLimit = vehicle("T1", "Winnipeg");
        withLimit.setEngineHours(4.0);
        withLimit.setMaxHours(11.0);
        FleetVehicleDto withoutLimit = vehicle("T2", "Calgary");
        FleetVehicleDto withoutId = vehicle(null, "Calgary");

        Call<FleetVehiclesResponseDto> call = mock(Call.class);
        when(call.execute()).thenReturn(Response.success(response(withLimit, withoutLimit, withoutId)));
        when(api.getVehicles("available", "truck")).thenReturn(call);

        List<Truck> trucks = client.getAvailableTrucks();

        assertEquals(2, trucks.size());
        assertEquals("Winnipeg", trucks.get(0).getWarehouse());
        assertEquals(420, trucks.get(0).getRemainingDutyMinutes());
        assertEquals(FleetApiClientImpl.DEFAULT_MAX_HOURS, trucks.get(1).getMaxHours(), 1e-9);
    }

    @Test
    @SuppressWarnings("unchecked")
    void mapsTrailerEquipment() throws IOException {
        FleetVehicleDto reefer = vehicle("TR1", "Winnipeg");
        reefer.setMaxWeightKg(2000);
        reefer.setCurrentWeightKg(250);
        reefer.setTemperatureControlled(true);
        reefer.setHasPalletJack(true);

        Call<FleetVehiclesResponseDto> call = mock(Call.class);
        when(call.execute()).thenReturn(Response.success(response(reefer)));
        when(api.getVehicles("available", "trailer")).thenReturn(call);

        Trailer trailer = client.getAvailableTrailers().get(0);

        assertEquals(2000, trailer.getMaxWeightKg(), 1e-9);
        assertEquals(250, trailer.getCurrentWeightKg(), 1e-9);
        assertTrue(trailer.isTemperatureControlled());
        assertTrue(trailer.hasPalletJack());
    }

    @Test
    @SuppressWarnings("unchecked")
    void failedCallYieldsEmptyFleet() throws IOException {
        Call<FleetVehiclesResponseDto> failing = mock(Call.class);
        when(failing.execute()).thenReturn(Response.error(503,
                ResponseBody.create("{}", MediaType.get("application/json"))));
        Call<FleetVehiclesResponseDto> throwing = mock(Call.class);
        when(throwing.execute()).thenThrow(new IOException("connection refused"));
        when(api.getVehicles("available", "truck")).thenReturn(failing);
        when(api.getVehicles("available", "trailer")).thenReturn(throwing);

        assertTrue(client.getAvailableTrucks().isEmpty());
        assertTrue(client.getAvailableTrailers().isEmpty());
    }

    @Test
    void vehicleWithoutLocationIsParkedAtUnknown() {
        FleetVehicleDto dto = new FleetVehicleDto();
        assertEquals("Unknown", dto.warehouseOrUnknown());
        assertFalse(dto.isTemperatureControlled());
    }

    private static FleetVehicleDto vehicle(String id, String warehouse) {
        FleetVehicleDto dto = new FleetVehicleDto();
        dto.setId(id);
        dto.setName(id == null ? "unnamed" : "Vehicle " + id);
        FleetVehicleDto.VehicleLocationDto location = new FleetVehicleDto.VehicleLocationDto();
        location.setWarehouse(warehouse);
        dto.setLocation(location);
        return dto;
    }

    private static FleetVehiclesResponseDto response(FleetVehicleDto... vehicles) {
        FleetVehiclesResponseDto response = new FleetVehiclesResponseDto();
        response.setData(Arrays.asList(vehicles));
        return response;
    }
}
