package org.freightplan.engine.api;

import org.freightplan.engine.api.dto.DistanceMatrixDto;
import org.junit.jupiter.api.Test;
import retrofit2.Call;
import retrofit2.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GoogleMapsClientImplTest {

    private static final List<String> LOCATIONS = Arrays.asList("Winnipeg", "Regina");

    private final GoogleMapsClientImpl.DistanceMatrixApi api = mock(GoogleMapsClientImpl.DistanceMatrixApi.class);

    @Test
    void convertsMetresAndSecondsToKilometresAndMinutes() throws IOException {
        stub(matrix("OK", "OK", 571_000, 19_800));

        RouteMatrix result = new GoogleMapsClientImpl(api, "key").routeMatrix(LOCATIONS);

        assertEquals(2, result.size());
        assertEquals(571.0, result.getDistanceKm()[0][1], 1e-9);
        assertEquals(330.0, result.getTimeMinutes()[0][1], 1e-9);
        assertEquals(0.0, result.getDistanceKm()[0][0], 1e-9);
    }

    @Test
    void nonOkStatusFailsTheWholeCall() throws IOException {
        stub(matrix("OVER_QUERY_LIMIT", "OK", 1, 1));

        assertThrows(MappingServiceException.class,
                () -> new GoogleMapsClientImpl(api, "key").routeMatrix(LOCATIONS));
    }

    @Test
    void unroutableElementFailsTheWholeCall() throws IOException {
        stub(matrix("OK", "ZERO_RESULTS", 1, 1));

        assertThrows(MappingServiceException.class,
                () -> new GoogleMapsClientImpl(api, "key").routeMatrix(LOCATIONS));
    }

    @Test
    @SuppressWarnings("unchecked")
    void networkErrorIsWrapped() throws IOException {
        Call<DistanceMatrixDto> call = mock(Call.class);
        when(call.execute()).thenThrow(new IOException("timeout"));
        when(api.distanceMatrix(anyString(), anyString(), anyString(), anyString(), anyString())).thenReturn(call);

        MappingServiceException e = assertThrows(MappingServiceException.class,
                () -> new GoogleMapsClientImpl(api, "key").routeMatrix(LOCATIONS));
        assertEquals(IOException.class, e.getCause().getClass());
    }

    @Test
    void missingKeyFailsWithoutCallingTheService() {
        assertThrows(MappingServiceException.class,
                () -> new GoogleMapsClientImpl(api, "").routeMatrix(LOCATIONS));
        verifyNoInteractions(api);
    }

    @SuppressWarnings("unchecked")
    private void stub(DistanceMatrixDto body) throws IOException {
        Call<DistanceMatrixDto> call = mock(Call.class);
        when(call.execute()).thenReturn(Response.success(body));
        when(api.distanceMatrix("Winnipeg|Regina", "Winnipeg|Regina", "driving", "metric", "key")).thenReturn(call);
    }

    /**
     * 2x2 matrix with the same off-diagonal values in both directions.
     */
    private static DistanceMatrixDto matrix(String status, String elementStatus, double metres, double seconds) {
        List<DistanceMatrixDto.RowDto> rows = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            List<DistanceMatrixDto.ElementDto> elements = new ArrayList<>();
            for (int j = 0; j < 2; j++) {
                DistanceMatrixDto.ElementDto element = new DistanceMatrixDto.ElementDto();
                element.setStatus(i == j ? "OK" : elementStatus);
                element.setDistance(value(i == j ? 0 : metres));
                element.setDuration(value(i == j ? 0 : seconds));
                elements.add(element);
            }
            DistanceMatrixDto.RowDto row = new DistanceMatrixDto.RowDto();
            row.setElements(elements);
            rows.add(row);
        }
        DistanceMatrixDto dto = new DistanceMatrixDto();
        dto.setStatus(status);
        dto.setRows(rows);
        return dto;
    }

    private static DistanceMatrixDto.ValueDto value(double v) {
        DistanceMatrixDto.ValueDto value = new DistanceMatrixDto.ValueDto();
        value.setValue(v);
        return value;
    }
}
