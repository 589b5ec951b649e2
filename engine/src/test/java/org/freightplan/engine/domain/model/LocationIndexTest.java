package org.freightplan.engine.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocationIndexTest {

    @Test
    void warehousesComeFirstThenOriginsThenDestinations() {
        List<Truck> trucks = Arrays.asList(
                new Truck("T1", "Truck 1", "Winnipeg", 0, 10),
                new Truck("T2", "Truck 2", "Calgary", 0, 10),
                new Truck("T3", "Truck 3", "Winnipeg", 0, 10));
        List<Order> orders = Arrays.asList(
                order("O1", "Regina", "Toronto"),
                order("O2", "Winnipeg", "Calgary"),
                order("O3", "Regina", "Montreal"));

        LocationIndex index = LocationIndex.of(trucks, orders);

        assertEquals(Arrays.asList("Winnipeg", "Calgary", "Regina", "Toronto", "Montreal"), index.getLocations());
        assertEquals(5, index.size());
        assertEquals(2, index.requireNode("Regina"));
        assertEquals("Toronto", index.locationAt(3));
    }

    @Test
    void unknownLocationIsReportedAsMissing() {
        LocationIndex index = LocationIndex.ofLocations(Collections.singletonList("Winnipeg"));

        assertFalse(index.nodeOf("Vancouver").isPresent());
        assertThrows(IllegalArgumentException.class, () -> index.requireNode("Vancouver"));
    }

    private static Order order(String id, String from, String to) {
        return new Order.Builder().id(id).shipFrom(from).shipTo(to).weightKg(100).build();
    }
}
