package org.decentmobility.testutil;

import org.decentmobility.model.Agent;
import org.decentmobility.model.Alternative;
import org.decentmobility.model.GridLocation;
import org.decentmobility.model.Location;
import org.decentmobility.model.LocationRole;
import org.decentmobility.model.NamedLocation;
import org.decentmobility.model.Need;
import org.decentmobility.model.TripPurpose;

import java.util.List;

/**
 * Shared test fixture factory for matching, evaluation and selection tests.
 */
public final class MobilityFixtures {
    public static final GridLocation A = GridLocation.of(0.0d, 0.0d);
    public static final GridLocation B = GridLocation.of(1.0d, 0.0d);

    public static final NamedLocation HOME = NamedLocation.of("home");
    public static final NamedLocation SUPERMARKET = NamedLocation.of("supermarket");
    public static final NamedLocation SCHOOL = NamedLocation.of("school");

    private MobilityFixtures() {
    }

    /**
     * Commuter living at A, working at B, needing five trips each way and no plan.
     */
    public static Agent commuter() {
        return Agent.builder()
                .location(LocationRole.HOME, A)
                .location(LocationRole.WORK, B)
                .need(Need.of(TripPurpose.COMMUTE, LocationRole.HOME, LocationRole.WORK, 5))
                .need(Need.of(TripPurpose.COMMUTE, LocationRole.WORK, LocationRole.HOME, 5))
                .build();
    }

    /**
     * Commuter with a bus alternative in each direction.
     */
    public static Agent commuterByBus() {
        return commuter().withPlan(List.of(
                Alternative.of(A, B, "bus"),
                Alternative.of(B, A, "bus")
        ));
    }

    /**
     * Catalog alternative from {@link #HOME} with explicit distance, energy and time.
     */
    public static Alternative option(Location destination, String mode, double distance, double energy, double time) {
        return Alternative.builder()
                .origin(HOME)
                .destination(destination)
                .mode(mode)
                .distance(distance)
                .energy(energy)
                .time(time)
                .build();
    }

    /**
     * Supermarket catalog with five modes of distinct energy and time.
     */
    public static List<Alternative> supermarketCatalog() {
        return List.of(
                option(SUPERMARKET, "car", 2.0d, 4.0d, 6.0d),
                option(SUPERMARKET, "bus", 2.0d, 1.5d, 15.0d),
                option(SUPERMARKET, "bike", 2.0d, 0.2d, 12.0d),
                option(SUPERMARKET, "walk", 2.0d, 0.0d, 30.0d),
                option(SUPERMARKET, "e-scooter", 2.0d, 0.3d, 9.0d)
        );
    }
}
