package org.Aayush.app;

import lombok.experimental.UtilityClass;
import org.Aayush.planner.catalog.EventListing;
import org.Aayush.planner.transit.TransitCostTable;

import java.util.List;

/**
 * Bundled film-festival programme used for smoke runs.
 *
 * <p>Transit times assume travel by bicycle, including time to find parking.</p>
 */
@UtilityClass
public class SampleProgramme {

    public static TransitCostTable transitTable() {
        return TransitCostTable.builder()
                .sameVenueMinutes(TransitCostTable.DEFAULT_SAME_VENUE_MINUTES)
                .symmetricCost("STA", "CAM", 20)
                .symmetricCost("STA", "EVR", 15)
                .symmetricCost("STA", "FLH", 15)
                .symmetricCost("STA", "VUE", 15)
                .symmetricCost("CAM", "EVR", 20)
                .symmetricCost("CAM", "FLH", 10)
                .symmetricCost("CAM", "VUE", 30)
                .symmetricCost("EVR", "FLH", 20)
                .symmetricCost("EVR", "VUE", 10)
                .symmetricCost("FLH", "VUE", 30)
                .build();
    }

    public static List<EventListing> listings() {
        return List.of(
                listing("After Yang", 96, "2022-08-20 19:00", "VUE"),
                listing("Fogaréu", 100, "2022-08-16 16:30", "VUE", "2022-08-17 19:00", "FLH"),
                listing("Leonor Will Never Die", 101, "2022-08-16 20:35", "FLH", "2022-08-18 15:30", "VUE"),
                listing("LOLA", 78, "2022-08-15 21:00", "EVR", "2022-08-19 16:00", "VUE"),
                listing("Full Time", 87, "2022-08-17 18:15", "VUE", "2022-08-18 16:00", "FLH"),
                listing("Special Delivery", 109, "2022-08-18 21:35", "VUE", "2022-08-19 16:20", "VUE"),
                listing("Anonymous Club", 83, "2022-08-15 19:00", "CAM", "2022-08-17 21:30", "VUE"),
                listing("Hallelujah", 115, "2022-08-17 15:50", "VUE", "2022-08-20 16:50", "FLH"),
                listing("The Territory", 85, "2022-08-13 14:00", "VUE", "2022-08-19 18:00", "EVR"),
                listing("The Forgiven", 117, "2022-08-17 20:35", "VUE"),
                listing("The Score", 114, "2022-08-18 19:00", "VUE", "2022-08-20 13:30", "FLH"),
                listing("AEIOU", 104, "2022-08-15 21:10", "VUE", "2022-08-16 14:00", "FLH"),
                listing("Axiom", 112, "2022-08-14 17:30", "VUE", "2022-08-16 11:30", "VUE"),
                listing("Phantom Project", 97, "2022-08-14 14:15", "VUE", "2022-08-15 21:20", "CAM"),
                listing("The Plains", 180, "2022-08-13 18:30", "FLH"),
                listing("Shadow", 56, "2022-08-16 18:30", "VUE"),
                listing("EIFF New Visions", 68, "2022-08-14 15:40", "FLH"),
                listing("Scotland's Voices", 79, "2022-08-13 15:30", "FLH"),
                listing("The Making of A Bear Named Wojtek", 60, "2022-08-14 11:30", "FLH")
        );
    }

    /**
     * @param startsAndVenues alternating start text and venue code.
     */
    private static EventListing listing(String title, long runningMinutes, String... startsAndVenues) {
        EventListing.EventListingBuilder builder = EventListing.builder()
                .title(title)
                .runningMinutes(runningMinutes);
        for (int i = 0; i + 1 < startsAndVenues.length; i += 2) {
            builder.showing(new EventListing.Showing(startsAndVenues[i], startsAndVenues[i + 1]));
        }
        return builder.build();
    }
}
