package org.Aayush.planner.catalog;

import org.Aayush.core.time.TimeUtils;
import org.Aayush.planner.transit.TransitCostTable;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, start-ordered collection of event occurrences for one optimization run.
 *
 * <p>Occurrences are sorted ascending by start; ties keep input order. The position of an
 * occurrence in this order is its identity throughout the solver. Every venue is checked
 * against the transit table the catalog is bound to.</p>
 */
public final class EventCatalog {
    private static final Comparator<EventOccurrence> BY_START = Comparator.comparing(EventOccurrence::getStart);

    private final TransitCostTable transitTable;
    private final List<EventOccurrence> occurrences;

    private EventCatalog(TransitCostTable transitTable, List<EventOccurrence> occurrences) {
        this.transitTable = transitTable;
        this.occurrences = occurrences;
    }

    /**
     * Expands ingestion listings into a catalog.
     *
     * @param listings titled works with their showings.
     * @param transitTable table every showing venue must belong to.
     * @return validated catalog.
     * @throws MalformedEventException when a listing or showing is invalid.
     */
    public static EventCatalog fromListings(Collection<EventListing> listings, TransitCostTable transitTable) {
        Objects.requireNonNull(listings, "listings");
        Builder builder = builder(transitTable);
        for (EventListing listing : listings) {
            builder.listing(listing);
        }
        return builder.build();
    }

    /**
     * Returns an empty catalog bound to the given table.
     */
    public static EventCatalog empty(TransitCostTable transitTable) {
        return builder(transitTable).build();
    }

    public static Builder builder(TransitCostTable transitTable) {
        return new Builder(Objects.requireNonNull(transitTable, "transitTable"));
    }

    public int size() {
        return occurrences.size();
    }

    public boolean isEmpty() {
        return occurrences.isEmpty();
    }

    /**
     * Returns the occurrence at one catalog index.
     */
    public EventOccurrence get(int index) {
        return occurrences.get(index);
    }

    /**
     * Returns all occurrences in catalog order.
     */
    public List<EventOccurrence> occurrences() {
        return occurrences;
    }

    public TransitCostTable transitTable() {
        return transitTable;
    }

    /**
     * Accumulates occurrences and freezes them into start order.
     */
    public static final class Builder {
        private final TransitCostTable transitTable;
        private final List<EventOccurrence> pending = new ArrayList<>();

        private Builder(TransitCostTable transitTable) {
            this.transitTable = transitTable;
        }

        /**
         * Adds one occurrence after checking its venue.
         */
        public Builder add(EventOccurrence occurrence) {
            Objects.requireNonNull(occurrence, "occurrence");
            if (!transitTable.containsVenue(occurrence.getVenue())) {
                throw new MalformedEventException(
                        MalformedEventException.REASON_UNKNOWN_VENUE,
                        "venue " + occurrence.getVenue() + " of \"" + occurrence.getTitle()
                                + "\" is not in the transit table"
                );
            }
            pending.add(occurrence);
            return this;
        }

        public Builder add(String title, LocalDateTime start, long runningMinutes, String venue) {
            return add(EventOccurrence.of(title, start, runningMinutes, venue));
        }

        /**
         * Adds every showing of one listing.
         */
        public Builder listing(EventListing listing) {
            Objects.requireNonNull(listing, "listing");
            if (listing.getShowings().isEmpty()) {
                throw new MalformedEventException(
                        MalformedEventException.REASON_NO_OCCURRENCES,
                        "listing \"" + listing.getTitle() + "\" has no showings"
                );
            }
            for (EventListing.Showing showing : listing.getShowings()) {
                add(listing.getTitle(), parseStart(listing.getTitle(), showing), listing.getRunningMinutes(), showing.venue());
            }
            return this;
        }

        public EventCatalog build() {
            List<EventOccurrence> sorted = new ArrayList<>(pending);
            // List.sort is stable, so equal starts keep insertion order.
            sorted.sort(BY_START);
            return new EventCatalog(transitTable, List.copyOf(sorted));
        }

        private static LocalDateTime parseStart(String title, EventListing.Showing showing) {
            if (showing == null || showing.start() == null || showing.start().isBlank()) {
                throw new MalformedEventException(
                        MalformedEventException.REASON_START_REQUIRED,
                        "showing of \"" + title + "\" has no start"
                );
            }
            try {
                return TimeUtils.parseTimestamp(showing.start());
            } catch (DateTimeParseException ex) {
                throw new MalformedEventException(
                        MalformedEventException.REASON_UNPARSEABLE_START,
                        "cannot parse start \"" + showing.start() + "\" of \"" + title + "\"",
                        ex
                );
            }
        }
    }
}
