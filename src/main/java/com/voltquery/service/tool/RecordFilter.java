package com.voltquery.service.tool;

import com.voltquery.model.DetectedLocation;
import lombok.Value;

import java.util.Locale;
import java.util.Optional;

/**
 * Metadata key/value that selects a tool's indexed records, usually a location.
 */
@Value
public class RecordFilter {

    public static final String ZIP = "zip";
    public static final String CITY = "city";
    public static final String STATE = "state";
    public static final String GRID = "grid";
    public static final String TOPIC = "topic";

    String key;
    String value;

    public static Optional<RecordFilter> forLocation(DetectedLocation location) {
        if (location == null || location.getLocationType() == null) {
            return Optional.empty();
        }
        return Optional.of(switch (location.getLocationType()) {
            case ZIP_CODE -> new RecordFilter(ZIP, location.getZipCode());
            case CITY_STATE -> new RecordFilter(CITY, location.getCity() + ", " + location.getState());
            case STATE -> new RecordFilter(STATE, location.getState());
            // two decimals is roughly a 1 km cell
            case COORDINATES -> new RecordFilter(GRID, String.format(Locale.ROOT, "%.2f,%.2f",
                    location.getLatitude(), location.getLongitude()));
        });
    }
}
