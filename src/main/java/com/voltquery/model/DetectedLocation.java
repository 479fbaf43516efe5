package com.voltquery.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Location mentioned in a question.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DetectedLocation {

    public enum LocationType {
        ZIP_CODE, CITY_STATE, STATE, COORDINATES
    }

    private String zipCode;
    private String city;

    /**
     * Two-letter state code.
     */
    private String state;

    private Double latitude;
    private Double longitude;
    private LocationType locationType;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    /**
     * Short human-readable form used in sub-questions and logs.
     */
    public String describe() {
        return switch (locationType) {
            case ZIP_CODE -> "zip " + zipCode;
            case CITY_STATE -> city + ", " + state;
            case STATE -> state;
            case COORDINATES -> latitude + "," + longitude;
        };
    }
}
