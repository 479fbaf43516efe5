package com.voltquery.service.location;

import com.voltquery.model.DetectedLocation;
import com.voltquery.model.DetectedLocation.LocationType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based location detection in question text.
 * Tried in order: coordinates, zip code, "City, ST", well-known city name, full state name,
 * upper-case state code. Lower-case two-letter codes are ignored ("in", "or").
 */
@Component
public class LocationExtractor {

    private static final Pattern COORDINATES =
            Pattern.compile("(-?\\d{1,2}\\.\\d+)\\s*,\\s*(-?\\d{1,3}\\.\\d+)");
    private static final Pattern ZIP_CODE = Pattern.compile("\\b(\\d{5})(?:-\\d{4})?\\b");
    private static final Pattern CITY_STATE =
            Pattern.compile("((?:[A-Z][a-z]+\\.?\\s){0,2}[A-Z][a-z]+),\\s*([A-Z]{2})\\b");
    private static final Pattern STATE_CODE = Pattern.compile("\\b([A-Z]{2})\\b");

    static final Set<String> STATE_CODES = Set.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA",
            "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME", "MD",
            "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
            "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC",
            "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY", "DC");

    private static final Map<String, String> STATE_NAMES = new LinkedHashMap<>();
    private static final Map<String, String> MAJOR_CITIES = new LinkedHashMap<>();

    static {
        // Multi-word names first so "west virginia" wins over "virginia"
        String[][] states = {
                {"district of columbia", "DC"}, {"new hampshire", "NH"}, {"new jersey", "NJ"},
                {"new mexico", "NM"}, {"new york", "NY"}, {"north carolina", "NC"}, {"north dakota", "ND"},
                {"rhode island", "RI"}, {"south carolina", "SC"}, {"south dakota", "SD"},
                {"west virginia", "WV"}, {"alabama", "AL"}, {"alaska", "AK"}, {"arizona", "AZ"},
                {"arkansas", "AR"}, {"california", "CA"}, {"colorado", "CO"}, {"connecticut", "CT"},
                {"delaware", "DE"}, {"florida", "FL"}, {"georgia", "GA"}, {"hawaii", "HI"}, {"idaho", "ID"},
                {"illinois", "IL"}, {"indiana", "IN"}, {"iowa", "IA"}, {"kansas", "KS"}, {"kentucky", "KY"},
                {"louisiana", "LA"}, {"maine", "ME"}, {"maryland", "MD"}, {"massachusetts", "MA"},
                {"michigan", "MI"}, {"minnesota", "MN"}, {"mississippi", "MS"}, {"missouri", "MO"},
                {"montana", "MT"}, {"nebraska", "NE"}, {"nevada", "NV"}, {"ohio", "OH"}, {"oklahoma", "OK"},
                {"oregon", "OR"}, {"pennsylvania", "PA"}, {"tennessee", "TN"}, {"texas", "TX"}, {"utah", "UT"},
                {"vermont", "VT"}, {"virginia", "VA"}, {"washington", "WA"}, {"wisconsin", "WI"},
                {"wyoming", "WY"}};
        for (String[] state : states) {
            STATE_NAMES.put(state[0], state[1]);
        }

        String[][] cities = {
                {"los angeles", "CA"}, {"san francisco", "CA"}, {"san diego", "CA"}, {"san jose", "CA"},
                {"san antonio", "TX"}, {"fort worth", "TX"}, {"new york city", "NY"}, {"denver", "CO"},
                {"chicago", "IL"}, {"houston", "TX"}, {"phoenix", "AZ"}, {"philadelphia", "PA"},
                {"dallas", "TX"}, {"austin", "TX"}, {"jacksonville", "FL"}, {"columbus", "OH"},
                {"charlotte", "NC"}, {"indianapolis", "IN"}, {"seattle", "WA"}, {"boston", "MA"}};
        for (String[] city : cities) {
            MAJOR_CITIES.put(city[0], city[1]);
        }
    }

    /**
     * First location found in the text, if any.
     */
    public Optional<DetectedLocation> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Matcher coordinates = COORDINATES.matcher(text);
        if (coordinates.find()) {
            double latitude = Double.parseDouble(coordinates.group(1));
            double longitude = Double.parseDouble(coordinates.group(2));
            if (Math.abs(latitude) <= 90 && Math.abs(longitude) <= 180) {
                return Optional.of(DetectedLocation.builder()
                        .latitude(latitude)
                        .longitude(longitude)
                        .locationType(LocationType.COORDINATES)
                        .build());
            }
        }

        Matcher zip = ZIP_CODE.matcher(text);
        if (zip.find()) {
            return Optional.of(DetectedLocation.builder()
                    .zipCode(zip.group(1))
                    .locationType(LocationType.ZIP_CODE)
                    .build());
        }

        Matcher cityState = CITY_STATE.matcher(text);
        while (cityState.find()) {
            if (STATE_CODES.contains(cityState.group(2))) {
                return Optional.of(DetectedLocation.builder()
                        .city(cityState.group(1))
                        .state(cityState.group(2))
                        .locationType(LocationType.CITY_STATE)
                        .build());
            }
        }

        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> city : MAJOR_CITIES.entrySet()) {
            if (containsWord(lower, city.getKey())) {
                return Optional.of(DetectedLocation.builder()
                        .city(titleCase(city.getKey()))
                        .state(city.getValue())
                        .locationType(LocationType.CITY_STATE)
                        .build());
            }
        }

        for (Map.Entry<String, String> state : STATE_NAMES.entrySet()) {
            if (containsWord(lower, state.getKey())) {
                return Optional.of(stateLocation(state.getValue()));
            }
        }

        Matcher stateCode = STATE_CODE.matcher(text);
        while (stateCode.find()) {
            if (STATE_CODES.contains(stateCode.group(1))) {
                return Optional.of(stateLocation(stateCode.group(1)));
            }
        }
        return Optional.empty();
    }

    private static DetectedLocation stateLocation(String code) {
        return DetectedLocation.builder()
                .state(code)
                .locationType(LocationType.STATE)
                .build();
    }

    private static boolean containsWord(String text, String phrase) {
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b").matcher(text).find();
    }

    private static String titleCase(String text) {
        StringBuilder result = new StringBuilder();
        for (String word : text.split(" ")) {
            if (!result.isEmpty()) {
                result.append(' ');
            }
            result.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return result.toString();
    }
}
