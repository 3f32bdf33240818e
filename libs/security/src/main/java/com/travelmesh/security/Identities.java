package com.travelmesh.security;

/**
 * Well-known component identities of the stock deployment.
 */
public final class Identities {

    public static final String WEB_CLIENT = "travel-web-client";
    public static final String TRAVEL_PLANNER = "travel-planner";

    public static final String AIRLINE_AGENT = "airline-agent";
    public static final String HOTEL_AGENT = "hotel-agent";
    public static final String CAR_RENTAL_AGENT = "car-rental-agent";

    public static final String AIRLINE_GATEWAY = "airline-gateway";
    public static final String HOTEL_GATEWAY = "hotel-gateway";
    public static final String CAR_RENTAL_GATEWAY = "car-rental-gateway";

    /** Identity assumed when a caller presents none. Never registered. */
    public static final String ANONYMOUS = "anonymous";

    private Identities() {
        // utility class
    }

    /** Maps a missing or blank presented identity to {@link #ANONYMOUS}. */
    public static String orAnonymous(String presented) {
        return presented == null || presented.isBlank() ? ANONYMOUS : presented.trim();
    }
}
