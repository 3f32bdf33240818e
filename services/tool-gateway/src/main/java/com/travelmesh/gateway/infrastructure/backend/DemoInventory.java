package com.travelmesh.gateway.infrastructure.backend;

import com.travelmesh.agentapi.Domain;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Demo inventory for each domain, enough to exercise every tool. */
public final class DemoInventory {

    private static final String[][] CITIES = {
        {"JFK", "New York"},
        {"LAX", "Los Angeles"},
        {"ORD", "Chicago"},
        {"SFO", "San Francisco"},
        {"MIA", "Miami"},
        {"SEA", "Seattle"},
        {"BOS", "Boston"},
        {"DFW", "Dallas"},
        {"ATL", "Atlanta"},
        {"DEN", "Denver"},
    };

    private static final String[][] ROUTES = {
        {"JFK", "LAX", "SkyWays", "08:00", "11:25", "32900"},
        {"LAX", "JFK", "SkyWays", "13:10", "21:40", "31900"},
        {"JFK", "MIA", "Atlantic Air", "07:15", "10:20", "18900"},
        {"MIA", "JFK", "Atlantic Air", "16:45", "19:50", "19900"},
        {"ORD", "SFO", "Lakeshore", "09:30", "12:05", "24500"},
        {"SFO", "SEA", "Pacific Hop", "10:00", "12:05", "12900"},
        {"BOS", "MIA", "Atlantic Air", "06:40", "10:05", "21900"},
        {"ATL", "DEN", "Lakeshore", "14:20", "16:00", "17900"},
    };

    private static final String[][] VEHICLE_CATEGORIES = {
        {"economy", "Toyota", "Yaris", "3900"},
        {"compact", "Honda", "Civic", "4500"},
        {"suv", "Ford", "Explorer", "7900"},
        {"luxury", "BMW", "5 Series", "12900"},
    };

    private DemoInventory() {}

    public static Inventory forDomain(Domain domain) {
        return switch (domain) {
            case FLIGHTS -> flights();
            case LODGING -> lodging();
            case VEHICLES -> vehicles();
            case NONE -> throw new IllegalArgumentException("No inventory for domain 'none'");
        };
    }

    static Inventory flights() {
        List<Map<String, Object>> airports = new ArrayList<>();
        for (String[] city : CITIES) {
            airports.add(Map.of("code", city[0], "name", city[1]));
        }
        List<Map<String, Object>> flights = new ArrayList<>();
        int number = 1001;
        for (String[] route : ROUTES) {
            Map<String, Object> flight = new LinkedHashMap<>();
            flight.put("flight_id", "FL" + number);
            flight.put("flight_number", route[2].substring(0, 2).toUpperCase() + number);
            flight.put("airline", route[2]);
            flight.put("origin", route[0]);
            flight.put("origin_city", cityName(route[0]));
            flight.put("destination", route[1]);
            flight.put("destination_city", cityName(route[1]));
            flight.put("departure_time", route[3]);
            flight.put("arrival_time", route[4]);
            flight.put("price_cents", Long.parseLong(route[5]));
            flight.put("currency", "USD");
            flight.put("seats_available", 42);
            flights.add(flight);
            number++;
        }
        return new Inventory("flight_id", airports, flights);
    }

    static Inventory lodging() {
        List<Map<String, Object>> cities = new ArrayList<>();
        List<Map<String, Object>> hotels = new ArrayList<>();
        for (String[] city : CITIES) {
            cities.add(Map.of("code", city[0], "city", city[1]));
            hotels.add(hotel(city, 1, city[1] + " Grand Hotel", 5, 38900));
            hotels.add(hotel(city, 2, city[1] + " Budget Inn", 2, 8900));
        }
        return new Inventory("hotel_id", cities, hotels);
    }

    static Inventory vehicles() {
        List<Map<String, Object>> locations = new ArrayList<>();
        List<Map<String, Object>> vehicles = new ArrayList<>();
        for (String[] city : CITIES) {
            String locationId = city[0] + "-AP";
            locations.add(Map.of("location_id", locationId, "name", city[1] + " Airport", "city", city[1]));
            for (String[] category : VEHICLE_CATEGORIES) {
                Map<String, Object> vehicle = new LinkedHashMap<>();
                vehicle.put("vehicle_id", "VEH-" + city[0] + "-" + category[0].toUpperCase());
                vehicle.put("location", city[1]);
                vehicle.put("location_code", city[0]);
                vehicle.put("location_id", locationId);
                vehicle.put("category", category[0]);
                vehicle.put("make", category[1]);
                vehicle.put("model", category[2]);
                vehicle.put("daily_rate_cents", Long.parseLong(category[3]));
                vehicle.put("currency", "USD");
                vehicles.add(vehicle);
            }
        }
        return new Inventory("vehicle_id", locations, vehicles);
    }

    private static Map<String, Object> hotel(String[] city, int index, String name, int stars, long nightlyCents) {
        Map<String, Object> hotel = new LinkedHashMap<>();
        hotel.put("hotel_id", "HTL-" + city[0] + "-" + index);
        hotel.put("name", name);
        hotel.put("city", city[1]);
        hotel.put("city_code", city[0]);
        hotel.put("star_rating", stars);
        hotel.put("price_per_night_cents", nightlyCents);
        hotel.put("currency", "USD");
        hotel.put("room_types", List.of("standard", "deluxe"));
        return hotel;
    }

    private static String cityName(String code) {
        for (String[] city : CITIES) {
            if (city[0].equals(code)) {
                return city[1];
            }
        }
        return code;
    }
}
