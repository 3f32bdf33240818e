package com.travelmesh.gateway.infrastructure.backend;

import com.travelmesh.gateway.domain.backend.BackendException;
import com.travelmesh.gateway.domain.backend.BookingBackend;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backend over a fixed inventory with bookings held in memory.
 *
 * <p>A search criterion {@code k} matches an offer when any of the offer fields {@code k},
 * {@code k_code}, {@code k_city} or {@code k_id} equals it, ignoring case, so "Miami" and "MIA"
 * both find Miami offers. Criteria no offer field corresponds to (dates, guest counts) are
 * ignored.
 */
public class InMemoryBookingBackend implements BookingBackend {

    private static final List<String> FIELD_SUFFIXES = List.of("", "_code", "_city", "_id");

    private final Inventory inventory;
    private final Map<String, Map<String, Object>> offers = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> bookings = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryBookingBackend(Inventory inventory, Clock clock) {
        this.inventory = inventory;
        this.clock = clock;
        for (Map<String, Object> offer : inventory.offers()) {
            offers.put(String.valueOf(offer.get(inventory.idField())), Collections.unmodifiableMap(new LinkedHashMap<>(offer)));
        }
    }

    @Override
    public List<Map<String, Object>> search(Map<String, Object> criteria) {
        return offers.values().stream()
                .filter(offer -> matches(offer, criteria))
                .map(InMemoryBookingBackend::copy)
                .toList();
    }

    @Override
    public Optional<Map<String, Object>> findOffer(String offerId) {
        return Optional.ofNullable(offers.get(offerId)).map(InMemoryBookingBackend::copy);
    }

    @Override
    public Map<String, Object> book(String offerId, Map<String, Object> details) {
        Map<String, Object> offer = offers.get(offerId);
        if (offer == null) {
            throw new BackendException("Offer not found: " + offerId);
        }
        Map<String, Object> booking = new LinkedHashMap<>();
        booking.put("booking_id", newConfirmationCode());
        booking.put(inventory.idField(), offerId);
        booking.put("status", "confirmed");
        booking.put("created_at", clock.instant().toString());
        booking.putAll(details);
        booking.put("offer", offer);
        bookings.put((String) booking.get("booking_id"), booking);
        return copy(booking);
    }

    @Override
    public Optional<Map<String, Object>> get(String bookingId) {
        return Optional.ofNullable(bookings.get(normalize(bookingId))).map(InMemoryBookingBackend::copy);
    }

    @Override
    public Map<String, Object> cancel(String bookingId) {
        String id = normalize(bookingId);
        Map<String, Object> cancelled = bookings.computeIfPresent(id, (key, booking) -> {
            if ("cancelled".equals(booking.get("status"))) {
                throw new BackendException("Booking already cancelled: " + key);
            }
            Map<String, Object> updated = new LinkedHashMap<>(booking);
            updated.put("status", "cancelled");
            updated.put("cancelled_at", clock.instant().toString());
            return updated;
        });
        if (cancelled == null) {
            throw new BackendException("Booking not found: " + bookingId);
        }
        return copy(cancelled);
    }

    @Override
    public List<Map<String, Object>> listLocations() {
        return inventory.locations();
    }

    public int bookingCount() {
        return bookings.size();
    }

    private static boolean matches(Map<String, Object> offer, Map<String, Object> criteria) {
        for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
            if (criterion.getValue() == null) {
                continue;
            }
            String wanted = criterion.getValue().toString().trim();
            boolean known = false;
            boolean matched = false;
            for (String suffix : FIELD_SUFFIXES) {
                Object value = offer.get(criterion.getKey() + suffix);
                if (value != null) {
                    known = true;
                    matched |= value.toString().equalsIgnoreCase(wanted);
                }
            }
            if (known && !matched) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return new LinkedHashMap<>(source);
    }

    private static String normalize(String bookingId) {
        return bookingId == null ? "" : bookingId.trim().toUpperCase(Locale.ROOT);
    }

    private static String newConfirmationCode() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
