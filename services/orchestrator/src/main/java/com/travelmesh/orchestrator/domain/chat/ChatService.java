package com.travelmesh.orchestrator.domain.chat;

import com.travelmesh.agentapi.AgentRequest;
import com.travelmesh.agentapi.AgentResponse;
import com.travelmesh.agentapi.Domain;
import com.travelmesh.agentapi.ItineraryItemSnapshot;
import com.travelmesh.agentapi.TripSnapshot;
import com.travelmesh.observability.MetricFactory;
import com.travelmesh.observability.SpanHelper;
import com.travelmesh.orchestrator.domain.agent.AgentClient;
import com.travelmesh.orchestrator.domain.agent.AgentRegistry;
import com.travelmesh.orchestrator.domain.agent.AgentStatus;
import com.travelmesh.orchestrator.domain.agent.DiscoveryResult;
import com.travelmesh.orchestrator.domain.context.ContextClient;
import com.travelmesh.orchestrator.domain.context.NewItineraryItem;
import com.travelmesh.orchestrator.domain.context.UserContext;
import com.travelmesh.orchestrator.domain.intent.DestinationExtractor;
import com.travelmesh.orchestrator.domain.intent.Intent;
import com.travelmesh.orchestrator.domain.intent.IntentClassifier;
import com.travelmesh.security.ErrorKind;
import com.travelmesh.security.TravelMeshException;
import com.travelmesh.security.UpstreamUnavailableException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one chat message: fetch context, classify, then answer, create a trip or dispatch to
 * the domain's agent. A successful booking made for the active trip is appended to it.
 */
public class ChatService {

    static final String DISPATCH_METRIC = "travelmesh.orchestrator.dispatches";

    static final String ATTR_INTENT_TYPE = "travelmesh.intent.type";
    static final String ATTR_INTENT_DOMAIN = "travelmesh.intent.domain";
    static final String ATTR_ROUTE = "travelmesh.route";
    static final String ATTR_AGENT = "travelmesh.agent";

    static final String GENERAL_HELP = """
            I'm your travel planner. I can help you:
            - plan a new trip
            - search for flights, hotels and rental cars
            - manage your bookings
            - review your itinerary
            What would you like to do?""";

    static final String MULTI_DOMAIN_PROMPT =
            "I can help you plan your trip! What would you like to start with: flights, hotels or a rental car?";

    private static final List<String> BOOKING_KEYS = List.of("booking", "reservation", "rental");

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final ContextClient contexts;
    private final IntentClassifier classifier;
    private final DestinationExtractor destinations;
    private final AgentRegistry registry;
    private final AgentClient agents;
    private final ItineraryFormatter formatter;
    private final MetricFactory metrics;
    private final SpanHelper spans;

    public ChatService(
            ContextClient contexts,
            IntentClassifier classifier,
            DestinationExtractor destinations,
            AgentRegistry registry,
            AgentClient agents,
            ItineraryFormatter formatter,
            MetricFactory metrics,
            SpanHelper spans) {
        this.contexts = contexts;
        this.classifier = classifier;
        this.destinations = destinations;
        this.registry = registry;
        this.agents = agents;
        this.formatter = formatter;
        this.metrics = metrics;
        this.spans = spans;
    }

    public ChatResponse chat(ChatRequest request) {
        return spans.inSpan("chat", () -> handle(request));
    }

    private ChatResponse handle(ChatRequest request) {
        Optional<UserContext> stored = fetchContext(request.callerId());
        boolean contextUsed = stored.isPresent();
        UserContext context = stored
                .map(found -> found.selectTrip(request.tripId(), this::fetchItinerary))
                .orElseGet(() -> UserContext.newUser(request.callerId()));

        Intent intent = classifier.classify(request.message(), context.hasActiveTrip());
        log.info("Classified intent: type={} domain={} route={}",
                intent.type().value(), intent.domain().value(), intent.route());
        SpanHelper.annotateCurrent(ATTR_INTENT_TYPE, intent.type().value());
        SpanHelper.annotateCurrent(ATTR_INTENT_DOMAIN, intent.domain().value());
        SpanHelper.annotateCurrent(ATTR_ROUTE, intent.route().name().toLowerCase(Locale.ROOT));

        return switch (intent.route()) {
            case ITINERARY_QUERY -> answerFromContext(intent, context, contextUsed);
            case TRIP_CREATION -> createTrip(request, intent, contextUsed);
            case DISPATCH -> dispatch(request, intent, context, contextUsed);
            case MULTI_DOMAIN -> new ChatResponse(
                    true, MULTI_DOMAIN_PROMPT, intent.type(), null, null, List.of(), null, contextUsed, null);
            case GENERAL -> new ChatResponse(
                    true, GENERAL_HELP, intent.type(), null, null, List.of(), null, contextUsed, null);
        };
    }

    private Optional<UserContext> fetchContext(String userId) {
        try {
            return contexts.findContext(userId);
        } catch (TravelMeshException e) {
            log.warn("Context unavailable, treating {} as a new user: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    private List<ItineraryItemSnapshot> fetchItinerary(String tripId) {
        try {
            return contexts.findItinerary(tripId);
        } catch (TravelMeshException e) {
            log.warn("Itinerary of trip {} unavailable: {}", tripId, e.getMessage());
            return List.of();
        }
    }

    private ChatResponse answerFromContext(Intent intent, UserContext context, boolean contextUsed) {
        String message = contextUsed
                ? formatter.format(context)
                : "I couldn't find any trip information. Would you like to plan a new trip?";
        return new ChatResponse(true, message, intent.type(), null, null, List.of(), null, contextUsed, null);
    }

    private ChatResponse createTrip(ChatRequest request, Intent intent, boolean contextUsed) {
        String destination = destinations.extract(request.message());
        try {
            TripSnapshot trip = contexts.createTrip(request.callerId(), destination);
            log.info("Created trip {} to {}", trip.tripId(), destination);
            return new ChatResponse(
                    true,
                    "I've started planning your trip to " + destination
                            + "! Would you like me to search for flights, hotels or a rental car?",
                    intent.type(), null, null, List.of(), Map.of("trip", trip), contextUsed, null);
        } catch (TravelMeshException e) {
            log.warn("Trip creation failed: {}", e.getMessage());
            return new ChatResponse(
                    false, "I had trouble creating your trip. Please try again.",
                    intent.type(), null, null, List.of(), null, contextUsed, e.errorKind().name());
        }
    }

    private ChatResponse dispatch(ChatRequest request, Intent intent, UserContext context, boolean contextUsed) {
        Domain domain = intent.domain();
        AgentStatus agent = registry.find(domain).orElse(null);
        if (agent == null || !agent.healthy()) {
            String agentId = agent == null ? null : agent.agentId();
            log.warn("No healthy agent for {}; not dispatching", domain.value());
            record(domain, "agent_unhealthy");
            return new ChatResponse(
                    false, "The " + domain.value() + " assistant is not available right now. Please try again later.",
                    intent.type(), domain, agentId, List.of(), null, contextUsed, ErrorKind.UPSTREAM_UNAVAILABLE.name());
        }
        SpanHelper.annotateCurrent(ATTR_AGENT, agent.agentId());

        AgentRequest agentRequest = new AgentRequest(
                request.message(),
                context.toDispatchContext().withRequest(request.parameters(), request.confirmed()),
                request.conversationId());
        AgentResponse response;
        try {
            response = agents.invoke(agent.endpoint(), agentRequest);
        } catch (TravelMeshException e) {
            if (e instanceof UpstreamUnavailableException) {
                registry.recordDiscovery(domain, DiscoveryResult.unreachable(e.errorKind().name()));
            }
            log.warn("Dispatch to {} failed with {}: {}", agent.agentId(), e.errorKind(), e.getMessage());
            record(domain, e.errorKind().name().toLowerCase(Locale.ROOT));
            return new ChatResponse(
                    false, "I couldn't reach the " + domain.value() + " assistant. Please try again later.",
                    intent.type(), domain, agent.agentId(), List.of(), null, contextUsed, e.errorKind().name());
        }

        if (!response.success()) {
            record(domain, "agent_failure");
            String error = response.error() == null ? ErrorKind.INTERNAL.name() : response.error();
            return new ChatResponse(false, response.message(), intent.type(), domain, agent.agentId(),
                    response.toolsCalled(), response.data(), contextUsed, error);
        }

        if (intent.addsToActiveTrip() && context.hasActiveTrip()) {
            appendBooking(context.activeTrip(), domain, response);
        }
        record(domain, "success");
        return new ChatResponse(true, response.message(), intent.type(), domain, agent.agentId(),
                response.toolsCalled(), response.data(), contextUsed, null);
    }

    /** Best effort: the booking already exists at the backend, so a failed append is only logged. */
    private void appendBooking(TripSnapshot trip, Domain domain, AgentResponse response) {
        Optional<Map<String, Object>> booking = bookingRecord(response);
        if (booking.isEmpty()) {
            return;
        }
        Map<String, Object> record = booking.get();
        NewItineraryItem item = new NewItineraryItem(
                itemType(domain),
                stringOrNull(record.get("booking_id")),
                providerOf(record),
                "confirmed",
                record);
        try {
            contexts.appendItineraryItem(trip.tripId(), item);
            log.info("Added {} booking {} to trip {}", item.itemType(), item.bookingReference(), trip.tripId());
        } catch (TravelMeshException e) {
            log.warn("Booking {} made but not added to trip {}: {}",
                    item.bookingReference(), trip.tripId(), e.getMessage());
        }
    }

    private static Optional<Map<String, Object>> bookingRecord(AgentResponse response) {
        boolean booked = response.toolsCalled().stream().anyMatch(tool -> tool.startsWith("book_"));
        if (!booked || response.data() == null) {
            return Optional.empty();
        }
        for (String key : BOOKING_KEYS) {
            if (response.data().get(key) instanceof Map<?, ?> map) {
                Map<String, Object> record = new LinkedHashMap<>();
                map.forEach((name, value) -> record.put(String.valueOf(name), value));
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    private static String providerOf(Map<String, Object> booking) {
        if (booking.get("offer") instanceof Map<?, ?> offer) {
            for (String key : List.of("airline", "name", "make")) {
                Object value = offer.get(key);
                if (value != null) {
                    return value.toString();
                }
            }
        }
        return null;
    }

    private static String itemType(Domain domain) {
        return switch (domain) {
            case FLIGHTS -> "flight";
            case LODGING -> "hotel";
            case VEHICLES -> "car";
            case NONE -> "other";
        };
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }

    private void record(Domain domain, String outcome) {
        metrics.increment(DISPATCH_METRIC, "Orchestrator dispatches", outcome, "domain", domain.value());
    }
}
