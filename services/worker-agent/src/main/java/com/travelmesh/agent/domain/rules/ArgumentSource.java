package com.travelmesh.agent.domain.rules;

import com.travelmesh.agentapi.TripSnapshot;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * One place an argument value can come from. Sources are tried in declaration order.
 */
@FunctionalInterface
public interface ArgumentSource {

    Optional<Object> resolve(RuleInput input);

    /** A structured request parameter. */
    static ArgumentSource parameter(String name) {
        return input -> input.context().parameter(name).map(value -> value);
    }

    /** A user preference from the dispatch context. */
    static ArgumentSource preference(String name) {
        return input -> Optional.ofNullable(input.context().userPreferences().get(name));
    }

    /** The first known city in the message. */
    static ArgumentSource cityInMessage(LocationResolver resolver, CityForm form) {
        return input -> resolver.firstMentioned(input.message()).map(form::render);
    }

    /** The known city right after a preposition in the message. */
    static ArgumentSource cityAfter(LocationResolver resolver, String preposition, CityForm form) {
        return input -> resolver.after(input.message(), preposition).map(form::render);
    }

    /** The active trip's destination; known cities are rendered in the given form. */
    static ArgumentSource tripDestination(LocationResolver resolver, CityForm form) {
        return tripCity(resolver, form, TripSnapshot::destination);
    }

    static ArgumentSource tripOrigin(LocationResolver resolver, CityForm form) {
        return tripCity(resolver, form, TripSnapshot::origin);
    }

    static ArgumentSource tripStartDate() {
        return tripField(TripSnapshot::startDate);
    }

    static ArgumentSource tripEndDate() {
        return tripField(TripSnapshot::endDate);
    }

    /** The first of the given words that occurs in the message. */
    static ArgumentSource wordIn(String... words) {
        return input -> Arrays.stream(words).filter(input::hasWord).findFirst().map(word -> word);
    }

    private static ArgumentSource tripCity(
            LocationResolver resolver, CityForm form, Function<TripSnapshot, String> field) {
        return input -> input.context().activeTripSnapshot()
                .map(field)
                .filter(value -> !value.isBlank())
                .map(value -> resolver.resolve(value).map(form::render).orElse(value));
    }

    private static ArgumentSource tripField(Function<TripSnapshot, String> field) {
        return input -> input.context().activeTripSnapshot()
                .map(field)
                .filter(value -> !value.isBlank())
                .map(value -> value);
    }

    /** How a resolved city is passed to a tool. */
    enum CityForm {
        NAME,
        CODE;

        String render(LocationResolver.KnownCity city) {
            return this == NAME ? city.name() : city.code();
        }
    }
}
