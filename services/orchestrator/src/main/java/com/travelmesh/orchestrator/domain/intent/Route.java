package com.travelmesh.orchestrator.domain.intent;

/** Where a classified request goes next. */
public enum Route {

    /** Answered from the caller's context; no agent is called. */
    ITINERARY_QUERY,

    /** Creates a trip through the context collaborator; no agent is called. */
    TRIP_CREATION,

    /** Sent to the worker agent of the intent's domain. */
    DISPATCH,

    /** Travel in general with no single domain; the caller is asked which domain to start with. */
    MULTI_DOMAIN,

    /** Static help text. */
    GENERAL
}
