package com.travelmesh.orchestrator.domain.intent;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IntentType {
    QUERY,
    SEARCH,
    CREATE,
    MODIFY,
    CANCEL,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
