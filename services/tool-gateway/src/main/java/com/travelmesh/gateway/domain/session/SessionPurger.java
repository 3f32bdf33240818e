package com.travelmesh.gateway.domain.session;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drops expired gateway sessions on a fixed delay. */
@Component
public class SessionPurger {

    private final SessionRegistry sessions;

    public SessionPurger(SessionRegistry sessions) {
        this.sessions = sessions;
    }

    /** The delay comes from {@code travelmesh.gateway.session-purge-interval-ms}. */
    @Scheduled(fixedDelayString = "${travelmesh.gateway.session-purge-interval-ms:60000}")
    public void purge() {
        sessions.purgeExpired();
    }
}
