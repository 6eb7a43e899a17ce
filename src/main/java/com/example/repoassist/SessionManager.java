package com.example.repoassist;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Lifecycle of conversation sessions: create, look up, reset and destroy. */
@Slf4j
@Service
public class SessionManager {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public Session create(AssistMode mode, AssistScope scope) {
        Session s = new Session(UUID.randomUUID().toString(), mode, scope);
        sessions.put(s.getId(), s);
        log.info("Created session {} (mode={}, scope={})", s.getId(), s.getMode().label(), s.getScope().label());
        return s;
    }

    /** A session that is not registered, for one-off queries. */
    public Session ephemeral(AssistMode mode, AssistScope scope) {
        return new Session("ephemeral-" + UUID.randomUUID(), mode, scope);
    }

    public Session get(String id) {
        Session s = id == null ? null : sessions.get(id);
        if (s == null) throw new SessionNotFoundException(id);
        return s;
    }

    public Session reset(String id) {
        Session s = get(id);
        s.reset();
        log.info("Reset session {}", id);
        return s;
    }

    /** Removes the session and cancels its running request. */
    public void destroy(String id) {
        Session s = sessions.remove(id);
        if (s == null) throw new SessionNotFoundException(id);
        if (s.cancelActive()) log.info("Cancelled running request of destroyed session {}", id);
        s.reset();
        log.info("Destroyed session {}", id);
    }

    public boolean cancel(String id) {
        return get(id).cancelActive();
    }

    public List<String> ids() {
        List<String> out = new ArrayList<>(sessions.keySet());
        out.sort(null);
        return out;
    }
}
