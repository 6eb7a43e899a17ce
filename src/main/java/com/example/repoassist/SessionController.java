package com.example.repoassist;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.bind.annotation.ResponseStatus;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    @Autowired
    private SessionManager sessionManager;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public QueryModels.SessionView create(@RequestBody(required = false) QueryModels.SessionRequest req) {
        String mode = req == null ? null : req.getMode();
        String scope = req == null ? null : req.getScope();
        Session s = sessionManager.create(AssistMode.parse(mode), AssistScope.parse(scope));
        return new QueryModels.SessionView(s);
    }

    @GetMapping
    public List<String> list() {
        return sessionManager.ids();
    }

    @GetMapping("/{id}")
    public QueryModels.SessionView get(@PathVariable("id") String id) {
        return new QueryModels.SessionView(sessionManager.get(id));
    }

    @PostMapping("/{id}/reset")
    public QueryModels.SessionView reset(@PathVariable("id") String id) {
        return new QueryModels.SessionView(sessionManager.reset(id));
    }

    @PostMapping("/{id}/cancel")
    public Map<String, Object> cancel(@PathVariable("id") String id) {
        return Collections.singletonMap("cancelled", sessionManager.cancel(id));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void destroy(@PathVariable("id") String id) {
        sessionManager.destroy(id);
    }
}
