package com.example.repoassist;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(QueryController.class);

    @Autowired
    private AgentOrchestrator orchestrator;

    @Autowired
    private SessionManager sessionManager;

    @PostMapping
    public ResponseEnvelope handleQuery(@RequestBody QueryModels.QueryRequest req) {
        log.info("Received POST query: {} (mode={}, scope={}, session={})",
                req.getQuery(), req.getMode(), req.getScope(), req.getSessionId());
        return run(req.getQuery(), req.getMode(), req.getScope(), req.getSessionId());
    }

    @GetMapping
    public ResponseEnvelope handleQueryGet(@RequestParam(name = "query") String query,
                                           @RequestParam(name = "mode", required = false) String mode,
                                           @RequestParam(name = "scope", required = false) String scope,
                                           @RequestParam(name = "sessionId", required = false) String sessionId) {
        log.info("Received GET query: {}", query);
        return run(query, mode, scope, sessionId);
    }

    private ResponseEnvelope run(String query, String mode, String scope, String sessionId) {
        AssistMode m = mode == null ? null : AssistMode.parse(mode);
        AssistScope s = scope == null ? null : AssistScope.parse(scope);
        Session session = sessionId == null || sessionId.isBlank()
                ? sessionManager.ephemeral(m, s)
                : sessionManager.get(sessionId);
        ResponseEnvelope envelope = orchestrator.answer(session, query, m, s);
        log.info("Request {} finished: status={}, citations={}, toolCalls={}", envelope.getRequestId(),
                envelope.getStatus().getLabel(), envelope.getCitations().size(), envelope.getToolCalls().size());
        return envelope;
    }
}
