package com.example.repoassist;

import java.util.List;

/**
 * The four retrieval operations available to the orchestrator. Every successful call registers
 * its results in the context's evidence set under the context's tool-call id; a failed call
 * registers nothing.
 */
public interface ToolGateway {

    List<EvidenceItem> searchRepo(String query, SearchFilters filters, ToolContext ctx) throws ToolGatewayException;

    /** Exact text of the inclusive line range. */
    String openFile(String path, int startLine, int endLine, ToolContext ctx) throws ToolGatewayException;

    List<Issue> getIssue(ExternalQuery query, ToolContext ctx) throws ToolGatewayException;

    List<PullRequest> getPullRequests(ExternalQuery query, ToolContext ctx) throws ToolGatewayException;
}
