package com.travelmesh.agent.domain;

/**
 * Optional free-text model consulted when no rule matches. Its output is only ever shown to the
 * user; it never selects or authorizes a tool.
 */
public interface LanguageModelClient {

    String generate(String prompt);
}
