package com.teenagi.agent.capability;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Free-text statements of what the agent can do. They only shape the system
 * prompt; nothing here is type-checked. Append-only, insertion order kept.
 */
@Slf4j
public class CapabilityRegistry {

    private final List<String> statements = new CopyOnWriteArrayList<>();

    /**
     * @return false (and nothing stored) when the statement is blank
     */
    public boolean learn(String statement) {
        if (statement == null || statement.isBlank()) {
            log.warn("Attempted to add empty capability");
            return false;
        }
        statements.add(statement.trim());
        log.info("Added capability: {}", statement.trim());
        return true;
    }

    public List<String> statements() {
        return List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public int size() {
        return statements.size();
    }
}
