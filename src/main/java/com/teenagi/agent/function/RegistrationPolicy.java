package com.teenagi.agent.function;

/**
 * What happens when a function is registered under a name that is already taken.
 */
public enum RegistrationPolicy {
    /** Last write wins; the earlier binding is dropped */
    REPLACE,
    /** Second registration fails with DuplicateRegistrationException */
    REJECT
}
