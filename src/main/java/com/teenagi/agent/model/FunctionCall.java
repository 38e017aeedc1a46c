package com.teenagi.agent.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One function invocation proposed by the model, exactly as the backend sent it.
 */
@Value
@Builder(toBuilder = true)
public class FunctionCall {

    /** Backend-assigned id; echoed back with the result so the backend can correlate them */
    String id;

    String functionName;

    /** Raw, unvalidated key/value payload */
    Map<String, Object> arguments;

    /**
     * Set by the adapter when this call cannot be used as proposed
     * (e.g. arguments that are not a JSON object). Such a call is never executed.
     */
    String parseError;

    public boolean isMalformed() {
        return parseError != null;
    }
}
