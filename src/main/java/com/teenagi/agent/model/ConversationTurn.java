package com.teenagi.agent.model;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of the history built up during a single {@code respond} call.
 *
 * A history always opens with one USER_MESSAGE. Every FUNCTION_CALL is
 * immediately followed by the FUNCTION_RESULT for the same call id, and a
 * successful run closes with one FINAL_ANSWER.
 */
@Value
@Builder
public class ConversationTurn {

    public enum Type {
        USER_MESSAGE, FUNCTION_CALL, FUNCTION_RESULT, FINAL_ANSWER
    }

    Type type;

    /** User text, final answer text, or the rendered function result / error description */
    String content;

    /** Present for FUNCTION_CALL and FUNCTION_RESULT */
    FunctionCall call;

    /** FUNCTION_RESULT only: true when content describes a failure */
    boolean error;

    public String getFunctionName() {
        return call != null ? call.getFunctionName() : null;
    }

    public String getCallId() {
        return call != null ? call.getId() : null;
    }

    public static ConversationTurn userMessage(String text) {
        return ConversationTurn.builder().type(Type.USER_MESSAGE).content(text).build();
    }

    public static ConversationTurn functionCall(FunctionCall call) {
        return ConversationTurn.builder().type(Type.FUNCTION_CALL).call(call).build();
    }

    public static ConversationTurn functionResult(FunctionCall call, String result) {
        return ConversationTurn.builder().type(Type.FUNCTION_RESULT).call(call).content(result).build();
    }

    public static ConversationTurn functionError(FunctionCall call, String description) {
        return ConversationTurn.builder().type(Type.FUNCTION_RESULT).call(call).content(description).error(true).build();
    }

    public static ConversationTurn finalAnswer(String text) {
        return ConversationTurn.builder().type(Type.FINAL_ANSWER).content(text).build();
    }
}
