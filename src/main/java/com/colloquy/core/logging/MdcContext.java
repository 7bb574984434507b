package com.colloquy.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys attached to log lines emitted while a conversation run is working.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setConversation(String conversationId) {
        MDC.put("conversationId", conversationId);
    }

    public static void setTurn(String conversationId, String agentId, int turn) {
        MDC.put("conversationId", conversationId);
        MDC.put("agentId", agentId);
        MDC.put("turn", String.valueOf(turn));
    }

    public static void clearTurn() {
        MDC.remove("agentId");
        MDC.remove("turn");
    }

    public static void clear() {
        MDC.remove("conversationId");
        MDC.remove("agentId");
        MDC.remove("turn");
    }
}
