package com.colloquy.dispatch.api;

import com.colloquy.core.agent.AgentDirectory;
import com.colloquy.core.agent.AgentNotFoundException;
import com.colloquy.core.chat.AgentChatService;
import com.colloquy.core.chat.AgentReply;
import com.colloquy.core.credit.InsufficientCreditsException;
import com.colloquy.core.generation.GenerationFailureException;
import com.colloquy.core.model.Agent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for browsing agents and chatting with one of them directly.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentDirectory agentDirectory;
    private final AgentChatService chatService;

    public AgentController(AgentDirectory agentDirectory, AgentChatService chatService) {
        this.agentDirectory = agentDirectory;
        this.chatService = chatService;
    }

    @GetMapping
    public List<Agent> list(@RequestParam(name = "user_id", required = false) String userId) {
        return agentDirectory.listAgents(userId);
    }

    /**
     * POST /api/v1/agents/{agentId}/chat: one user message, one agent reply.
     */
    @PostMapping("/{agentId}/chat")
    public AgentReply chat(@PathVariable String agentId, @RequestBody AgentChatRequest request) {
        AgentReply reply = chatService.chat(request.userId(), agentId, request.message(), request.conversationId());
        log.info("Agent {} replied in conversation {}", agentId, reply.conversationId());
        return reply;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(AgentNotFoundException.class)
    ResponseEntity<Map<String, String>> unknownAgent(AgentNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(InsufficientCreditsException.class)
    ResponseEntity<Map<String, String>> insufficientCredits(InsufficientCreditsException e) {
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(Map.of("error", "Insufficient credits"));
    }

    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<Map<String, String>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(GenerationFailureException.class)
    ResponseEntity<Map<String, String>> generationFailed(GenerationFailureException e) {
        log.warn("Agent chat failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
    }
}
