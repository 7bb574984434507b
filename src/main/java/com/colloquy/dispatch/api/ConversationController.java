package com.colloquy.dispatch.api;

import com.colloquy.core.agent.AgentNotFoundException;
import com.colloquy.core.credit.InsufficientCreditsException;
import com.colloquy.core.model.Message;
import com.colloquy.core.stream.ConversationHandle;
import com.colloquy.core.stream.ConversationLaunch;
import com.colloquy.core.stream.ConversationNotFoundException;
import com.colloquy.core.stream.ConversationStreamService;
import jakarta.servlet.http.HttpServletResponse;
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
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST + SSE endpoints for group conversations.
 * <p>
 * Starting or continuing a conversation answers with an event stream, unless it is started
 * through {@code /run}. The conversation id is returned in the {@code X-Conversation-Id}
 * header. If the client that started a streamed run disconnects, the run is stopped.
 */
@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    static final String CONVERSATION_ID_HEADER = "X-Conversation-Id";

    private final ConversationStreamService conversationService;
    private final SseStreamingService sseStreamingService;

    public ConversationController(ConversationStreamService conversationService,
                                  SseStreamingService sseStreamingService) {
        this.conversationService = conversationService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/conversations: start a conversation and stream its events.
     */
    @PostMapping
    public SseEmitter start(@RequestBody ConversationRequest request, HttpServletResponse response) {
        ConversationHandle handle = conversationService.open(toLaunch(request));
        log.info("Accepted conversation {}", handle.conversationId());
        return stream(handle, response);
    }

    /**
     * POST /api/v1/conversations/run: run a conversation to its end and answer with the transcript.
     * The request thread is released while the run executes on the worker pool.
     */
    @PostMapping("/run")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> run(@RequestBody ConversationRequest request) {
        ConversationHandle handle = conversationService.open(toLaunch(request));
        String conversationId = handle.conversationId();
        log.info("Running conversation {} without streaming", conversationId);
        return conversationService.launch(handle).thenApply(status -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("conversationId", conversationId);
            body.put("status", status);
            body.put("totalCreditsUsed", handle.totalCreditsUsed());
            handle.error().ifPresent(error -> body.put("error", error));
            body.put("messages", conversationService.transcript(conversationId));
            return ResponseEntity.ok(body);
        });
    }

    /**
     * POST /api/v1/conversations/{id}/messages: continue a stored conversation.
     */
    @PostMapping("/{id}/messages")
    public SseEmitter resume(@PathVariable String id, @RequestBody ConversationRequest request,
                             HttpServletResponse response) {
        ConversationHandle handle = conversationService.resume(id, toLaunch(request));
        log.info("Resuming conversation {}", id);
        return stream(handle, response);
    }

    /**
     * GET /api/v1/conversations/{id}/events: observe a running conversation.
     */
    @GetMapping("/{id}/events")
    public SseEmitter events(@PathVariable String id) {
        if (conversationService.find(id).isEmpty()) {
            throw new ConversationNotFoundException(id);
        }
        return sseStreamingService.createEmitter(id);
    }

    /**
     * POST /api/v1/conversations/{id}/stop: stop a running conversation.
     */
    @PostMapping("/{id}/stop")
    public ResponseEntity<Map<String, String>> stop(@PathVariable String id) {
        if (!conversationService.stop(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No running conversation " + id));
        }
        return ResponseEntity.ok(Map.of("conversationId", id, "status", "STOPPING"));
    }

    /**
     * GET /api/v1/conversations/{id}: stored transcript.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String id) {
        List<Message> transcript = conversationService.transcript(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("conversationId", id);
        body.put("running", conversationService.find(id).isPresent());
        body.put("messages", transcript);
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(AgentNotFoundException.class)
    ResponseEntity<Map<String, String>> unknownAgent(AgentNotFoundException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ConversationNotFoundException.class)
    ResponseEntity<Map<String, String>> notFound(ConversationNotFoundException e) {
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

    private SseEmitter stream(ConversationHandle handle, HttpServletResponse response) {
        String conversationId = handle.conversationId();
        response.setHeader(CONVERSATION_ID_HEADER, conversationId);
        SseEmitter emitter = sseStreamingService.createEmitter(conversationId,
                () -> conversationService.stop(conversationId));
        handle.completion().whenComplete((status, ex) -> sseStreamingService.completeAll(conversationId));
        conversationService.launch(handle);
        return emitter;
    }

    private static ConversationLaunch toLaunch(ConversationRequest request) {
        return new ConversationLaunch(request.userId(), request.message(), request.agentIds(), request.maxTurns());
    }
}
