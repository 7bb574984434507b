package com.colloquy.dispatch.api;

import com.colloquy.core.agent.AgentNotFoundException;
import com.colloquy.core.credit.InsufficientCreditsException;
import com.colloquy.core.model.ConversationStatus;
import com.colloquy.core.model.Message;
import com.colloquy.core.model.MessageRole;
import com.colloquy.core.stream.ConversationHandle;
import com.colloquy.core.stream.ConversationLaunch;
import com.colloquy.core.stream.ConversationNotFoundException;
import com.colloquy.core.stream.ConversationStreamService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConversationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ConversationControllerTest {

    private static final String START_BODY = """
            {"user_id":"u1","message":"Hello","agent_ids":["alice","bob"],"max_turns":4}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConversationStreamService conversationService;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private ConversationHandle handle(String id) {
        ConversationHandle handle = mock(ConversationHandle.class);
        when(handle.conversationId()).thenReturn(id);
        when(handle.completion()).thenReturn(new CompletableFuture<>());
        return handle;
    }

    // ── POST /api/v1/conversations ───────────────────────────────────

    @Test
    @DisplayName("POST /conversations opens, streams and launches the conversation")
    void start() throws Exception {
        ConversationHandle handle = handle("c1");
        when(conversationService.open(any())).thenReturn(handle);
        when(sseStreamingService.createEmitter(eq("c1"), any())).thenReturn(new SseEmitter());

        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(START_BODY))
                .andExpect(request().asyncStarted())
                .andExpect(header().string(ConversationController.CONVERSATION_ID_HEADER, "c1"));

        ArgumentCaptor<ConversationLaunch> launch = ArgumentCaptor.forClass(ConversationLaunch.class);
        verify(conversationService).open(launch.capture());
        assertEquals(new ConversationLaunch("u1", "Hello", List.of("alice", "bob"), 4), launch.getValue());
        verify(conversationService).launch(handle);
    }

    @Test
    @DisplayName("client disconnect stops the run")
    void disconnectStopsRun() throws Exception {
        ConversationHandle handle = handle("c1");
        when(conversationService.open(any())).thenReturn(handle);
        when(sseStreamingService.createEmitter(eq("c1"), any())).thenReturn(new SseEmitter());

        mockMvc.perform(post("/api/v1/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(START_BODY));

        ArgumentCaptor<Runnable> onDisconnect = ArgumentCaptor.forClass(Runnable.class);
        verify(sseStreamingService).createEmitter(eq("c1"), onDisconnect.capture());
        onDisconnect.getValue().run();
        verify(conversationService).stop("c1");
    }

    @Test
    @DisplayName("emitters are completed when the run finishes")
    void completesEmittersOnFinish() throws Exception {
        ConversationHandle handle = mock(ConversationHandle.class);
        var completion = new CompletableFuture<ConversationStatus>();
        when(handle.conversationId()).thenReturn("c1");
        when(handle.completion()).thenReturn(completion);
        when(conversationService.open(any())).thenReturn(handle);
        when(sseStreamingService.createEmitter(eq("c1"), any())).thenReturn(new SseEmitter());

        mockMvc.perform(post("/api/v1/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(START_BODY));
        completion.complete(ConversationStatus.STOPPED);

        verify(sseStreamingService).completeAll("c1");
    }

    // ── POST /api/v1/conversations/run ───────────────────────────────

    @Test
    @DisplayName("POST /conversations/run answers with status, credits and transcript once the run ends")
    void runToCompletion() throws Exception {
        ConversationHandle handle = handle("c1");
        when(handle.totalCreditsUsed()).thenReturn(12L);
        when(conversationService.open(any())).thenReturn(handle);
        when(conversationService.launch(handle)).thenReturn(CompletableFuture.completedFuture(ConversationStatus.COMPLETED));
        when(conversationService.transcript("c1")).thenReturn(List.of(
                new Message(MessageRole.USER, "Hello", "User", null, 1L),
                new Message(MessageRole.ASSISTANT, "Hi!", "Alice", "alice", 2L)));

        var result = mockMvc.perform(post("/api/v1/conversations/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(START_BODY))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversationId").value("c1"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.totalCreditsUsed").value(12))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(jsonPath("$.messages[1].agentId").value("alice"));
        verifyNoInteractions(sseStreamingService);
    }

    @Test
    @DisplayName("POST /conversations/run reports the error of a failed run")
    void runFailure() throws Exception {
        ConversationHandle handle = handle("c1");
        when(handle.error()).thenReturn(Optional.of("Conversation error: model down"));
        when(conversationService.open(any())).thenReturn(handle);
        when(conversationService.launch(handle)).thenReturn(CompletableFuture.completedFuture(ConversationStatus.FAILED));
        when(conversationService.transcript("c1")).thenReturn(List.of(
                new Message(MessageRole.USER, "Hello", "User", null, 1L)));

        var result = mockMvc.perform(post("/api/v1/conversations/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(START_BODY))
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.error").value("Conversation error: model down"));
    }

    @Test
    @DisplayName("invalid request returns 400 with the error")
    void badRequest() throws Exception {
        when(conversationService.open(any())).thenThrow(new IllegalArgumentException("message must not be blank"));

        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"\",\"agent_ids\":[\"alice\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("message must not be blank"));
        verify(conversationService, never()).launch(any());
    }

    @Test
    @DisplayName("unknown agent returns 400")
    void unknownAgent() throws Exception {
        when(conversationService.open(any())).thenThrow(new AgentNotFoundException("zed"));

        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(START_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Agent zed not found"));
    }

    @Test
    @DisplayName("user without credits gets 402")
    void insufficientCredits() throws Exception {
        when(conversationService.open(any())).thenThrow(new InsufficientCreditsException(1, 0));

        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(START_BODY))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error").value("Insufficient credits"));
    }

    // ── POST /api/v1/conversations/{id}/messages ─────────────────────

    @Test
    @DisplayName("resume streams the continued conversation")
    void resume() throws Exception {
        ConversationHandle handle = handle("c1");
        when(conversationService.resume(eq("c1"), any())).thenReturn(handle);
        when(sseStreamingService.createEmitter(eq("c1"), any())).thenReturn(new SseEmitter());

        mockMvc.perform(post("/api/v1/conversations/c1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"And then?\",\"agent_ids\":[\"alice\"]}"))
                .andExpect(request().asyncStarted());

        verify(conversationService).launch(handle);
    }

    @Test
    @DisplayName("resume of an unknown conversation returns 404")
    void resumeUnknown() throws Exception {
        when(conversationService.resume(eq("nope"), any())).thenThrow(new ConversationNotFoundException("nope"));

        mockMvc.perform(post("/api/v1/conversations/nope/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\",\"agent_ids\":[\"alice\"]}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("resume while running returns 409")
    void resumeConflict() throws Exception {
        when(conversationService.resume(eq("c1"), any()))
                .thenThrow(new IllegalStateException("Conversation c1 is already running"));

        mockMvc.perform(post("/api/v1/conversations/c1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\",\"agent_ids\":[\"alice\"]}"))
                .andExpect(status().isConflict());
    }

    // ── GET /{id}/events, POST /{id}/stop, GET /{id} ─────────────────

    @Test
    @DisplayName("observing an unknown conversation returns 404")
    void eventsUnknown() throws Exception {
        when(conversationService.find("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/conversations/nope/events"))
                .andExpect(status().isNotFound());
        verify(sseStreamingService, never()).createEmitter(any());
    }

    @Test
    @DisplayName("observing a running conversation attaches an emitter")
    void eventsRunning() throws Exception {
        ConversationHandle handle = handle("c1");
        when(conversationService.find("c1")).thenReturn(Optional.of(handle));
        when(sseStreamingService.createEmitter("c1")).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/conversations/c1/events"))
                .andExpect(request().asyncStarted());
    }

    @Test
    @DisplayName("stop returns 200 for a running conversation and 404 otherwise")
    void stop() throws Exception {
        when(conversationService.stop("c1")).thenReturn(true);
        when(conversationService.stop("c2")).thenReturn(false);

        mockMvc.perform(post("/api/v1/conversations/c1/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("STOPPING"));
        mockMvc.perform(post("/api/v1/conversations/c2/stop"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /{id} returns the stored transcript")
    void transcript() throws Exception {
        when(conversationService.transcript("c1")).thenReturn(List.of(
                new Message(MessageRole.USER, "Hello", "User", null, 1L),
                new Message(MessageRole.ASSISTANT, "Hi!", "Alice", "alice", 2L)));
        when(conversationService.find("c1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/conversations/c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversationId").value("c1"))
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.messages.length()").value(2))
                .andExpect(jsonPath("$.messages[1].agentId").value("alice"))
                .andExpect(jsonPath("$.messages[1].role").value("ASSISTANT"));
    }

    @Test
    @DisplayName("GET /{id} for an unknown conversation returns 404")
    void transcriptUnknown() throws Exception {
        when(conversationService.transcript("nope")).thenThrow(new ConversationNotFoundException("nope"));

        mockMvc.perform(get("/api/v1/conversations/nope"))
                .andExpect(status().isNotFound());
    }
}
