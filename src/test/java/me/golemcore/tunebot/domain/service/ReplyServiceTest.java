package me.golemcore.tunebot.domain.service;

import me.golemcore.tunebot.domain.clear.AutoClearRegistry;
import me.golemcore.tunebot.domain.resilience.FailureKind;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.port.outbound.ChatPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ReplyServiceTest {

    private ChatPort chatPort;
    private AutoClearRegistry clearRegistry;
    private ReplyService replyService;

    @BeforeEach
    void setUp() {
        chatPort = mock(ChatPort.class);
        clearRegistry = mock(AutoClearRegistry.class);
        replyService = new ReplyService(chatPort, clearRegistry);
    }

    @Test
    void shouldRecordSentMessage() {
        when(chatPort.sendText("1", "hello")).thenReturn(11);

        assertEquals(11, replyService.send("1", "hello"));
        verify(clearRegistry).record("1", 11);
    }

    @Test
    void shouldRecordPhotoAndEditedMessage() {
        byte[] image = { 1, 2 };
        when(chatPort.sendPhoto("1", image, "cover")).thenReturn(12);

        replyService.sendPhoto("1", image, "cover");
        replyService.edit("1", 5, "text");

        verify(clearRegistry).record("1", 12);
        verify(clearRegistry).record("1", 5);
    }

    @Test
    void shouldNotRecordFailedSend() {
        when(chatPort.sendText(anyString(), anyString()))
                .thenThrow(new OperationFailedException(FailureKind.FATAL, "chat not found"));

        assertFalse(replyService.trySend("1", "hello"));
        verify(clearRegistry, never()).record(anyString(), anyInt());
    }

    @Test
    void shouldDeleteCommandMessageWithoutTrackingIt() {
        replyService.tryDelete("1", 7);

        verify(chatPort).delete("1", List.of(7));
        verifyNoInteractions(clearRegistry);
    }

    @Test
    void shouldSwallowFailedCommandDeletion() {
        when(chatPort.delete(anyString(), anyList()))
                .thenThrow(new OperationFailedException(FailureKind.RETRIES_EXHAUSTED, "HTTP 429"));

        assertDoesNotThrow(() -> replyService.tryDelete("1", 7));
    }
}
