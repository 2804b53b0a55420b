package com.alchemist.handler;

import com.alchemist.model.CastResult;
import com.alchemist.model.EffectDescriptor;
import com.alchemist.model.Element;
import com.alchemist.model.SelectionResult;
import com.alchemist.service.CombatWorldService;
import com.alchemist.service.EffectRegistry;
import com.alchemist.service.VisualCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CombatWebSocketHandlerTest {

    private CombatWorldService world;
    private VisualCatalog visuals;
    private WebSocketSession session;
    private CombatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        world = mock(CombatWorldService.class);
        visuals = mock(VisualCatalog.class);
        WorldSnapshotWriter snapshots = mock(WorldSnapshotWriter.class);
        when(snapshots.getObjectMapper()).thenReturn(new ObjectMapper());
        session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
        when(session.getId()).thenReturn("s1");
        handler = new CombatWebSocketHandler(world, snapshots, visuals);
    }

    private String lastReply() throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(captor.capture());
        return captor.getValue().getPayload();
    }

    @Test
    void selectElementRepliesWithTheSelectionResult() throws Exception {
        when(world.selectElement(Element.FIRE)).thenReturn(CompletableFuture.completedFuture(SelectionResult.PENDING));

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"select_element\",\"element\":\"fire\"}"));

        assertThat(lastReply()).contains("\"event\":\"selection\"").contains("\"result\":\"PENDING\"");
    }

    @Test
    void castRepliesWithStatusAndIcon() throws Exception {
        EffectDescriptor fireball = new EffectRegistry().getEffect("fireball").orElseThrow();
        when(world.cast()).thenReturn(CompletableFuture.completedFuture(
                CastResult.failed(CastResult.Status.ON_COOLDOWN, fireball)));
        when(visuals.iconFor(fireball)).thenReturn("icons/fireball");

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"cast\"}"));

        assertThat(lastReply()).contains("ON_COOLDOWN").contains("Fireball").contains("icons/fireball");
    }

    @Test
    void moveIsForwardedToTheWorld() throws Exception {
        when(world.requestMove(10.0, 20.0)).thenReturn(CompletableFuture.completedFuture(null));

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"request_move\",\"x\":10,\"y\":20}"));

        verify(world).requestMove(10.0, 20.0);
        verify(session, never()).sendMessage(any());
    }

    @Test
    void castFailingOnTheFrameThreadIsReportedAsAnError() throws Exception {
        when(world.cast()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("frame aborted")));

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"cast\"}"));

        assertThat(lastReply()).contains("\"event\":\"error\"").contains("cast failed: frame aborted");
    }

    @Test
    void failedFaceCommandIsReportedAsAnError() throws Exception {
        CompletableFuture<Boolean> failed = new CompletableFuture<>();
        when(world.face(false)).thenReturn(failed);

        handler.handleTextMessage(session, new TextMessage("{\"action\":\"face\",\"right\":false}"));
        verify(session, never()).sendMessage(any());

        // Completes later, as the frame thread would
        failed.completeExceptionally(new IllegalStateException("player missing"));

        assertThat(lastReply()).contains("face failed: player missing");
    }

    @Test
    void moveWithoutCoordinatesIsAnError() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"request_move\",\"x\":10}"));

        assertThat(lastReply()).contains("\"event\":\"error\"");
    }

    @Test
    void unknownElementIsReportedNotThrown() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"select_element\",\"element\":\"air\"}"));

        assertThat(lastReply()).contains("\"event\":\"error\"").contains("Unknown element: air");
    }

    @Test
    void malformedJsonIsReportedNotThrown() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{not json"));

        assertThat(lastReply()).contains("\"event\":\"error\"");
    }

    @Test
    void unknownActionIsReported() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"dance\"}"));

        assertThat(lastReply()).contains("Unknown action: dance");
    }
}
