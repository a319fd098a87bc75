package lkml.watch.app.service;

import lkml.watch.app.entity.PatchCard;
import lkml.watch.app.entity.PatchThread;
import lkml.watch.app.model.PatchCardView;
import lkml.watch.app.model.ThreadCreation;
import lkml.watch.app.model.ThreadOverview;
import lkml.watch.app.sender.ThreadSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WatchServiceTest {

    @Mock
    private PatchCardService patchCardService;

    @Mock
    private ThreadService threadService;

    @Mock
    private ThreadSender threadSender;

    @Mock
    private ProcessingLockService processingLockService;

    @InjectMocks
    private WatchService watchService;

    private PatchCard card;
    private ThreadOverview overview;

    @BeforeEach
    void setUp() {
        card = new PatchCard();
        card.setMessageIdHeader("c@x");
        card.setSubject("[PATCH v2 0/2] net: rework foo");
        card.setPlatformMessageId("msg-1");
        card.setPlatformChannelId("chan-1");
        overview = new ThreadOverview(PatchCardView.builder().messageIdHeader("c@x").build(), null, null);
        lenient().when(processingLockService.getNodeId()).thenReturn("node-1");
        lenient().when(processingLockService.tryLock(anyString(), anyString())).thenReturn(true);
    }

    private static PatchThread thread(boolean active) {
        PatchThread thread = new PatchThread();
        thread.setThreadId("t-1");
        thread.setPatchCardMessageIdHeader("c@x");
        thread.setActive(active);
        return thread;
    }

    @Test
    void autoWatch_WithoutExistingThread_ShouldCreateThreadAndMarkCard() {
        // Given
        when(threadService.findByCardHeader("c@x")).thenReturn(Optional.empty());
        when(threadService.prepareOverview("c@x")).thenReturn(Optional.of(overview));
        when(threadSender.createThreadAndSendOverview("[PATCH v2 0/2] net: rework foo", "msg-1", overview))
                .thenReturn(new ThreadCreation("t-1", Map.of(0, "ov-0", 1, "ov-1")));
        when(threadService.create("c@x", "t-1", "[PATCH v2 0/2] net: rework foo")).thenReturn(thread(true));

        // When
        boolean watched = watchService.autoWatch(card);

        // Then
        assertTrue(watched);
        assertTrue(card.isHasThread());
        verify(threadService).updateSubPatchMessages("t-1", Map.of(0, "ov-0", 1, "ov-1"));
        verify(patchCardService).markHasThread("c@x");
        verify(processingLockService).releaseLock("thread:c@x", "node-1");
    }

    @Test
    void autoWatch_WhenThreadLockHeldElsewhere_ShouldNotCreateThread() {
        when(processingLockService.tryLock("thread:c@x", "node-1")).thenReturn(false);

        assertFalse(watchService.autoWatch(card));

        assertFalse(card.isHasThread());
        verifyNoInteractions(threadSender, threadService);
        verify(processingLockService, never()).releaseLock(anyString(), anyString());
    }

    @Test
    void autoWatch_WhenThreadCreatedWhileWaitingForLock_ShouldReuseIt() {
        when(threadService.findByCardHeader("c@x")).thenReturn(Optional.of(thread(true)));

        assertTrue(watchService.autoWatch(card));

        verifyNoInteractions(threadSender);
        verify(processingLockService).tryLock("thread:c@x", "node-1");
        verify(processingLockService).releaseLock("thread:c@x", "node-1");
    }

    @Test
    void autoWatch_Twice_ShouldCreateOneThread() {
        // Given
        when(threadService.findByCardHeader("c@x"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(thread(true)));
        when(threadService.prepareOverview("c@x")).thenReturn(Optional.of(overview));
        when(threadSender.createThreadAndSendOverview(anyString(), anyString(), any(ThreadOverview.class)))
                .thenReturn(new ThreadCreation("t-1", Map.of()));
        when(threadService.create(anyString(), anyString(), anyString())).thenReturn(thread(true));

        // When
        assertTrue(watchService.autoWatch(card));
        assertTrue(watchService.autoWatch(card));

        // Then
        verify(threadSender, times(1)).createThreadAndSendOverview(anyString(), anyString(), any(ThreadOverview.class));
        assertTrue(card.isHasThread());
    }

    @Test
    void autoWatch_WithActiveThreadAndStaleFlag_ShouldBackfillFlag() {
        when(threadService.findByCardHeader("c@x")).thenReturn(Optional.of(thread(true)));

        assertTrue(watchService.autoWatch(card));

        assertTrue(card.isHasThread());
        verify(patchCardService).markHasThread("c@x");
        verifyNoInteractions(threadSender);
    }

    @Test
    void watch_WithArchivedThread_ShouldNotReopen() {
        when(patchCardService.findByHeader("c@x")).thenReturn(Optional.of(card));
        when(threadService.findByCardHeader("c@x")).thenReturn(Optional.of(thread(false)));

        assertFalse(watchService.watch("c@x"));

        verifyNoInteractions(threadSender);
        verify(patchCardService, never()).markHasThread(anyString());
    }

    @Test
    void watch_WithoutPlatformIdentity_ShouldFail() {
        card.setPlatformMessageId(null);
        when(patchCardService.findByHeader("c@x")).thenReturn(Optional.of(card));

        assertFalse(watchService.watch("c@x"));

        verifyNoInteractions(threadService, threadSender);
        verify(processingLockService, never()).tryLock(anyString(), anyString());
    }

    @Test
    void watch_UnknownCard_ShouldFail() {
        when(patchCardService.findByHeader("nope@x")).thenReturn(Optional.empty());

        assertFalse(watchService.watch("nope@x"));
    }

    @Test
    void autoWatch_WhenPlatformCreatesNothing_ShouldLeaveCardUnthreaded() {
        when(threadService.findByCardHeader("c@x")).thenReturn(Optional.empty());
        when(threadService.prepareOverview("c@x")).thenReturn(Optional.of(overview));
        when(threadSender.createThreadAndSendOverview(anyString(), anyString(), any(ThreadOverview.class))).thenReturn(null);

        assertFalse(watchService.autoWatch(card));

        assertFalse(card.isHasThread());
        verify(threadService, never()).create(anyString(), anyString(), anyString());
        verify(patchCardService, never()).markHasThread(anyString());
    }

    @Test
    void threadName_ShouldBeCappedAtHundredCharacters() {
        String longSubject = "x".repeat(150);

        assertEquals(100, WatchService.threadName(longSubject).length());
    }
}
