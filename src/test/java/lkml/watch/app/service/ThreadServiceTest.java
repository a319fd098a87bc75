package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.PatchThread;
import lkml.watch.app.model.PatchCardView;
import lkml.watch.app.model.SeriesPatchInfo;
import lkml.watch.app.model.ThreadNode;
import lkml.watch.app.model.ThreadOverview;
import lkml.watch.app.repository.FeedMessageRepository;
import lkml.watch.app.repository.PatchThreadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ThreadServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-28T12:00:00Z");

    @Mock
    private PatchThreadRepository patchThreadRepository;

    @Mock
    private FeedMessageRepository feedMessageRepository;

    @Mock
    private PatchCardService patchCardService;

    private ThreadService threadService;

    private final Map<String, FeedMessage> stored = new HashMap<>();

    @BeforeEach
    void setUp() {
        threadService = new ThreadService(patchThreadRepository, feedMessageRepository, patchCardService,
                new ThreadTreeBuilder(), new ThreadTreeFormatter());
        lenient().when(feedMessageRepository.findByMessageIdHeader(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(stored.get(inv.<String>getArgument(0))));
        lenient().when(feedMessageRepository.findRepliesTo(anyString(), any(Pageable.class)))
                .thenAnswer(inv -> {
                    String parent = inv.getArgument(0);
                    List<FeedMessage> replies = new ArrayList<>();
                    for (FeedMessage m : stored.values()) {
                        if (m.getInReplyToHeader() != null && m.getInReplyToHeader().contains(parent)) {
                            replies.add(m);
                        }
                    }
                    return replies;
                });
    }

    private FeedMessage store(String id, String inReplyTo, boolean reply, int minute) {
        FeedMessage message = new FeedMessage();
        message.setMessageIdHeader(id);
        message.setInReplyToHeader(inReplyTo);
        message.setReply(reply);
        message.setPatch(!reply);
        message.setSubject(id);
        message.setReceivedAt(T0.plusSeconds(60L * minute));
        stored.put(id, message);
        return message;
    }

    private static PatchThread thread(String threadId, boolean active) {
        PatchThread thread = new PatchThread();
        thread.setThreadId(threadId);
        thread.setPatchCardMessageIdHeader("c@x");
        thread.setActive(active);
        return thread;
    }

    @Test
    void create_WhenThreadAlreadyRecorded_ShouldReturnExisting() {
        // Given
        PatchThread existing = thread("t-1", true);
        when(patchThreadRepository.findByPatchCardMessageIdHeader("c@x")).thenReturn(Optional.of(existing));

        // When
        PatchThread result = threadService.create("c@x", "t-2", "name");

        // Then
        assertSame(existing, result);
        verify(patchThreadRepository, never()).saveAndFlush(any(PatchThread.class));
    }

    @Test
    void create_WhenConcurrentInsertWins_ShouldReturnWinner() {
        PatchThread winner = thread("t-1", true);
        when(patchThreadRepository.findByPatchCardMessageIdHeader("c@x"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(patchThreadRepository.saveAndFlush(any(PatchThread.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertSame(winner, threadService.create("c@x", "t-2", "name"));
    }

    @Test
    void archive_ShouldBeOneWay() {
        // Given
        PatchThread thread = thread("t-1", true);
        when(patchThreadRepository.findByThreadId("t-1")).thenReturn(Optional.of(thread));

        // When
        assertTrue(threadService.archive("t-1"));
        Instant archivedAt = thread.getArchivedAt();
        assertTrue(threadService.archive("t-1"));

        // Then
        assertFalse(thread.isActive());
        assertNotNull(archivedAt);
        assertEquals(archivedAt, thread.getArchivedAt());
        verify(patchThreadRepository, times(1)).save(thread);
    }

    @Test
    void archive_UnknownThread_ShouldReturnFalse() {
        when(patchThreadRepository.findByThreadId("nope")).thenReturn(Optional.empty());

        assertFalse(threadService.archive("nope"));
    }

    @Test
    void updateSubPatchMessages_ShouldReplaceMap() {
        PatchThread thread = thread("t-1", true);
        when(patchThreadRepository.findByThreadId("t-1")).thenReturn(Optional.of(thread));

        assertTrue(threadService.updateSubPatchMessages("t-1", Map.of(0, "m0", 1, "m1")));
        assertEquals(Map.of(0, "m0", 1, "m1"), thread.getSubPatchMessages());
        verify(patchThreadRepository).save(thread);
    }

    @Test
    void collectReplies_ShouldFollowNestedRepliesOnly() {
        // Given
        store("c@x", null, false, 0);
        store("r1@x", "<c@x>", true, 1);
        store("r2@x", "<r1@x>", true, 2);
        store("p1@x", "<c@x>", false, 3);

        // When
        List<FeedMessage> replies = threadService.collectReplies("c@x");

        // Then
        assertEquals(List.of("r1@x", "r2@x"),
                replies.stream().map(FeedMessage::getMessageIdHeader).collect(Collectors.toList()));
    }

    @Test
    void collectReplies_ShouldStopAfterTwentyLevels() {
        store("c@x", null, false, 0);
        String parent = "c@x";
        for (int i = 0; i < 25; i++) {
            store("r" + i + "@x", "<" + parent + ">", true, i + 1);
            parent = "r" + i + "@x";
        }

        assertEquals(ThreadService.MAX_REPLY_LEVELS, threadService.collectReplies("c@x").size());
    }

    @Test
    void prepareOverview_ShouldIncludeSubPatchesAndTheirReplies() {
        // Given
        FeedMessage cover = store("c@x", null, false, 0);
        cover.setCoverLetter(true);
        store("p1@x", "<c@x>", false, 1);
        store("p2@x", "<c@x>", false, 2);
        store("r1@x", "<c@x>", true, 5);
        store("r2@x", "<p1@x>", true, 3);
        PatchCardView view = PatchCardView.builder()
                .messageIdHeader("c@x")
                .subject("c@x")
                .seriesPatch(true)
                .coverLetter(true)
                .seriesPatchEntry(SeriesPatchInfo.builder().messageId("p1@x").patchIndex(1).patchTotal(2).build())
                .seriesPatchEntry(SeriesPatchInfo.builder().messageId("p2@x").patchIndex(2).patchTotal(2).build())
                .build();
        when(patchCardService.getCardView("c@x")).thenReturn(Optional.of(view));

        // When
        ThreadOverview overview = threadService.prepareOverview("c@x").orElseThrow();

        // Then
        ThreadNode root = overview.getRoot();
        assertEquals(ThreadNode.NodeType.COVER_LETTER, root.getType());
        assertEquals(List.of("p1@x", "p2@x", "r1@x"), root.getChildren().stream()
                .map(n -> n.getMessage().getMessageIdHeader()).collect(Collectors.toList()));
        assertEquals("r2@x", root.getChildren().get(0).getChildren().get(0).getMessage().getMessageIdHeader());
    }

    @Test
    void prepareOverview_WithoutCard_ShouldBeEmpty() {
        when(patchCardService.getCardView("c@x")).thenReturn(Optional.empty());

        assertTrue(threadService.prepareOverview("c@x").isEmpty());
    }
}
