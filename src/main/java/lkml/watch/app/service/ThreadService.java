package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.PatchThread;
import lkml.watch.app.model.PatchCardView;
import lkml.watch.app.model.ReplyHierarchy;
import lkml.watch.app.model.SeriesPatchInfo;
import lkml.watch.app.model.ThreadNode;
import lkml.watch.app.model.ThreadOverview;
import lkml.watch.app.repository.FeedMessageRepository;
import lkml.watch.app.repository.PatchThreadRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Discussion threads attached to cards, and the overview tree shown inside them.
 */
@Slf4j
@Service
public class ThreadService {
    static final int MAX_REPLY_LEVELS = 20;

    private final PatchThreadRepository patchThreadRepository;
    private final FeedMessageRepository feedMessageRepository;
    private final PatchCardService patchCardService;
    private final ThreadTreeBuilder threadTreeBuilder;
    private final ThreadTreeFormatter threadTreeFormatter;

    @Value("${lkml.thread.reply-fetch-limit:100}")
    private int replyFetchLimit = 100;

    public ThreadService(
            PatchThreadRepository patchThreadRepository,
            FeedMessageRepository feedMessageRepository,
            PatchCardService patchCardService,
            ThreadTreeBuilder threadTreeBuilder,
            ThreadTreeFormatter threadTreeFormatter) {
        this.patchThreadRepository = patchThreadRepository;
        this.feedMessageRepository = feedMessageRepository;
        this.patchCardService = patchCardService;
        this.threadTreeBuilder = threadTreeBuilder;
        this.threadTreeFormatter = threadTreeFormatter;
    }

    public Optional<PatchThread> findByCardHeader(String cardMessageIdHeader) {
        return patchThreadRepository.findByPatchCardMessageIdHeader(cardMessageIdHeader);
    }

    public Optional<PatchThread> findByThreadId(String threadId) {
        return patchThreadRepository.findByThreadId(threadId);
    }

    public long countActiveThreads() {
        return patchThreadRepository.countByActiveTrue();
    }

    /**
     * Records a thread for a card. A card never gets a second thread: an existing row is returned as is.
     */
    public PatchThread create(String cardMessageIdHeader, String threadId, String threadName) {
        Optional<PatchThread> existing = findByCardHeader(cardMessageIdHeader);
        if (existing.isPresent()) {
            log.debug("Thread for card {} already recorded as {}", cardMessageIdHeader, existing.get().getThreadId());
            return existing.get();
        }

        PatchThread thread = new PatchThread();
        thread.setPatchCardMessageIdHeader(cardMessageIdHeader);
        thread.setThreadId(threadId);
        thread.setThreadName(threadName);
        thread.setActive(true);
        try {
            PatchThread saved = patchThreadRepository.saveAndFlush(thread);
            log.info("Recorded thread {} for card {}", threadId, cardMessageIdHeader);
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("Thread for card {} was recorded concurrently", cardMessageIdHeader);
            return findByCardHeader(cardMessageIdHeader).orElseThrow(() -> e);
        }
    }

    /**
     * Archiving is one-way; an archived thread is never reactivated.
     */
    public boolean archive(String threadId) {
        Optional<PatchThread> found = patchThreadRepository.findByThreadId(threadId);
        if (found.isEmpty()) {
            return false;
        }
        PatchThread thread = found.get();
        if (!thread.isActive()) {
            return true;
        }
        thread.setActive(false);
        thread.setArchivedAt(Instant.now());
        patchThreadRepository.save(thread);
        log.info("Archived thread {}", threadId);
        return true;
    }

    public boolean updateSubPatchMessages(String threadId, Map<Integer, String> subPatchMessages) {
        return patchThreadRepository.findByThreadId(threadId)
                .map(thread -> {
                    thread.setSubPatchMessages(new LinkedHashMap<>(subPatchMessages));
                    patchThreadRepository.save(thread);
                    return true;
                })
                .orElse(false);
    }

    public boolean updateOverviewMessageId(String threadId, String overviewMessageId) {
        return patchThreadRepository.findByThreadId(threadId)
                .map(thread -> {
                    thread.setOverviewMessageId(overviewMessageId);
                    patchThreadRepository.save(thread);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Replies below a message, breadth first, at most {@value #MAX_REPLY_LEVELS} levels deep.
     * Only messages flagged as replies are followed.
     */
    public List<FeedMessage> collectReplies(String messageIdHeader) {
        List<FeedMessage> collected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(messageIdHeader);
        Deque<String> level = new ArrayDeque<>();
        level.add(messageIdHeader);

        for (int depth = 0; depth < MAX_REPLY_LEVELS && !level.isEmpty(); depth++) {
            Deque<String> next = new ArrayDeque<>();
            for (String parentId : level) {
                for (FeedMessage reply : feedMessageRepository.findRepliesTo(parentId, PageRequest.of(0, replyFetchLimit))) {
                    if (!reply.isReply() || !parentId.equals(MessageIds.primaryReference(reply.getInReplyToHeader()))) {
                        continue;
                    }
                    if (seen.add(reply.getMessageIdHeader())) {
                        collected.add(reply);
                        next.add(reply.getMessageIdHeader());
                    }
                }
            }
            level = next;
        }
        return collected;
    }

    /**
     * Overview of a card: its root message, the series sub-patches and every reply below them.
     */
    public Optional<ThreadOverview> prepareOverview(String cardMessageIdHeader) {
        Optional<PatchCardView> view = patchCardService.getCardView(cardMessageIdHeader);
        if (view.isEmpty()) {
            log.warn("No patch card {} to build an overview for", cardMessageIdHeader);
            return Optional.empty();
        }
        Optional<FeedMessage> root = feedMessageRepository.findByMessageIdHeader(cardMessageIdHeader);
        if (root.isEmpty()) {
            log.warn("Root message {} of card is not stored", cardMessageIdHeader);
            return Optional.empty();
        }

        PatchCardView card = view.get();
        Set<String> subPatchIds = card.getSeriesPatches().stream()
                .map(SeriesPatchInfo::getMessageId)
                .collect(Collectors.toSet());

        List<FeedMessage> messages = new ArrayList<>();
        messages.add(root.get());
        messages.addAll(collectReplies(cardMessageIdHeader));
        for (String subPatchId : subPatchIds) {
            feedMessageRepository.findByMessageIdHeader(subPatchId).ifPresent(subPatch -> {
                messages.add(subPatch);
                messages.addAll(collectReplies(subPatchId));
            });
        }

        ReplyHierarchy hierarchy = threadTreeBuilder.buildHierarchy(messages, cardMessageIdHeader, subPatchIds);
        ThreadNode tree = threadTreeBuilder.buildTree(root.get(), hierarchy, subPatchIds);
        ThreadOverview overview = new ThreadOverview(card, tree, hierarchy);
        if (log.isDebugEnabled()) {
            log.debug("Overview for {}:\n{}", cardMessageIdHeader, threadTreeFormatter.format(overview));
        }
        return Optional.of(overview);
    }
}
