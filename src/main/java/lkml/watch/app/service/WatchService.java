package lkml.watch.app.service;

import lkml.watch.app.entity.PatchCard;
import lkml.watch.app.entity.PatchThread;
import lkml.watch.app.model.ThreadCreation;
import lkml.watch.app.model.ThreadOverview;
import lkml.watch.app.sender.ThreadSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Opens discussion threads on posted cards, either on operator request or through auto-watch.
 */
@Slf4j
@Service
public class WatchService {
    static final int MAX_THREAD_NAME_LENGTH = 100;
    static final String THREAD_LOCK_PREFIX = "thread:";

    private final PatchCardService patchCardService;
    private final ThreadService threadService;
    private final ThreadSender threadSender;
    private final ProcessingLockService processingLockService;

    public WatchService(PatchCardService patchCardService, ThreadService threadService, ThreadSender threadSender,
                        ProcessingLockService processingLockService) {
        this.patchCardService = patchCardService;
        this.threadService = threadService;
        this.threadSender = threadSender;
        this.processingLockService = processingLockService;
    }

    public boolean watch(String cardMessageIdHeader) {
        Optional<PatchCard> card = patchCardService.findByHeader(cardMessageIdHeader);
        if (card.isEmpty()) {
            log.warn("Cannot watch {}: no patch card", cardMessageIdHeader);
            return false;
        }
        return openThread(card.get());
    }

    public boolean autoWatch(PatchCard card) {
        log.info("Auto-watching patch card {}", card.getMessageIdHeader());
        return openThread(card);
    }

    /**
     * Idempotent: an existing active thread is reused, an archived one is left alone.
     * Only one worker at a time may open the thread of a card.
     * @return true when the card ends up with an active thread
     */
    private boolean openThread(PatchCard card) {
        String header = card.getMessageIdHeader();
        if (card.getPlatformMessageId() == null || card.getPlatformMessageId().isBlank()) {
            log.warn("Patch card {} has no platform message to anchor a thread on", header);
            return false;
        }

        String lockKey = THREAD_LOCK_PREFIX + header;
        String nodeId = processingLockService.getNodeId();
        if (!processingLockService.tryLock(lockKey, nodeId)) {
            log.debug("Thread for card {} is being opened by another worker", header);
            return false;
        }
        try {
            return openThreadLocked(card, header);
        } finally {
            processingLockService.releaseLock(lockKey, nodeId);
        }
    }

    private boolean openThreadLocked(PatchCard card, String header) {
        Optional<PatchThread> existing = threadService.findByCardHeader(header);
        if (existing.isPresent()) {
            if (!existing.get().isActive()) {
                log.info("Thread {} for card {} is archived, not reopening", existing.get().getThreadId(), header);
                return false;
            }
            if (!card.isHasThread()) {
                patchCardService.markHasThread(header);
                card.setHasThread(true);
            }
            log.debug("Card {} already has thread {}", header, existing.get().getThreadId());
            return true;
        }

        Optional<ThreadOverview> overview = threadService.prepareOverview(header);
        if (overview.isEmpty()) {
            return false;
        }

        String threadName = threadName(card.getSubject());
        ThreadCreation creation;
        try {
            creation = threadSender.createThreadAndSendOverview(threadName, card.getPlatformMessageId(), overview.get());
        } catch (RuntimeException e) {
            log.error("Failed to create thread for card {}: {}", header, e.getMessage(), e);
            return false;
        }
        if (creation == null || creation.getThreadId() == null || creation.getThreadId().isBlank()) {
            log.warn("Thread platform did not create a thread for card {}", header);
            return false;
        }

        PatchThread thread = threadService.create(header, creation.getThreadId(), threadName);
        if (creation.getSubPatchMessages() != null && !creation.getSubPatchMessages().isEmpty()) {
            threadService.updateSubPatchMessages(thread.getThreadId(), creation.getSubPatchMessages());
        }
        patchCardService.markHasThread(header);
        card.setHasThread(true);
        log.info("Opened thread {} for card {}", thread.getThreadId(), header);
        return true;
    }

    static String threadName(String subject) {
        String name = subject == null || subject.isBlank() ? "Patch discussion" : subject.trim();
        return name.length() > MAX_THREAD_NAME_LENGTH ? name.substring(0, MAX_THREAD_NAME_LENGTH) : name;
    }
}
