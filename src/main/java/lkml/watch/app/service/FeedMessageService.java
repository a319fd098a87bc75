package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.PatchCard;
import lkml.watch.app.entity.PatchThread;
import lkml.watch.app.model.CardCreationResult;
import lkml.watch.app.model.FilterDecision;
import lkml.watch.app.model.MessageClassification;
import lkml.watch.app.model.PatchCardView;
import lkml.watch.app.model.ReplyNotice;
import lkml.watch.app.model.ReplyTarget;
import lkml.watch.app.model.SentCard;
import lkml.watch.app.model.SeriesPatchInfo;
import lkml.watch.app.model.ThreadOverview;
import lkml.watch.app.sender.PatchCardSender;
import lkml.watch.app.sender.ThreadSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Card and thread lifecycle driven by stored feed messages.
 * <p>
 * Patches create cards (series sub-patches only through their cover letter). Replies update the
 * overview of an active thread, or, when a filter matches the reply, raise the card of the patch
 * they answer and post a reply notice.
 */
@Slf4j
@Service
public class FeedMessageService {
    private static final DateTimeFormatter NOTICE_DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    static final String CARD_LOCK_PREFIX = "card:";

    private final PatchCardService patchCardService;
    private final PatchCardFilterService patchCardFilterService;
    private final SeriesResolver seriesResolver;
    private final ReplyChainResolver replyChainResolver;
    private final ThreadService threadService;
    private final WatchService watchService;
    private final ProcessingLockService processingLockService;
    private final PatchCardSender patchCardSender;
    private final ThreadSender threadSender;

    @Value("${lkml.lock.card-wait-attempts:5}")
    private int cardLockAttempts = 5;

    @Value("${lkml.lock.card-wait-ms:1000}")
    private long cardLockWaitMs = 1000;

    public FeedMessageService(
            PatchCardService patchCardService,
            PatchCardFilterService patchCardFilterService,
            SeriesResolver seriesResolver,
            ReplyChainResolver replyChainResolver,
            ThreadService threadService,
            WatchService watchService,
            ProcessingLockService processingLockService,
            PatchCardSender patchCardSender,
            ThreadSender threadSender) {
        this.patchCardService = patchCardService;
        this.patchCardFilterService = patchCardFilterService;
        this.seriesResolver = seriesResolver;
        this.replyChainResolver = replyChainResolver;
        this.threadService = threadService;
        this.watchService = watchService;
        this.processingLockService = processingLockService;
        this.patchCardSender = patchCardSender;
        this.threadSender = threadSender;
    }

    /**
     * Runs a stored message through the card and thread lifecycle.
     * @return true when the message is fully handled, false when it should be processed again next cycle
     */
    public boolean processMessage(FeedMessage message, MessageClassification classification) {
        if (classification.isPatch()) {
            return processPatch(message, classification);
        } else if (classification.isReply()) {
            return processReply(message);
        }
        return true;
    }

    private boolean processPatch(FeedMessage message, MessageClassification classification) {
        String header = message.getMessageIdHeader();
        if (header == null) {
            log.warn("Patch '{}' has no message id, skipping", message.getSubject());
            return true;
        }
        if (patchCardService.exists(header)) {
            log.debug("Patch card for {} already exists", header);
            return true;
        }
        if (classification.isSeriesPatch() && !classification.isCoverLetter()) {
            log.debug("Series sub-patch {} stored, card comes from the cover letter", header);
            return true;
        }
        // A redelivered patch whose card was already swept must not be posted again
        if (patchCardService.isExpired(message.getReceivedAt())) {
            log.debug("Patch {} is past the card timeout, not posting a card", header);
            return true;
        }

        FilterDecision decision = patchCardFilterService.shouldCreatePatchCard(message);
        if (!decision.isAllowed()) {
            log.debug("Filters rejected patch {} ({})", header, message.getSubject());
            return true;
        }

        PatchCard card = createAndSendCard(message, decision.getMatchedFilters());
        if (card == null) {
            return false;
        }
        if (patchCardFilterService.isAutoWatchEnabled(decision.getMatchedFilters()) && !card.isHasThread()) {
            watchService.autoWatch(card);
        }
        return true;
    }

    /**
     * Posts and persists the card for a root patch, one creator at a time per message id.
     * While another worker holds the card lock this waits for it, then falls back to the card it stored.
     * @return the stored card, or null when no card could be posted or found
     */
    PatchCard createAndSendCard(FeedMessage root, List<String> matchedFilters) {
        String header = root.getMessageIdHeader();
        String lockKey = CARD_LOCK_PREFIX + header;
        String nodeId = processingLockService.getNodeId();
        if (!acquireCardLock(lockKey, nodeId)) {
            log.debug("Card for {} is being created by another worker", header);
            return patchCardService.findByHeader(header).orElse(null);
        }

        try {
            Optional<PatchCard> existing = patchCardService.findByHeader(header);
            if (existing.isPresent()) {
                return existing.get();
            }

            List<SeriesPatchInfo> seriesPatches = root.isCoverLetter() && root.isSeriesPatch()
                    ? seriesResolver.listSeries(root)
                    : List.of();
            PatchCardView view = PatchCardView.builder()
                    .messageIdHeader(header)
                    .subsystemName(root.getSubsystemName())
                    .subject(root.getSubject())
                    .author(root.getAuthor())
                    .url(root.getUrl())
                    .expiresAt(patchCardService.expiryFor(root.getReceivedAt()))
                    .seriesPatch(root.isSeriesPatch())
                    .seriesMessageId(root.getSeriesMessageId())
                    .patchVersion(root.getPatchVersion())
                    .patchIndex(root.getPatchIndex())
                    .patchTotal(root.getPatchTotal())
                    .coverLetter(root.isCoverLetter())
                    .seriesPatches(seriesPatches)
                    .matchedFilters(matchedFilters)
                    .build();

            SentCard sent;
            try {
                sent = patchCardSender.send(view);
            } catch (RuntimeException e) {
                log.error("Failed to send patch card for {}: {}", header, e.getMessage(), e);
                return null;
            }
            if (sent == null || sent.getMessageId() == null || sent.getMessageId().isBlank()) {
                log.warn("Patch card for {} was not posted, not persisting it", header);
                return null;
            }

            CardCreationResult result = patchCardService.createFromMessage(root, sent);
            if (!result.isCreated()) {
                log.info("Patch card {} already existed, kept platform message {}",
                        header, result.getCard().getPlatformMessageId());
            }
            return result.getCard();
        } finally {
            processingLockService.releaseLock(lockKey, nodeId);
        }
    }

    private boolean acquireCardLock(String lockKey, String nodeId) {
        for (int attempt = 1; attempt <= cardLockAttempts; attempt++) {
            if (processingLockService.tryLock(lockKey, nodeId)) {
                return true;
            }
            if (attempt < cardLockAttempts && cardLockWaitMs > 0) {
                try {
                    Thread.sleep(cardLockWaitMs);
                } catch (InterruptedException e) {
                    log.warn("Interrupted while waiting for lock {}", lockKey);
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    private boolean processReply(FeedMessage reply) {
        if (MessageIds.primaryReference(reply.getInReplyToHeader()) == null) {
            log.debug("Reply {} has no usable in-reply-to header", reply.getMessageIdHeader());
            return true;
        }

        Optional<ReplyTarget> target = replyChainResolver.resolve(reply);
        PatchCard card = target.flatMap(t -> patchCardService.findCardForPatch(t.getRoot())).orElse(null);

        if (card != null) {
            Optional<PatchThread> thread = threadService.findByCardHeader(card.getMessageIdHeader());
            if (thread.isPresent() && thread.get().isActive()) {
                return updateThreadWithReply(thread.get(), card, target.get(), reply);
            }
        }

        return processReplyPerspective(reply, target.orElse(null), card);
    }

    private boolean updateThreadWithReply(PatchThread thread, PatchCard card, ReplyTarget target, FeedMessage reply) {
        Optional<PatchCardView> view = patchCardService.getCardView(card.getMessageIdHeader());
        if (view.isEmpty()) {
            return true;
        }
        Integer targetIndex = targetIndex(view.get(), target.getPatch().getMessageIdHeader());
        if (targetIndex == null) {
            log.debug("Reply {} targets {} which is not part of card {}",
                    reply.getMessageIdHeader(), target.getPatch().getMessageIdHeader(), card.getMessageIdHeader());
            return true;
        }

        String overviewMessageId = overviewMessageId(thread);
        if (overviewMessageId == null) {
            log.warn("Thread {} has no overview message to update", thread.getThreadId());
            return true;
        }

        Optional<ThreadOverview> overview = threadService.prepareOverview(card.getMessageIdHeader());
        if (overview.isEmpty()) {
            return true;
        }

        boolean updated;
        try {
            updated = threadSender.updateThreadOverview(thread.getThreadId(), overviewMessageId, overview.get());
        } catch (RuntimeException e) {
            log.error("Failed to update overview of thread {}: {}", thread.getThreadId(), e.getMessage(), e);
            return false;
        }
        if (!updated) {
            log.warn("Overview of thread {} was not updated for reply {}", thread.getThreadId(), reply.getMessageIdHeader());
            return false;
        }
        log.info("Updated thread {} with reply {} (patch index {})",
                thread.getThreadId(), reply.getMessageIdHeader(), targetIndex);
        notifyThreadUpdate(thread, card);
        return true;
    }

    // 0 for the cover letter, 1 for a single patch, the patch index for a listed sub-patch
    static Integer targetIndex(PatchCardView card, String patchMessageIdHeader) {
        if (patchMessageIdHeader.equals(card.getMessageIdHeader())) {
            return card.isSeriesPatch() ? 0 : 1;
        }
        if (!card.isSeriesPatch()) {
            return null;
        }
        return card.getSeriesPatches().stream()
                .filter(p -> patchMessageIdHeader.equals(p.getMessageId()))
                .map(SeriesPatchInfo::getPatchIndex)
                .findFirst()
                .orElse(null);
    }

    private static String overviewMessageId(PatchThread thread) {
        if (thread.getOverviewMessageId() != null && !thread.getOverviewMessageId().isBlank()) {
            return thread.getOverviewMessageId();
        }
        Map<Integer, String> subPatchMessages = thread.getSubPatchMessages();
        if (subPatchMessages == null || subPatchMessages.isEmpty()) {
            return null;
        }
        return new TreeMap<>(subPatchMessages).firstEntry().getValue();
    }

    private void notifyThreadUpdate(PatchThread thread, PatchCard card) {
        if (card.getPlatformChannelId() == null || card.getPlatformChannelId().isBlank()) {
            log.debug("No channel known for card {}, skipping update notification", card.getMessageIdHeader());
            return;
        }
        try {
            if (!threadSender.sendThreadUpdateNotification(
                    card.getPlatformChannelId(), thread.getThreadId(), card.getPlatformMessageId())) {
                log.warn("Update notification for thread {} was not sent", thread.getThreadId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to send update notification for thread {}: {}", thread.getThreadId(), e.getMessage(), e);
        }
    }

    /**
     * A reply on a patch without an active thread. Only replies matched by a filter count:
     * they raise the card of the answered patch and post a reply notice.
     * Returns false while the card or the notice could not be posted.
     */
    private boolean processReplyPerspective(FeedMessage reply, ReplyTarget target, PatchCard card) {
        if (target == null) {
            log.debug("No patch found for reply {}", reply.getMessageIdHeader());
            return true;
        }
        FeedMessage root = target.getRoot();

        FilterDecision decision = patchCardFilterService.shouldCreatePatchCard(reply);
        if (!decision.isAllowed() || !decision.hasMatches()) {
            log.debug("Reply {} matched no filter", reply.getMessageIdHeader());
            return true;
        }
        if (card != null && card.isHasThread()) {
            log.debug("Card {} already has a thread, not sending a reply notice", card.getMessageIdHeader());
            return true;
        }

        if (card == null) {
            if (root.isSeriesPatch() && !root.isCoverLetter()) {
                log.debug("Reply {} answers sub-patch {} of a series without a known cover letter",
                        reply.getMessageIdHeader(), root.getMessageIdHeader());
                return true;
            }
            card = createAndSendCard(root, decision.getMatchedFilters());
            if (card == null) {
                log.info("No card for {} yet, reply {} is retried next cycle",
                        root.getMessageIdHeader(), reply.getMessageIdHeader());
                return false;
            }
        }

        if (!sendReplyNotice(reply, root)) {
            return false;
        }

        if (patchCardFilterService.isAutoWatchEnabled(decision.getMatchedFilters()) && !card.isHasThread()) {
            watchService.autoWatch(card);
        }
        return true;
    }

    private boolean sendReplyNotice(FeedMessage reply, FeedMessage root) {
        String author = reply.getAuthor();
        if (reply.getAuthorEmail() != null && !reply.getAuthorEmail().isBlank()) {
            author = author + " <" + reply.getAuthorEmail() + ">";
        }
        ReplyNotice notice = ReplyNotice.builder()
                .replyAuthor(author)
                .replySubject(reply.getSubject())
                .replyUrl(reply.getUrl())
                .replySubsystem(reply.getSubsystemName())
                .replyDate(reply.getReceivedAt() != null ? NOTICE_DATE_FORMAT.format(reply.getReceivedAt()) : "")
                .rootSubject(root.getSubject())
                .rootUrl(root.getUrl())
                .build();
        try {
            patchCardSender.sendReplyNotification(notice);
            log.info("Sent reply notice for {} on {}", reply.getMessageIdHeader(), root.getMessageIdHeader());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to send reply notice for {}: {}", reply.getMessageIdHeader(), e.getMessage(), e);
            return false;
        }
    }
}
