package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.model.ReplyTarget;
import lkml.watch.app.repository.FeedMessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a reply to the patch it ultimately answers by walking In-Reply-To references,
 * possibly through other replies. Missing links, cycles and over-long chains resolve to nothing.
 */
@Slf4j
@Component
public class ReplyChainResolver {
    static final int MAX_CHAIN_DEPTH = 30;

    private final FeedMessageRepository feedMessageRepository;

    public ReplyChainResolver(FeedMessageRepository feedMessageRepository) {
        this.feedMessageRepository = feedMessageRepository;
    }

    /**
     * Find the patch a reply belongs to.
     * First follows the reference chain; when that breaks, falls back to the series id of the reply
     * (or of its direct parent) and accepts the series root if it is a known patch.
     */
    public Optional<ReplyTarget> resolve(FeedMessage reply) {
        String parentId = MessageIds.primaryReference(reply.getInReplyToHeader());
        if (parentId == null) {
            return Optional.empty();
        }

        Optional<ReplyTarget> viaChain = walkChain(parentId);
        if (viaChain.isPresent()) {
            return viaChain;
        }

        String seriesId = reply.getSeriesMessageId();
        if (seriesId == null) {
            seriesId = feedMessageRepository.findByMessageIdHeader(parentId)
                    .map(FeedMessage::getSeriesMessageId)
                    .orElse(null);
        }
        if (seriesId == null) {
            log.debug("No patch found for reply {} (in-reply-to {})", reply.getMessageIdHeader(), parentId);
            return Optional.empty();
        }

        Optional<ReplyTarget> viaSeries = feedMessageRepository.findByMessageIdHeader(seriesId)
                .filter(ReplyChainResolver::isRootPatch)
                .map(root -> new ReplyTarget(root, root));
        if (viaSeries.isPresent()) {
            log.debug("Resolved reply {} through series id {}", reply.getMessageIdHeader(), seriesId);
        }
        return viaSeries;
    }

    private Optional<ReplyTarget> walkChain(String startId) {
        Set<String> visited = new HashSet<>();
        String currentId = startId;
        int depth = 0;

        while (currentId != null && depth < MAX_CHAIN_DEPTH) {
            if (!visited.add(currentId)) {
                log.debug("Reference cycle detected at {}", currentId);
                return Optional.empty();
            }

            Optional<FeedMessage> current = feedMessageRepository.findByMessageIdHeader(currentId);
            if (current.isEmpty()) {
                return Optional.empty();
            }

            FeedMessage message = current.get();
            if (isRootPatch(message)) {
                return Optional.of(new ReplyTarget(message, canonicalRoot(message)));
            }

            currentId = MessageIds.primaryReference(message.getInReplyToHeader());
            depth++;
        }

        if (currentId != null) {
            log.debug("Reply chain starting at {} exceeds {} hops, giving up", startId, MAX_CHAIN_DEPTH);
        }
        return Optional.empty();
    }

    // Series sub-patches are represented by their cover letter
    private FeedMessage canonicalRoot(FeedMessage patch) {
        String seriesId = patch.getSeriesMessageId();
        if (!patch.isSeriesPatch() || patch.isCoverLetter() || seriesId == null
                || seriesId.equals(patch.getMessageIdHeader())) {
            return patch;
        }
        return feedMessageRepository.findByMessageIdHeader(seriesId)
                .filter(ReplyChainResolver::isRootPatch)
                .orElse(patch);
    }

    static boolean isRootPatch(FeedMessage message) {
        return message.isPatch() && !message.isReply();
    }
}
