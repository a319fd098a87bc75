package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.model.MessageSaveResult;
import lkml.watch.app.repository.FeedMessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Idempotent storage of feed messages keyed on the Message-ID header.
 * A message row is written once; later deliveries only backfill classification and missing fields.
 */
@Slf4j
@Service
public class FeedMessageStore {
    private final FeedMessageRepository feedMessageRepository;

    public FeedMessageStore(FeedMessageRepository feedMessageRepository) {
        this.feedMessageRepository = feedMessageRepository;
    }

    public MessageSaveResult save(FeedMessage incoming) {
        String header = incoming.getMessageIdHeader();
        Optional<FeedMessage> existing = feedMessageRepository.findByMessageIdHeader(header);
        if (existing.isPresent()) {
            return new MessageSaveResult(backfill(existing.get(), incoming), false);
        }

        try {
            return new MessageSaveResult(feedMessageRepository.saveAndFlush(incoming), true);
        } catch (DataIntegrityViolationException e) {
            // Inserted by a concurrent cycle between our lookup and insert
            log.debug("Concurrent insert detected for message {}, re-reading", header);
            FeedMessage winner = feedMessageRepository.findByMessageIdHeader(header).orElseThrow(() -> e);
            return new MessageSaveResult(backfill(winner, incoming), false);
        }
    }

    /**
     * Flags a message as fully handled so later deliveries do not run it through the lifecycle again.
     */
    public void markProcessed(FeedMessage message) {
        feedMessageRepository.markProcessed(message.getMessageIdHeader());
        message.setProcessed(true);
    }

    private FeedMessage backfill(FeedMessage stored, FeedMessage incoming) {
        boolean changed = false;

        if (stored.isPatch() != incoming.isPatch()
                || stored.isReply() != incoming.isReply()
                || stored.isSeriesPatch() != incoming.isSeriesPatch()
                || stored.isCoverLetter() != incoming.isCoverLetter()
                || !Objects.equals(stored.getPatchVersion(), incoming.getPatchVersion())
                || !Objects.equals(stored.getPatchIndex(), incoming.getPatchIndex())
                || !Objects.equals(stored.getPatchTotal(), incoming.getPatchTotal())
                || !Objects.equals(stored.getSeriesMessageId(), incoming.getSeriesMessageId())) {
            stored.setPatch(incoming.isPatch());
            stored.setReply(incoming.isReply());
            stored.setSeriesPatch(incoming.isSeriesPatch());
            stored.setCoverLetter(incoming.isCoverLetter());
            stored.setPatchVersion(incoming.getPatchVersion());
            stored.setPatchIndex(incoming.getPatchIndex());
            stored.setPatchTotal(incoming.getPatchTotal());
            stored.setSeriesMessageId(incoming.getSeriesMessageId());
            changed = true;
        }
        if (stored.getReceivedAt() == null && incoming.getReceivedAt() != null) {
            stored.setReceivedAt(incoming.getReceivedAt());
            changed = true;
        }
        if (stored.getInReplyToHeader() == null && incoming.getInReplyToHeader() != null) {
            stored.setInReplyToHeader(incoming.getInReplyToHeader());
            changed = true;
        }
        if (stored.getUrl() == null && incoming.getUrl() != null) {
            stored.setUrl(incoming.getUrl());
            changed = true;
        }

        return changed ? feedMessageRepository.save(stored) : stored;
    }
}
