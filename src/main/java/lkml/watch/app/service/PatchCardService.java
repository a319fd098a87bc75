package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.entity.PatchCard;
import lkml.watch.app.model.CardCreationResult;
import lkml.watch.app.model.PatchCardView;
import lkml.watch.app.model.SentCard;
import lkml.watch.app.model.SeriesPatchInfo;
import lkml.watch.app.repository.PatchCardRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence side of the patch card lifecycle: lookup, race-safe creation, thread flag and expiry.
 */
@Slf4j
@Service
public class PatchCardService {
    private final PatchCardRepository patchCardRepository;
    private final SeriesResolver seriesResolver;

    @Value("${lkml.card.timeout-hours:24}")
    private long cardTimeoutHours = 24;

    public PatchCardService(PatchCardRepository patchCardRepository, SeriesResolver seriesResolver) {
        this.patchCardRepository = patchCardRepository;
        this.seriesResolver = seriesResolver;
    }

    public Optional<PatchCard> findByHeader(String messageIdHeader) {
        if (messageIdHeader == null) {
            return Optional.empty();
        }
        return patchCardRepository.findByMessageIdHeader(messageIdHeader);
    }

    public boolean exists(String messageIdHeader) {
        return messageIdHeader != null && patchCardRepository.existsByMessageIdHeader(messageIdHeader);
    }

    /**
     * Earliest card of a series.
     * @param requirePlatformIdentity only consider cards that were actually posted
     */
    public Optional<PatchCard> findSeriesCard(String seriesMessageId, boolean requirePlatformIdentity) {
        if (seriesMessageId == null) {
            return Optional.empty();
        }
        List<PatchCard> cards = requirePlatformIdentity
                ? patchCardRepository.findSentBySeriesMessageId(seriesMessageId)
                : patchCardRepository.findBySeriesMessageIdOrderByCreatedAtAsc(seriesMessageId);
        return cards.stream().findFirst();
    }

    /**
     * The card owning a root patch: its own card, else the posted card of its series.
     */
    public Optional<PatchCard> findCardForPatch(FeedMessage root) {
        Optional<PatchCard> own = findByHeader(root.getMessageIdHeader());
        if (own.isPresent()) {
            return own;
        }
        return findSeriesCard(root.getSeriesMessageId(), true);
    }

    /**
     * Persist a card built from its root message and the identity returned by the card sender.
     */
    public CardCreationResult createFromMessage(FeedMessage root, SentCard sent) {
        PatchCard card = new PatchCard();
        card.setMessageIdHeader(root.getMessageIdHeader());
        card.setSubsystemName(root.getSubsystemName());
        card.setSubject(root.getSubject());
        card.setAuthor(root.getAuthor());
        card.setUrl(root.getUrl());
        card.setExpiresAt(expiryFor(root.getReceivedAt()));
        card.setSeriesPatch(root.isSeriesPatch());
        card.setSeriesMessageId(root.getSeriesMessageId());
        card.setPatchVersion(root.getPatchVersion());
        card.setPatchIndex(root.getPatchIndex());
        card.setPatchTotal(root.getPatchTotal());
        card.setHasThread(false);
        card.setPlatformMessageId(sent.getMessageId());
        card.setPlatformChannelId(sent.getChannelId());
        return create(card);
    }

    /**
     * Insert a card. When a concurrent writer inserted the same header first, the stored row keeps
     * its platform identity and takes this call's descriptive fields.
     */
    public CardCreationResult create(PatchCard card) {
        try {
            PatchCard saved = patchCardRepository.saveAndFlush(card);
            log.info("Created patch card for {} ({})", saved.getMessageIdHeader(), saved.getSubject());
            return CardCreationResult.created(saved);
        } catch (DataIntegrityViolationException e) {
            log.info("Patch card for {} was created concurrently, updating existing row", card.getMessageIdHeader());
            PatchCard existing = patchCardRepository.findByMessageIdHeader(card.getMessageIdHeader())
                    .orElseThrow(() -> e);
            existing.setSubsystemName(card.getSubsystemName());
            existing.setSubject(card.getSubject());
            existing.setAuthor(card.getAuthor());
            existing.setUrl(card.getUrl());
            existing.setExpiresAt(card.getExpiresAt());
            existing.setSeriesPatch(card.isSeriesPatch());
            existing.setSeriesMessageId(card.getSeriesMessageId());
            existing.setPatchVersion(card.getPatchVersion());
            existing.setPatchIndex(card.getPatchIndex());
            existing.setPatchTotal(card.getPatchTotal());
            if (isBlank(existing.getPlatformMessageId())) {
                existing.setPlatformMessageId(card.getPlatformMessageId());
                existing.setPlatformChannelId(card.getPlatformChannelId());
            }
            return CardCreationResult.alreadyExists(patchCardRepository.save(existing));
        }
    }

    public boolean markHasThread(String messageIdHeader) {
        int updated = patchCardRepository.markHasThread(messageIdHeader);
        if (updated == 0) {
            log.warn("No patch card {} to mark as threaded", messageIdHeader);
        }
        return updated > 0;
    }

    /**
     * Read model of a card, with the series listing for cover letters.
     */
    public Optional<PatchCardView> getCardView(String messageIdHeader) {
        return findByHeader(messageIdHeader).map(this::toView);
    }

    public PatchCardView toView(PatchCard card) {
        boolean coverLetter = card.getPatchIndex() != null && card.getPatchIndex() == 0;
        List<SeriesPatchInfo> seriesPatches = card.isSeriesPatch() && coverLetter
                ? seriesResolver.listSeries(card.getSeriesMessageId(), card.getMessageIdHeader(), card.getPatchTotal())
                : List.of();
        return PatchCardView.builder()
                .messageIdHeader(card.getMessageIdHeader())
                .subsystemName(card.getSubsystemName())
                .subject(card.getSubject())
                .author(card.getAuthor())
                .url(card.getUrl())
                .expiresAt(card.getExpiresAt())
                .seriesPatch(card.isSeriesPatch())
                .seriesMessageId(card.getSeriesMessageId())
                .patchVersion(card.getPatchVersion())
                .patchIndex(card.getPatchIndex())
                .patchTotal(card.getPatchTotal())
                .coverLetter(coverLetter)
                .hasThread(card.isHasThread())
                .platformMessageId(card.getPlatformMessageId())
                .platformChannelId(card.getPlatformChannelId())
                .seriesPatches(seriesPatches)
                .build();
    }

    public Instant expiryFor(Instant receivedAt) {
        Instant base = receivedAt != null ? receivedAt : Instant.now();
        return base.plus(Duration.ofHours(cardTimeoutHours));
    }

    /**
     * True when a card for a message received at the given time would already be past its expiry,
     * so the sweep has removed it (or would remove it right away).
     */
    public boolean isExpired(Instant receivedAt) {
        return receivedAt != null && !expiryFor(receivedAt).isAfter(Instant.now());
    }

    /**
     * Drops cards that expired without a discussion thread being opened.
     * @return number of cards removed
     */
    @Scheduled(fixedDelayString = "${lkml.card.sweep-interval-ms:3600000}",
            initialDelayString = "${lkml.card.sweep-interval-ms:3600000}")
    public int sweepExpiredCards() {
        List<PatchCard> expired = patchCardRepository.findByHasThreadFalseAndExpiresAtLessThanEqual(Instant.now());
        if (expired.isEmpty()) {
            return 0;
        }
        patchCardRepository.deleteAll(expired);
        log.info("Removed {} expired patch cards", expired.size());
        return expired.size();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
