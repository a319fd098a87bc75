package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.model.SeriesPatchInfo;
import lkml.watch.app.repository.FeedMessageRepository;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the sub-patch listing of a series from the messages stored so far.
 */
@Component
public class SeriesResolver {
    private final FeedMessageRepository feedMessageRepository;

    public SeriesResolver(FeedMessageRepository feedMessageRepository) {
        this.feedMessageRepository = feedMessageRepository;
    }

    public List<SeriesPatchInfo> listSeries(FeedMessage coverLetter) {
        return listSeries(coverLetter.getSeriesMessageId(), coverLetter.getMessageIdHeader(), coverLetter.getPatchTotal());
    }

    /**
     * Known sub-patches of a series, ascending by patch index.
     * The cover letter (index 0), replies and the requesting message itself are left out.
     */
    public List<SeriesPatchInfo> listSeries(String seriesMessageId, String excludeMessageIdHeader, Integer seriesTotal) {
        if (seriesMessageId == null) {
            return List.of();
        }
        return feedMessageRepository.findBySeriesMessageId(seriesMessageId).stream()
                .filter(m -> m.isPatch() && !m.isReply())
                .filter(m -> m.getPatchIndex() != null && m.getPatchIndex() != 0)
                .filter(m -> !m.getMessageIdHeader().equals(excludeMessageIdHeader))
                .sorted(Comparator.comparing(FeedMessage::getPatchIndex)
                        .thenComparing(FeedMessage::getReceivedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(m -> SeriesPatchInfo.builder()
                        .subject(m.getSubject())
                        .patchIndex(m.getPatchIndex())
                        .patchTotal(m.getPatchTotal() != null ? m.getPatchTotal() : (seriesTotal != null ? seriesTotal : 0))
                        .messageId(m.getMessageIdHeader())
                        .url(m.getUrl() != null ? m.getUrl() : "")
                        .build())
                .collect(Collectors.toList());
    }
}
