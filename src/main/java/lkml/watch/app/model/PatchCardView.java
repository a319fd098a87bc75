package lkml.watch.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Renderable card data handed to the card sender, and the read model of a persisted card
 * enriched with its series listing.
 */
@Value
@Builder(toBuilder = true)
public class PatchCardView {
    String messageIdHeader;
    String subsystemName;
    String subject;
    String author;
    String url;
    Instant expiresAt;
    boolean seriesPatch;
    String seriesMessageId;
    Integer patchVersion;
    Integer patchIndex;
    Integer patchTotal;
    boolean coverLetter;
    boolean hasThread;
    String platformMessageId;
    String platformChannelId;
    @Singular("seriesPatchEntry")
    List<SeriesPatchInfo> seriesPatches;
    @Singular
    List<String> matchedFilters;
}
