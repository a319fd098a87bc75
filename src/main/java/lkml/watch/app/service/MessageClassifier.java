package lkml.watch.app.service;

import lkml.watch.app.model.MessageClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a mailing-list message from its subject and reply header.
 * Recognizes conventional patch tags such as {@code [PATCH]}, {@code [PATCH v2 3/5]} or
 * {@code [RFC PATCH net-next v3 0/7]}. Never throws: anything unparsable is a plain message.
 */
@Slf4j
@Component
public class MessageClassifier {
    private static final Pattern REPLY_PREFIX = Pattern.compile("^\\s*(re|fwd?|aw)\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern PATCH_TAG = Pattern.compile("\\[([^\\[\\]]*?\\bPATCH\\b[^\\[\\]]*)]", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERSION = Pattern.compile("^v(\\d{1,6})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern POSITION = Pattern.compile("^(\\d{1,6})/(\\d{1,6})$");

    /**
     * @param subject raw subject line
     * @param messageIdHeader the message's own Message-ID
     * @param inReplyToHeader raw In-Reply-To header, may be null
     */
    public MessageClassification classify(String subject, String messageIdHeader, String inReplyToHeader) {
        String parent = MessageIds.primaryReference(inReplyToHeader);
        try {
            if (subject == null || subject.isBlank()) {
                return MessageClassification.plain(parent != null);
            }
            if (REPLY_PREFIX.matcher(subject).find()) {
                return MessageClassification.plain(true);
            }
            Matcher tag = PATCH_TAG.matcher(subject);
            if (!tag.find()) {
                return MessageClassification.plain(parent != null);
            }
            return classifyPatchTag(tag.group(1), MessageIds.normalize(messageIdHeader), parent);
        } catch (RuntimeException e) {
            log.warn("Could not classify subject '{}': {}", subject, e.getMessage());
            return MessageClassification.plain(parent != null);
        }
    }

    private MessageClassification classifyPatchTag(String tag, String ownId, String parent) {
        Integer version = null;
        Integer index = null;
        Integer total = null;
        boolean coverMarker = false;

        for (String token : tag.trim().split("\\s+")) {
            Matcher v = VERSION.matcher(token);
            Matcher p = POSITION.matcher(token);
            if (v.matches()) {
                version = Integer.parseInt(v.group(1));
            } else if (p.matches()) {
                index = Integer.parseInt(p.group(1));
                total = Integer.parseInt(p.group(2));
            } else if (token.equalsIgnoreCase("cover") || token.equalsIgnoreCase("cover-letter")) {
                coverMarker = true;
            }
        }

        boolean coverLetter = coverMarker || (index != null && index == 0);
        boolean series = total != null && total > 1;

        String seriesMessageId = null;
        if (coverLetter) {
            seriesMessageId = ownId;
        } else if (series) {
            // git send-email threads every sub-patch under the cover letter (or under 1/n when there is none)
            seriesMessageId = parent != null ? parent : ownId;
        }

        return MessageClassification.builder()
                .patch(true)
                .reply(false)
                .coverLetter(coverLetter)
                .seriesPatch(series)
                .version(version)
                .index(index)
                .total(total)
                .seriesMessageId(seriesMessageId)
                .build();
    }
}
