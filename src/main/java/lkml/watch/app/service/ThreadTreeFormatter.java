package lkml.watch.app.service;

import lkml.watch.app.entity.FeedMessage;
import lkml.watch.app.model.PatchCardView;
import lkml.watch.app.model.ThreadNode;
import lkml.watch.app.model.ThreadOverview;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Plain-text rendering of a thread overview, one line per message, indented by depth.
 */
@Component
public class ThreadTreeFormatter {
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);
    static final String NO_REPLIES = "_(No replies)_";

    public String format(ThreadOverview overview) {
        PatchCardView card = overview.getCard();
        StringBuilder out = new StringBuilder();
        out.append('[').append(card.getSubject()).append("](").append(nullToEmpty(card.getUrl())).append(")\n\n");

        ThreadNode root = overview.getRoot();
        if (root == null || root.getChildren().isEmpty()) {
            out.append(NO_REPLIES);
            return out.toString();
        }
        appendNode(out, root, 0);
        return out.toString().stripTrailing();
    }

    private void appendNode(StringBuilder out, ThreadNode node, int depth) {
        FeedMessage message = node.getMessage();
        out.append("\t".repeat(depth))
                .append("\\` ")
                .append(message.getReceivedAt() != null ? TIME_FORMAT.format(message.getReceivedAt()) : "----")
                .append(" [").append(subjectTag(message.getSubject())).append("](")
                .append(nullToEmpty(message.getUrl())).append(") ")
                .append(authorName(message.getAuthor()))
                .append('\n');
        for (ThreadNode child : node.getChildren()) {
            appendNode(out, child, depth + 1);
        }
    }

    // "[PATCH v2 1/3] net: fix foo" -> "[PATCH v2 1/3]"
    static String subjectTag(String subject) {
        if (subject == null) {
            return "";
        }
        int end = subject.indexOf("] ");
        return end >= 0 ? subject.substring(0, end + 1) : subject;
    }

    // "Jane Doe (Example Corp)" -> "Jane Doe"
    static String authorName(String author) {
        if (author == null) {
            return "";
        }
        int paren = author.indexOf(" (");
        return paren >= 0 ? author.substring(0, paren) : author;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
