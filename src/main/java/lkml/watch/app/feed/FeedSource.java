package lkml.watch.app.feed;

import java.util.List;

/**
 * Pulls new entries of a mailing list. Delivery is at-least-once and may be out of order.
 */
public interface FeedSource {
    /**
     * Fetch entries published since the previous call for this subsystem.
     * @param subsystem list name, e.g. "netdev"
     * @return entries in feed order, possibly including ones already seen
     */
    List<FeedEntry> fetchNewEntries(String subsystem);
}
