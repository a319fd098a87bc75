package lkml.watch.app.model;

import lkml.watch.app.entity.FeedMessage;
import lombok.Value;

/**
 * Where a reply chain ends up.
 * {@code patch} is the nearest patch ancestor actually answered (possibly a series sub-patch),
 * {@code root} is the canonical card owner: the cover letter for a series, otherwise the patch itself.
 */
@Value
public class ReplyTarget {
    FeedMessage patch;
    FeedMessage root;
}
