package lkml.watch.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SeriesPatchInfo {
    String subject;
    int patchIndex;
    int patchTotal;
    String messageId;
    String url;
}
