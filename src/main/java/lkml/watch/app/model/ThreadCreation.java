package lkml.watch.app.model;

import lombok.Value;

import java.util.Map;

@Value
public class ThreadCreation {
    String threadId;
    Map<Integer, String> subPatchMessages;
}
