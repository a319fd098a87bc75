package lkml.watch.app.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one monitoring cycle across all subscribed subsystems.
 */
@Data
public class MonitoringResult {
    private int totalSubsystems;
    private int processedSubsystems;
    private int totalNewCount;
    private int totalReplyCount;
    private List<SubsystemResult> results = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
    private Instant startTime;
    private Instant endTime;

    public int getErrorCount() {
        return errors.size();
    }

    @Data
    public static class SubsystemResult {
        private final String subsystem;
        private int newCount;
        private int replyCount;
        private int failedCount;
        private boolean skipped;
        private String error;
    }
}
