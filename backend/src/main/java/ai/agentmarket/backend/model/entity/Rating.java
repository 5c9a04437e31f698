package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.store.LedgerRecord;
import ai.agentmarket.backend.store.RecordType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One party's rating of the other after a completed job. Keyed by (job, rater).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Rating implements LedgerRecord {

    private long id;

    private long jobId;

    private String rater;

    private String ratee;

    private int rating;

    private String review;

    private Instant timestamp;

    private long version;

    public static String key(long jobId, String rater) {
        return RecordType.RATING.key(jobId, rater);
    }

    @Override
    public RecordType recordType() {
        return RecordType.RATING;
    }

    @Override
    public String ledgerKey() {
        return key(jobId, rater);
    }

    @Override
    public Long jobScope() {
        return jobId;
    }

    @Override
    public Rating copy() {
        return toBuilder().build();
    }
}
