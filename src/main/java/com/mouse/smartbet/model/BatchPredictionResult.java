package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.ErrorCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchPredictionResult {

    @Singular
    List<PredictionRecord> predictions;

    @Singular
    List<Failure> failures;

    public int getTotal() {
        return predictions.size() + failures.size();
    }

    public long getUnsupportedCount() {
        return failures.stream().filter(f -> f.errorCode() == ErrorCode.UNSUPPORTED_LEAGUE).count();
    }

    public long getSupportedCount() {
        return getTotal() - getUnsupportedCount();
    }

    public long getRecommendedCount() {
        return predictions.stream().filter(PredictionRecord::isRecommended).count();
    }

    /**
     * @param index position of the match in the submitted batch
     */
    public record Failure(int index, String league, String match, ErrorCode errorCode, String message) {
    }
}
