package com.gravitychain.performance;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class ProposerPerformance {

    private long successfulProposals;
    private long failedProposals;

    public ProposerPerformance copy() {
        return new ProposerPerformance(successfulProposals, failedProposals);
    }

    public long getTotalProposals() {
        return successfulProposals + failedProposals;
    }

    void recordSuccess() {
        successfulProposals++;
    }

    void recordFailure() {
        failedProposals++;
    }
}
