package com.ripple.resilience.model;

import lombok.Value;

@Value
public class ConsistencyTally {
    int passed;
    int failed;
    int total;

    public ConsistencyTally add(boolean checkPassed) {
        return new ConsistencyTally(
            passed + (checkPassed ? 1 : 0),
            failed + (checkPassed ? 0 : 1),
            total + 1);
    }
}
