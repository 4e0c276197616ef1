package com.ecoimpact.indicators.exception;

public class RunInProgressException extends IndicatorException {

    public RunInProgressException(String currentJob) {
        super("another run is in progress: " + currentJob);
    }
}
