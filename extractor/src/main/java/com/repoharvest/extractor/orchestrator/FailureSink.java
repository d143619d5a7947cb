package com.repoharvest.extractor.orchestrator;

import java.io.IOException;

/**
 * Destination for the detailed failures of a finished run.
 */
public interface FailureSink {

    void write(RunReport report) throws IOException;
}
