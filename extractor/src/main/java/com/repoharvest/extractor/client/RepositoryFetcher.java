package com.repoharvest.extractor.client;

import com.repoharvest.extractor.model.WorkItem;

/**
 * Issues one query for one work item with one credential. Never throws for
 * API or transport failures; they come back as a classified {@link FetchOutcome}.
 */
@FunctionalInterface
public interface RepositoryFetcher {

    FetchOutcome fetch(WorkItem item, Credential credential);
}
