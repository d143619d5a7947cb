package com.repoharvest.extractor.model;

/**
 * One repository targeted for extraction, as read from the input work list.
 *
 * <p>{@code sequence} is the item's position in the input and keeps two
 * identical rows distinct in the run report.</p>
 */
public record WorkItem(
        int sequence,
        String owner,
        String name,
        String displayName,
        Long downloads
) {

    public static WorkItem of(int sequence, String owner, String name) {
        return new WorkItem(sequence, owner, name, name, null);
    }

    public String fullName() {
        return owner + "/" + name;
    }
}
