package com.taskdrive.recovery;

/**
 * Outcome of one recovery pass.
 */
public record RecoveryReport(
    int scanned,
    int reclaimed,
    int exhausted,
    int raceLost,
    int duplicatesResolved,
    int markersSwept,
    int tempFilesRemoved
) {
    public static RecoveryReport empty() {
        return new RecoveryReport(0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Check if the pass changed anything in the store.
     */
    public boolean hasChanges() {
        return reclaimed + exhausted + duplicatesResolved + markersSwept + tempFilesRemoved > 0;
    }
}
