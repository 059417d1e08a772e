package io.abrserver.state;

import java.util.List;

public record CommitOutcome(boolean changed, List<String> resolvedAssets, List<String> failedDownloads) {
    public CommitOutcome {
        resolvedAssets = resolvedAssets == null ? List.of() : List.copyOf(resolvedAssets);
        failedDownloads = failedDownloads == null ? List.of() : List.copyOf(failedDownloads);
    }
}
