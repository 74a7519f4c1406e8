package com.kmg.ocrbatch.dto;

import java.util.List;

public record BatchView(
        List<ItemResultView> items,
        int succeededCount,
        int failedCount,
        List<String> failedUrls
) {
}
