package org.qbitspark.fileboxstorage.multipart_service.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.fileboxstorage.multipart_service.service.MultipartCoordinator;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Aborts multipart uploads whose session outlived its TTL, returning their reserved quota.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MultipartReclaimJob {

    private final MultipartCoordinator multipartCoordinator;

    @Scheduled(fixedDelayString = "${app.storage.multipart.reclaim-interval:PT15M}",
            initialDelayString = "${app.storage.multipart.reclaim-interval:PT15M}")
    public void reclaimStaleUploads() {
        log.debug("Sweeping stale multipart uploads");
        multipartCoordinator.reclaimStaleSessions();
    }
}
