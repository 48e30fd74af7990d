package org.qbitspark.fileboxstorage.multipart_service.job;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.qbitspark.fileboxstorage.multipart_service.service.MultipartCoordinator;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MultipartReclaimJobTest {

    @Mock
    private MultipartCoordinator multipartCoordinator;

    @InjectMocks
    private MultipartReclaimJob job;

    @Test
    void sweepDelegatesToTheCoordinator() {
        when(multipartCoordinator.reclaimStaleSessions()).thenReturn(2);

        job.reclaimStaleUploads();

        verify(multipartCoordinator).reclaimStaleSessions();
    }
}
