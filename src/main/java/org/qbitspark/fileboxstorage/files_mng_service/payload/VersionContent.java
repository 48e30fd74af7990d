package org.qbitspark.fileboxstorage.files_mng_service.payload;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileVersionEntity;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * An open stream over one version's content, verified against the recorded etag when opened.
 */
@Getter
@RequiredArgsConstructor
public class VersionContent implements Closeable {

    private final FileVersionEntity version;
    private final InputStream stream;

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
