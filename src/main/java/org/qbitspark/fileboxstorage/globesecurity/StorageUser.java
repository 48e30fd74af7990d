package org.qbitspark.fileboxstorage.globesecurity;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Identity of the caller as resolved by the surrounding application. The storage ceiling travels
 * with the identity; the quota tracker adopts it on every reservation.
 */
@Value
@Builder
public class StorageUser {
    UUID id;
    long storageQuota;
}
