package org.qbitspark.fileboxstorage.files_mng_service.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.qbitspark.fileboxstorage.files_mng_service.entity.FileEntity;
import org.qbitspark.fileboxstorage.files_mng_service.enums.FileLifecycle;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidOperationException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.ItemNotFoundException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.PermissionDeniedException;
import org.qbitspark.fileboxstorage.support.InMemoryRepositories;
import org.qbitspark.fileboxstorage.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileTreeServiceImplTest {

    private InMemoryRepositories store;
    private MutableClock clock;
    private FileTreeServiceImpl fileTree;
    private UUID userId;

    @BeforeEach
    void setUp() {
        store = new InMemoryRepositories();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        fileTree = new FileTreeServiceImpl(store.fileRepository(), InMemoryRepositories.transactionTemplate(), clock);
        userId = UUID.randomUUID();
    }

    @Test
    void nodesCarryTheirLogicalPath() {
        FileEntity docs = fileTree.createDirectory(userId, null, "docs");
        FileEntity reports = fileTree.createDirectory(userId, docs.getFileId(), "reports");
        FileEntity file = fileTree.createFile(userId, reports.getFileId(), "q3.pdf", null);

        assertEquals("/docs/reports/q3.pdf", file.getLogicalPath());
        assertEquals("application/pdf", file.getMimeType());
        assertEquals(0, file.getCurrentVersion());
    }

    @Test
    void siblingNamesMustBeUnique() {
        FileEntity docs = fileTree.createDirectory(userId, null, "docs");
        fileTree.createFile(userId, docs.getFileId(), "a.txt", null);

        assertThrows(InvalidOperationException.class, () -> fileTree.createFile(userId, docs.getFileId(), "a.txt", null));
        assertThrows(InvalidOperationException.class, () -> fileTree.createDirectory(userId, null, "docs"));
    }

    @Test
    void sameNameIsFineForAnotherOwner() {
        fileTree.createDirectory(userId, null, "docs");

        FileEntity other = fileTree.createDirectory(UUID.randomUUID(), null, "docs");

        assertEquals("/docs", other.getLogicalPath());
    }

    @Test
    void invalidNamesAreRejected() {
        for (String name : List.of("", " ", ".", "..", "a/b", "a\\b", "nul\0byte", "x".repeat(256))) {
            assertThrows(InvalidOperationException.class, () -> fileTree.createFile(userId, null, name, null), name);
        }
    }

    @Test
    void filesCannotHoldChildren() {
        FileEntity file = fileTree.createFile(userId, null, "a.txt", null);

        assertThrows(InvalidOperationException.class, () -> fileTree.createFile(userId, file.getFileId(), "b.txt", null));
    }

    @Test
    void moveIntoItselfOrADescendantIsRejected() {
        FileEntity a = fileTree.createDirectory(userId, null, "a");
        FileEntity b = fileTree.createDirectory(userId, a.getFileId(), "b");
        FileEntity c = fileTree.createDirectory(userId, b.getFileId(), "c");

        assertThrows(InvalidOperationException.class, () -> fileTree.move(userId, a.getFileId(), a.getFileId()));
        assertThrows(InvalidOperationException.class, () -> fileTree.move(userId, a.getFileId(), c.getFileId()));
        assertSame(null, a.getParent());
    }

    @Test
    void moveRewritesPathsOfTheWholeSubtree() {
        FileEntity a = fileTree.createDirectory(userId, null, "a");
        FileEntity b = fileTree.createDirectory(userId, a.getFileId(), "b");
        FileEntity file = fileTree.createFile(userId, b.getFileId(), "notes.md", null);
        FileEntity archive = fileTree.createDirectory(userId, null, "archive");

        fileTree.move(userId, b.getFileId(), archive.getFileId());

        assertEquals("/archive/b", b.getLogicalPath());
        assertEquals("/archive/b/notes.md", file.getLogicalPath());
        assertEquals(archive.getFileId(), b.getParentId());
    }

    @Test
    void moveOntoATakenNameIsRejected() {
        FileEntity a = fileTree.createDirectory(userId, null, "a");
        fileTree.createFile(userId, a.getFileId(), "same.txt", null);
        FileEntity loose = fileTree.createFile(userId, null, "same.txt", null);

        assertThrows(InvalidOperationException.class, () -> fileTree.move(userId, loose.getFileId(), a.getFileId()));
        assertNull(loose.getParent());
    }

    @Test
    void moveToTheRootDetachesTheNode() {
        FileEntity a = fileTree.createDirectory(userId, null, "a");
        FileEntity file = fileTree.createFile(userId, a.getFileId(), "x.txt", null);

        fileTree.move(userId, file.getFileId(), null);

        assertNull(file.getParent());
        assertEquals("/x.txt", file.getLogicalPath());
    }

    @Test
    void renameUpdatesDescendantPaths() {
        FileEntity a = fileTree.createDirectory(userId, null, "a");
        FileEntity file = fileTree.createFile(userId, a.getFileId(), "x.txt", null);

        fileTree.rename(userId, a.getFileId(), "renamed");

        assertEquals("/renamed", a.getLogicalPath());
        assertEquals("/renamed/x.txt", file.getLogicalPath());
    }

    @Test
    void renameToASiblingsNameIsRejected() {
        fileTree.createFile(userId, null, "a.txt", null);
        FileEntity b = fileTree.createFile(userId, null, "b.txt", null);

        assertThrows(InvalidOperationException.class, () -> fileTree.rename(userId, b.getFileId(), "a.txt"));
    }

    @Test
    void softDeleteTombstonesTheSubtreeAndFreesTheName() {
        FileEntity docs = fileTree.createDirectory(userId, null, "docs");
        FileEntity file = fileTree.createFile(userId, docs.getFileId(), "a.txt", null);

        fileTree.softDelete(userId, docs.getFileId());

        assertEquals(FileLifecycle.TOMBSTONED, docs.getLifecycle());
        assertEquals(FileLifecycle.TOMBSTONED, file.getLifecycle());
        assertEquals(docs.getDeletedAt(), file.getDeletedAt());
        assertTrue(fileTree.listChildren(userId, null, false).isEmpty());
        assertEquals(1, fileTree.listChildren(userId, null, true).size());
        assertThrows(ItemNotFoundException.class, () -> fileTree.getNode(userId, docs.getFileId(), false));
        fileTree.createDirectory(userId, null, "docs");
    }

    @Test
    void restoreRevivesOnlyWhatWasDeletedTogether() {
        FileEntity docs = fileTree.createDirectory(userId, null, "docs");
        FileEntity earlier = fileTree.createFile(userId, docs.getFileId(), "earlier.txt", null);
        FileEntity later = fileTree.createFile(userId, docs.getFileId(), "later.txt", null);
        fileTree.softDelete(userId, earlier.getFileId());
        clock.advance(Duration.ofMinutes(5));
        fileTree.softDelete(userId, docs.getFileId());

        fileTree.restore(userId, docs.getFileId());

        assertTrue(docs.isActive());
        assertTrue(later.isActive());
        assertFalse(earlier.isActive());
        assertNull(docs.getDeletedAt());
    }

    @Test
    void restoreIsBlockedWhenTheNameWasReused() {
        FileEntity original = fileTree.createFile(userId, null, "a.txt", null);
        fileTree.softDelete(userId, original.getFileId());
        fileTree.createFile(userId, null, "a.txt", null);

        assertThrows(InvalidOperationException.class, () -> fileTree.restore(userId, original.getFileId()));
        assertFalse(original.isActive());
    }

    @Test
    void restoreIsBlockedWhileTheParentIsDeleted() {
        FileEntity docs = fileTree.createDirectory(userId, null, "docs");
        FileEntity file = fileTree.createFile(userId, docs.getFileId(), "a.txt", null);
        fileTree.softDelete(userId, docs.getFileId());

        assertThrows(InvalidOperationException.class, () -> fileTree.restore(userId, file.getFileId()));
    }

    @Test
    void restoringAnActiveNodeIsRejected() {
        FileEntity file = fileTree.createFile(userId, null, "a.txt", null);

        assertThrows(InvalidOperationException.class, () -> fileTree.restore(userId, file.getFileId()));
    }

    @Test
    void otherOwnersCannotTouchTheNode() {
        FileEntity file = fileTree.createFile(userId, null, "a.txt", null);
        UUID intruder = UUID.randomUUID();

        assertThrows(PermissionDeniedException.class, () -> fileTree.rename(intruder, file.getFileId(), "b.txt"));
        assertThrows(PermissionDeniedException.class, () -> fileTree.softDelete(intruder, file.getFileId()));
    }
}
