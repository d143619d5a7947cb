package com.repoharvest.extractor.input;

import com.repoharvest.extractor.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkListReaderTest {

    private final WorkListReader reader = new WorkListReader();

    @Test
    @DisplayName("Reads owner and repository from owners_and_repo")
    void readsRows() throws IOException {
        String csv = """
                name,num_downloads,owners_and_repo
                Requests,"1,234",psf/requests
                Flask,99,pallets/flask
                """;

        List<WorkItem> items = reader.read(new StringReader(csv));

        assertEquals(2, items.size());
        WorkItem first = items.get(0);
        assertEquals(0, first.sequence());
        assertEquals("psf", first.owner());
        assertEquals("requests", first.name());
        assertEquals("Requests", first.displayName());
        assertEquals(1234L, first.downloads());
        assertEquals("pallets/flask", items.get(1).fullName());
        assertEquals(1, items.get(1).sequence());
    }

    @Test
    @DisplayName("Skips rows with an invalid owners_and_repo value")
    void skipsInvalidRows() throws IOException {
        String csv = """
                name,num_downloads,owners_and_repo
                NoSlash,1,justaname
                Empty,2,
                Trailing,3,owner/
                Good,4,owner/repo
                """;

        List<WorkItem> items = reader.read(new StringReader(csv));

        assertEquals(1, items.size());
        assertEquals("owner/repo", items.get(0).fullName());
        assertEquals(0, items.get(0).sequence());
    }

    @Test
    @DisplayName("Keeps everything after the first slash as the repository name")
    void splitsOnFirstSlash() throws IOException {
        String csv = """
                name,num_downloads,owners_and_repo
                Nested,1,owner/repo/extra
                """;

        WorkItem item = reader.read(new StringReader(csv)).get(0);

        assertEquals("owner", item.owner());
        assertEquals("repo/extra", item.name());
    }

    @Test
    @DisplayName("Non-numeric downloads are kept as null")
    void nonNumericDownloads() throws IOException {
        String csv = """
                name,num_downloads,owners_and_repo
                Thing,n/a,owner/thing
                """;

        assertNull(reader.read(new StringReader(csv)).get(0).downloads());
    }

    @Test
    @DisplayName("Throws when a required column is missing")
    void missingColumn_throws() {
        String csv = """
                name,owners_and_repo
                Thing,owner/thing
                """;

        IOException ex = assertThrows(IOException.class, () -> reader.read(new StringReader(csv)));
        assertTrue(ex.getMessage().contains("num_downloads"));
    }

    @Test
    @DisplayName("Reads a work list from disk")
    void readsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("repos.csv");
        Files.writeString(file, "name,num_downloads,owners_and_repo\nA,1,a/b\n");

        assertEquals(List.of(new WorkItem(0, "a", "b", "A", 1L)), reader.read(file));
    }
}
