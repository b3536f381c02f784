package com.dcruver.itemstore.table;

import com.dcruver.itemstore.StoreFixture;
import com.dcruver.itemstore.domain.ConflictException;
import com.dcruver.itemstore.domain.ContentKind;
import com.dcruver.itemstore.domain.Item;
import com.dcruver.itemstore.domain.NotFoundException;
import com.dcruver.itemstore.domain.TableImport;
import com.dcruver.itemstore.domain.TableMatrix;
import com.dcruver.itemstore.domain.ValidationException;
import com.dcruver.itemstore.repo.ItemRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for coordinate-addressed cells and the dense matrix export.
 */
class CoordinateEngineTest {

    @TempDir
    Path tempDir;

    private StoreFixture store;
    private ItemRepository repository;
    private CoordinateEngine engine;
    private long collectionId;
    private long tableId;

    @BeforeEach
    void setUp() throws Exception {
        store = new StoreFixture(tempDir);
        repository = store.repository;
        engine = store.coordinateEngine;
        collectionId = repository.createCollection("Servers", null);
        tableId = repository.createTable(collectionId, "Hosts", "Lab machines");
    }

    @Test
    void testExportFillsMissingCells() {
        engine.setCell(tableId, 0, 0, "Row1");
        engine.setCell(tableId, 0, 1, "X");
        engine.setCell(tableId, 1, 0, "Row2");

        TableMatrix matrix = engine.exportToMatrix(tableId);

        assertEquals("Hosts", matrix.getTableName());
        assertEquals(List.of("Row1", "X"), matrix.getColumns());
        assertEquals(List.of(List.of("Row1", "X"), List.of("Row2", "")), matrix.getRows());
        assertEquals(2, matrix.getTotalRows());
        assertEquals(2, matrix.getTotalColumns());
        assertEquals(3, matrix.getTotalItems());
    }

    @Test
    void testExportUsesPlaceholderForMissingHeader() {
        engine.setCell(tableId, 0, 0, "name");
        engine.setCell(tableId, 2, 2, "far corner");

        TableMatrix matrix = engine.exportToMatrix(tableId);

        assertEquals(List.of("name", "COL_1", "COL_2"), matrix.getColumns());
        assertEquals(3, matrix.getRows().size());
        matrix.getRows().forEach(row -> assertEquals(3, row.size()));
        assertEquals("far corner", matrix.getRows().get(2).get(2));
        assertEquals("COL_2", engine.getCell(tableId, 2, 2).orElseThrow().getLabel());
    }

    @Test
    void testExportIsStable() throws Exception {
        engine.setCell(tableId, 1, 3, "d");
        engine.setCell(tableId, 0, 0, "a");
        engine.setCell(tableId, 2, 1, "c");

        ObjectMapper mapper = new ObjectMapper();
        String first = mapper.writeValueAsString(engine.exportToMatrix(tableId));
        String second = mapper.writeValueAsString(engine.exportToMatrix(tableId));

        assertEquals(first, second);
    }

    @Test
    void testExportOfEmptyTable() {
        TableMatrix matrix = engine.exportToMatrix(tableId);

        assertTrue(matrix.getColumns().isEmpty());
        assertTrue(matrix.getRows().isEmpty());
        assertEquals(0, matrix.getTotalItems());
    }

    @Test
    void testSetCellUpdatesInPlace() {
        long id = engine.setCell(tableId, 1, 1, "old");
        long again = engine.setCell(tableId, 1, 1, "new");

        assertEquals(id, again);
        assertEquals("new", engine.getCell(tableId, 1, 1).orElseThrow().getContent());
        assertEquals(1, repository.countCells(tableId));
    }

    @Test
    void testNewCellTakesColumnHeaderLabel() {
        engine.setCell(tableId, 0, 1, "ip");
        engine.setCell(tableId, 3, 1, "10.0.0.3");

        assertEquals("ip", engine.getCell(tableId, 3, 1).orElseThrow().getLabel());
    }

    @Test
    void testKeyColumnWriteRelabelsWholeRow() {
        engine.setCell(tableId, 1, 0, "web-1");
        engine.setCell(tableId, 1, 1, "10.0.0.1");
        engine.setCell(tableId, 1, 2, "ubuntu");

        assertEquals("web-1", engine.getCell(tableId, 1, 2).orElseThrow().getRowLabel());

        engine.setCell(tableId, 1, 0, "web-01");

        for (Item cell : repository.cellsOf(tableId)) {
            assertEquals("web-01", cell.getRowLabel());
        }
        assertEquals("web-01", repository.readItem(engine.getCell(tableId, 1, 1).orElseThrow().getId()).getRowLabel());
    }

    @Test
    void testRowLabelIsSanitizedKey() {
        engine.setCell(tableId, 2, 0, "mail server (eu)");
        engine.setCell(tableId, 2, 1, "10.0.0.2");

        assertEquals("mail_server_eu", engine.getCell(tableId, 2, 1).orElseThrow().getRowLabel());
    }

    @Test
    void testRowWithoutKeyCellFallsBack() {
        engine.setCell(tableId, 4, 1, "orphan");

        assertEquals("row_4", engine.getCell(tableId, 4, 1).orElseThrow().getRowLabel());
    }

    @Test
    void testCoordinateUniqueness() {
        repository.createTableCell(tableId, 0, 0, "name", "alpha");

        assertThrows(ConflictException.class, () -> repository.createTableCell(tableId, 0, 0, "name", "beta"));
        assertThrows(ValidationException.class, () -> repository.createTableCell(tableId, -1, 0, "name", "beta"));
        assertThrows(ValidationException.class, () -> engine.setCell(tableId, 0, -2, "x"));
        assertEquals(1, repository.countCells(tableId));
        assertEquals("alpha", engine.getCell(tableId, 0, 0).orElseThrow().getContent());
    }

    @Test
    void testClearCellAndDimensions() {
        engine.setCell(tableId, 0, 0, "a");
        engine.setCell(tableId, 2, 3, "b");

        assertEquals(new CoordinateEngine.Dimensions(3, 4, 2), engine.dimensions(tableId));

        assertTrue(engine.clearCell(tableId, 2, 3));
        assertFalse(engine.clearCell(tableId, 2, 3));
        assertTrue(engine.getCell(tableId, 2, 3).isEmpty());
        assertEquals(new CoordinateEngine.Dimensions(1, 1, 1), engine.dimensions(tableId));
    }

    @Test
    void testDeleteTableRemovesCellsAndReleasesTags() {
        engine.importMatrix(TableImport.builder()
            .collectionId(collectionId)
            .name("Credentials")
            .columns(List.of("service", "password"))
            .row(List.of("db", "s3cret"))
            .tag("infra")
            .build());
        long imported = repository.findTableByName("Credentials").orElseThrow().getId();
        assertEquals(2, store.usageCount("infra"));

        engine.deleteTable(imported);

        assertTrue(repository.findTableByName("Credentials").isEmpty());
        assertEquals(0, store.usageCount("infra"));
        assertEquals(0, (int) store.jdbc.queryForObject(
            "SELECT COUNT(*) FROM items WHERE table_id = ?", Integer.class, imported));
        assertThrows(NotFoundException.class, () -> engine.exportToMatrix(imported));
    }

    @Test
    void testImportMatrix() {
        long imported = engine.importMatrix(TableImport.builder()
            .collectionId(collectionId)
            .name("Accounts")
            .columns(List.of("service", "url", "password"))
            .row(List.of("github", "https://github.com", "pw-1"))
            .row(List.of("gitlab", "", "pw-2"))
            .sensitiveColumn(2)
            .urlColumn(1)
            .build());

        TableMatrix matrix = engine.exportToMatrix(imported);
        assertEquals(List.of("service", "url", "password"), matrix.getColumns());
        assertEquals(List.of("gitlab", "", "pw-2"), matrix.getRows().get(1));
        assertEquals(5, matrix.getTotalItems());

        Item url = engine.getCell(imported, 0, 1).orElseThrow();
        assertEquals(ContentKind.URL, url.getKind());
        Item password = engine.getCell(imported, 1, 2).orElseThrow();
        assertTrue(password.isSensitive());
        assertEquals("pw-2", password.getContent());
        assertEquals("gitlab", password.getRowLabel());
        assertTrue(store.gateway.isEncrypted(store.storedContent(password.getId())));
    }

    @Test
    void testImportIsAllOrNothing() {
        TableImport bad = TableImport.builder()
            .collectionId(collectionId)
            .name("Links")
            .columns(List.of("name", "link"))
            .row(List.of("ok", "https://example.com"))
            .row(List.of("broken", "not a url"))
            .urlColumn(1)
            .build();

        assertThrows(ValidationException.class, () -> engine.importMatrix(bad));
        assertTrue(repository.findTableByName("Links").isEmpty());
        assertEquals(0, (int) store.jdbc.queryForObject(
            "SELECT COUNT(*) FROM items WHERE label IN ('name', 'link')", Integer.class));
    }

    @Test
    void testImportRejectsDuplicateName() {
        TableImport duplicate = TableImport.builder()
            .collectionId(collectionId)
            .name("Hosts")
            .column("name")
            .row(List.of("x"))
            .build();

        assertThrows(ConflictException.class, () -> engine.importMatrix(duplicate));
    }

    @Test
    void testMissingTable() {
        assertThrows(NotFoundException.class, () -> engine.getCell(777, 0, 0));
        assertThrows(NotFoundException.class, () -> engine.setCell(777, 0, 0, "x"));
    }
}
