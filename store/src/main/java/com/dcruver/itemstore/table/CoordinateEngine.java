package com.dcruver.itemstore.table;

import com.dcruver.itemstore.domain.ContentKind;
import com.dcruver.itemstore.domain.DataTable;
import com.dcruver.itemstore.domain.Item;
import com.dcruver.itemstore.domain.ItemDraft;
import com.dcruver.itemstore.domain.ItemPlacement;
import com.dcruver.itemstore.domain.ItemUpdate;
import com.dcruver.itemstore.domain.TableImport;
import com.dcruver.itemstore.domain.TableMatrix;
import com.dcruver.itemstore.domain.ValidationException;
import com.dcruver.itemstore.repo.ItemRepository;
import com.dcruver.itemstore.store.ItemRowStore;
import com.dcruver.itemstore.store.StoreTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sparse (row, column) cell storage of a table and its dense matrix view.
 *
 * Cells are ordinary items placed in a table; this engine addresses them by coordinate
 * and goes through {@link ItemRepository} for every write so encryption and tags apply.
 */
@Component
@Slf4j
public class CoordinateEngine {

    private final JdbcTemplate jdbcTemplate;
    private final ItemRepository repository;
    private final ItemRowStore itemRows;
    private final StoreTransactions transactions;

    public CoordinateEngine(DataSource dataSource, ItemRepository repository, ItemRowStore itemRows,
                            StoreTransactions transactions) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.repository = repository;
        this.itemRows = itemRows;
        this.transactions = transactions;
    }

    /**
     * Extent of a table: one past the highest row and column index, plus the number of stored cells.
     */
    public record Dimensions(int rows, int columns, int cells) {
    }

    public Optional<Item> getCell(long tableId, int row, int column) {
        repository.getTable(tableId);
        return itemRows.findCell(tableId, row, column).map(cell -> repository.readItem(cell.getId()));
    }

    /**
     * Write a cell's content, creating the cell if the coordinate is free.
     *
     * A new cell is labelled after its column: the label of the row-0 cell above it,
     * its own content when it is itself in row 0, or {@code COL_<column>} otherwise.
     *
     * @return id of the written cell
     */
    public long setCell(long tableId, int row, int column, String content) {
        return transactions.inTransaction("Set cell", () -> {
            repository.getTable(tableId);
            requireCoordinate(row, column);

            Optional<Item> existing = itemRows.findCell(tableId, row, column);
            if (existing.isPresent()) {
                long id = existing.get().getId();
                repository.updateItem(id, ItemUpdate.content(content));
                log.debug("Cell ({}, {}) of table {} updated", row, column, tableId);
                return id;
            }

            String label = columnLabel(tableId, row, column, content);
            return repository.createTableCell(tableId, row, column, ItemDraft.of(label, content, ContentKind.TEXT));
        });
    }

    /**
     * Remove the cell at a coordinate.
     *
     * @return false if there was no cell
     */
    public boolean clearCell(long tableId, int row, int column) {
        return transactions.inTransaction("Clear cell", () -> {
            repository.getTable(tableId);
            Optional<Item> existing = itemRows.findCell(tableId, row, column);
            if (existing.isEmpty()) {
                return false;
            }
            repository.deleteItem(existing.get().getId());
            log.debug("Cell ({}, {}) of table {} cleared", row, column, tableId);
            return true;
        });
    }

    public Dimensions dimensions(long tableId) {
        repository.getTable(tableId);
        return jdbcTemplate.queryForObject("""
                SELECT COALESCE(MAX(cell_row) + 1, 0) AS row_count,
                       COALESCE(MAX(cell_col) + 1, 0) AS column_count,
                       COUNT(*) AS cell_count
                FROM items WHERE table_id = ?
                """,
            (rs, rowNum) -> new Dimensions(rs.getInt("row_count"), rs.getInt("column_count"), rs.getInt("cell_count")),
            tableId);
    }

    /**
     * Rebuild the table as a dense grid spanning 0..maxRow by 0..maxColumn.
     * Column names come from the row-0 labels, {@code COL_<c>} where row 0 has no cell;
     * missing cells are empty strings. Row 0 is part of the rows.
     */
    public TableMatrix exportToMatrix(long tableId) {
        DataTable table = repository.getTable(tableId);
        List<Item> cells = repository.cellsOf(tableId);

        if (cells.isEmpty()) {
            log.warn("Table '{}' has no cells to export", table.getName());
            return TableMatrix.builder()
                .tableName(table.getName())
                .columns(List.of())
                .rows(List.of())
                .build();
        }

        Map<Long, Item> byCoordinate = new HashMap<>();
        int maxRow = 0;
        int maxColumn = 0;
        for (Item cell : cells) {
            ItemPlacement.TableCell placement = (ItemPlacement.TableCell) cell.getPlacement();
            byCoordinate.put(key(placement.row(), placement.column()), cell);
            maxRow = Math.max(maxRow, placement.row());
            maxColumn = Math.max(maxColumn, placement.column());
        }

        List<String> columns = new ArrayList<>();
        for (int c = 0; c <= maxColumn; c++) {
            Item header = byCoordinate.get(key(0, c));
            columns.add(header != null ? header.getLabel() : placeholder(c));
        }

        List<List<String>> rows = new ArrayList<>();
        for (int r = 0; r <= maxRow; r++) {
            List<String> values = new ArrayList<>();
            for (int c = 0; c <= maxColumn; c++) {
                Item cell = byCoordinate.get(key(r, c));
                values.add(cell != null ? cell.getContent() : "");
            }
            rows.add(List.copyOf(values));
        }

        log.info("Table '{}' exported: {} rows x {} columns", table.getName(), rows.size(), columns.size());
        return TableMatrix.builder()
            .tableName(table.getName())
            .columns(List.copyOf(columns))
            .rows(List.copyOf(rows))
            .totalRows(maxRow + 1)
            .totalColumns(maxColumn + 1)
            .totalItems(cells.size())
            .build();
    }

    public void deleteTable(long tableId) {
        repository.deleteTable(tableId);
    }

    /**
     * Create a table with every non-blank value of the grid as a cell, all or nothing.
     * Cells are labelled with their column name.
     *
     * @return id of the new table
     */
    public long importMatrix(TableImport tableImport) {
        return transactions.inTransaction("Import table", () -> {
            long tableId = repository.createTable(
                tableImport.getCollectionId(), tableImport.getName(), tableImport.getDescription());

            int created = 0;
            List<List<String>> rows = tableImport.getRows();
            for (int r = 0; r < rows.size(); r++) {
                List<String> values = rows.get(r);
                for (int c = 0; c < values.size(); c++) {
                    String value = values.get(c);
                    if (value == null || value.isBlank()) {
                        continue;
                    }
                    ItemDraft draft = ItemDraft.builder()
                        .label(importedColumnName(tableImport.getColumns(), c))
                        .content(value)
                        .kind(tableImport.getUrlColumns().contains(c) ? ContentKind.URL : ContentKind.TEXT)
                        .sensitive(tableImport.getSensitiveColumns().contains(c))
                        .tags(tableImport.getTags())
                        .build();
                    repository.createTableCell(tableId, r, c, draft);
                    created++;
                }
            }

            log.info("Table '{}' imported: {} cells from {} rows (ID: {})",
                tableImport.getName(), created, rows.size(), tableId);
            return tableId;
        });
    }

    private String columnLabel(long tableId, int row, int column, String content) {
        if (row == 0) {
            if (content == null || content.isBlank()) {
                throw new ValidationException("Content cannot be empty");
            }
            return content.strip();
        }
        return itemRows.findCell(tableId, 0, column)
            .map(Item::getLabel)
            .orElse(placeholder(column));
    }

    private static String importedColumnName(List<String> columns, int column) {
        if (column < columns.size() && columns.get(column) != null && !columns.get(column).isBlank()) {
            return columns.get(column).strip();
        }
        return placeholder(column);
    }

    private static void requireCoordinate(int row, int column) {
        if (row < 0 || column < 0) {
            throw new ValidationException(String.format("Invalid coordinate (%d, %d)", row, column));
        }
    }

    private static String placeholder(int column) {
        return "COL_" + column;
    }

    private static long key(int row, int column) {
        return ((long) row << 32) | (column & 0xffffffffL);
    }
}
