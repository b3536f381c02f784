package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Dense rectangular reconstruction of a table's cells.
 * Every row has exactly {@code columns.size()} values; missing cells are empty strings.
 */
@Data
@Builder
public class TableMatrix {
    private final String tableName;
    private final List<String> columns;
    private final List<List<String>> rows;
    private final int totalRows;
    private final int totalColumns;
    private final int totalItems;
}
