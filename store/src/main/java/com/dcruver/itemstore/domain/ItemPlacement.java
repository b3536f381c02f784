package com.dcruver.itemstore.domain;

/**
 * Where an item lives: on its own, as a step of a list, or as a cell of a table.
 * Exactly one variant applies to every item.
 */
public sealed interface ItemPlacement
    permits ItemPlacement.Standalone, ItemPlacement.ListStep, ItemPlacement.TableCell {

    Standalone STANDALONE = new Standalone();

    static ItemPlacement standalone() {
        return STANDALONE;
    }

    static ItemPlacement listStep(long listId, int position) {
        return new ListStep(listId, position);
    }

    static ItemPlacement tableCell(long tableId, int row, int column) {
        return new TableCell(tableId, row, column);
    }

    record Standalone() implements ItemPlacement {
    }

    /**
     * A step of a list, positioned 1..N.
     */
    record ListStep(long listId, int position) implements ItemPlacement {
    }

    /**
     * A cell of a table addressed by zero-based row and column.
     */
    record TableCell(long tableId, int row, int column) implements ItemPlacement {
    }
}
