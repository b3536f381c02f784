package com.dcruver.itemstore.repo;

import com.dcruver.itemstore.domain.ConflictException;
import com.dcruver.itemstore.domain.ContentKind;
import com.dcruver.itemstore.domain.CorruptContentException;
import com.dcruver.itemstore.domain.DataTable;
import com.dcruver.itemstore.domain.Item;
import com.dcruver.itemstore.domain.ItemCollection;
import com.dcruver.itemstore.domain.ItemDraft;
import com.dcruver.itemstore.domain.ItemPlacement;
import com.dcruver.itemstore.domain.ItemUpdate;
import com.dcruver.itemstore.domain.NotFoundException;
import com.dcruver.itemstore.domain.StepList;
import com.dcruver.itemstore.domain.ValidationException;
import com.dcruver.itemstore.ordering.OrderingEngine;
import com.dcruver.itemstore.protect.ContentProtectionGateway;
import com.dcruver.itemstore.store.CollectionStore;
import com.dcruver.itemstore.store.ItemRowStore;
import com.dcruver.itemstore.store.ListStore;
import com.dcruver.itemstore.store.StoreTransactions;
import com.dcruver.itemstore.store.TableStore;
import com.dcruver.itemstore.tags.TagManager;
import com.dcruver.itemstore.validation.ItemContentValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate root of the store: creates, reads, updates and deletes items of every placement,
 * plus the collections, lists and tables that own them.
 *
 * Every mutating call is one transaction. Sensitive content is encrypted on the way in
 * and decrypted on the way out; items returned from here always carry plaintext.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ItemRepository {

    private static final int ROW_LABEL_MAX = 50;

    private final CollectionStore collections;
    private final ListStore lists;
    private final TableStore tables;
    private final ItemRowStore itemRows;
    private final ContentProtectionGateway protectionGateway;
    private final TagManager tagManager;
    private final OrderingEngine orderingEngine;
    private final ItemContentValidator contentValidator;
    private final StoreTransactions transactions;

    // ---------------------------------------------------------------- collections

    public long createCollection(String name, String description) {
        String trimmed = requireText(name, "Collection name");
        return transactions.inTransaction("Create collection", () -> {
            if (collections.findByName(trimmed).isPresent()) {
                throw new ConflictException("Collection already exists: " + trimmed);
            }
            long id = collections.insert(trimmed, description);
            log.info("Collection created: {} (ID: {})", trimmed, id);
            return id;
        });
    }

    public ItemCollection getCollection(long collectionId) {
        return collections.find(collectionId).orElseThrow(() -> NotFoundException.of("Collection", collectionId));
    }

    public List<ItemCollection> allCollections() {
        return collections.findAll();
    }

    /**
     * Delete a collection with every item, list and table in it.
     */
    public void deleteCollection(long collectionId) {
        transactions.run("Delete collection", () -> {
            getCollection(collectionId);
            tagManager.releaseItems(itemRows.idsInCollection(collectionId));
            int items = itemRows.deleteByCollection(collectionId);
            collections.delete(collectionId);
            log.info("Collection deleted: ID {} ({} items removed)", collectionId, items);
        });
    }

    // ---------------------------------------------------------------- lists

    public long createList(long collectionId, String name, String description) {
        String trimmed = requireText(name, "List name");
        return transactions.inTransaction("Create list", () -> {
            getCollection(collectionId);
            if (!lists.isNameAvailable(collectionId, trimmed, null)) {
                throw new ConflictException("A list named '" + trimmed + "' already exists in collection " + collectionId);
            }
            long id = lists.insert(collectionId, trimmed, description);
            log.info("List created: {} (ID: {}, collection {})", trimmed, id, collectionId);
            return id;
        });
    }

    public StepList getList(long listId) {
        return lists.find(listId).orElseThrow(() -> NotFoundException.of("List", listId));
    }

    public List<StepList> listsInCollection(long collectionId) {
        return lists.findByCollection(collectionId);
    }

    /**
     * Rename a list and/or change its description. Null arguments are left unchanged.
     */
    public void updateList(long listId, String name, String description) {
        transactions.run("Update list", () -> {
            StepList list = getList(listId);
            String newName = null;
            if (name != null) {
                newName = requireText(name, "List name");
                if (!lists.isNameAvailable(list.getCollectionId(), newName, listId)) {
                    throw new ConflictException("A list named '" + newName + "' already exists in collection "
                        + list.getCollectionId());
                }
            }
            lists.update(listId, newName, description);
            log.info("List updated: ID {}", listId);
        });
    }

    public void recordListUsage(long listId) {
        transactions.run("Record list usage", () -> {
            getList(listId);
            lists.recordUsage(listId);
        });
    }

    /**
     * Delete a list and all of its steps.
     */
    public void deleteList(long listId) {
        transactions.run("Delete list", () -> {
            getList(listId);
            tagManager.releaseItems(itemRows.idsInList(listId));
            int steps = itemRows.deleteByList(listId);
            lists.delete(listId);
            log.info("List deleted: ID {} ({} steps removed)", listId, steps);
        });
    }

    // ---------------------------------------------------------------- tables

    public long createTable(long collectionId, String name, String description) {
        String trimmed = requireText(name, "Table name");
        return transactions.inTransaction("Create table", () -> {
            getCollection(collectionId);
            if (!tables.isNameAvailable(trimmed, null)) {
                throw new ConflictException("A table named '" + trimmed + "' already exists");
            }
            long id = tables.insert(collectionId, trimmed, description);
            log.info("Table created: {} (ID: {})", trimmed, id);
            return id;
        });
    }

    public DataTable getTable(long tableId) {
        return tables.find(tableId).orElseThrow(() -> NotFoundException.of("Table", tableId));
    }

    public Optional<DataTable> findTableByName(String name) {
        return tables.findByName(name);
    }

    public List<DataTable> tablesInCollection(long collectionId) {
        return tables.findByCollection(collectionId);
    }

    public void updateTable(long tableId, String name, String description) {
        transactions.run("Update table", () -> {
            getTable(tableId);
            String newName = null;
            if (name != null) {
                newName = requireText(name, "Table name");
                if (!tables.isNameAvailable(newName, tableId)) {
                    throw new ConflictException("A table named '" + newName + "' already exists");
                }
            }
            tables.update(tableId, newName, description);
            log.info("Table updated: ID {}", tableId);
        });
    }

    /**
     * Delete a table and all of its cells.
     */
    public void deleteTable(long tableId) {
        transactions.run("Delete table", () -> {
            getTable(tableId);
            tagManager.releaseItems(itemRows.idsInTable(tableId));
            int cells = itemRows.deleteByTable(tableId);
            tables.delete(tableId);
            log.info("Table deleted: ID {} ({} cells removed)", tableId, cells);
        });
    }

    // ---------------------------------------------------------------- item creation

    public long createStandaloneItem(long collectionId, ItemDraft draft) {
        return transactions.inTransaction("Create item", () -> {
            getCollection(collectionId);
            long id = insertItem(collectionId, draft, ItemPlacement.standalone());
            log.info("Item added: {} (ID: {}, Sensitive: {}, Tags: {})",
                draft.getLabel(), id, draft.isSensitive(), draft.getTags().size());
            return id;
        });
    }

    public long createListStep(long listId, String label, String content, ContentKind kind, Integer position) {
        return createListStep(listId, ItemDraft.of(label, content, kind), position);
    }

    /**
     * Add a step to a list. A null position appends; otherwise the step is inserted
     * at 1..N+1 and later steps move down.
     */
    public long createListStep(long listId, ItemDraft draft, Integer position) {
        return transactions.inTransaction("Create list step", () -> {
            StepList list = getList(listId);
            validateDraft(draft);

            int target;
            if (position == null) {
                target = orderingEngine.nextPosition(listId);
            } else {
                orderingEngine.openSlot(listId, position);
                target = position;
            }

            long id = insertItem(list.getCollectionId(), draft, ItemPlacement.listStep(listId, target));
            lists.touch(listId);
            log.info("Step added: {} (ID: {}, list {}, position {})", draft.getLabel(), id, listId, target);
            return id;
        });
    }

    /**
     * Create a list together with its steps, numbered 1..N in the given order, all or nothing.
     *
     * @return id of the new list
     */
    public long createListWithSteps(long collectionId, String name, String description, List<ItemDraft> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new ValidationException("A list needs at least one step");
        }
        return transactions.inTransaction("Create list with steps", () -> {
            long listId = createList(collectionId, name, description);
            StepList list = getList(listId);
            int position = 1;
            for (ItemDraft step : steps) {
                insertItem(list.getCollectionId(), step, ItemPlacement.listStep(listId, position++));
            }
            log.info("List created: {} (ID: {}) with {} steps", list.getName(), listId, steps.size());
            return listId;
        });
    }

    public long createTableCell(long tableId, int row, int column, String label, String content) {
        return createTableCell(tableId, row, column, ItemDraft.of(label, content, ContentKind.TEXT));
    }

    /**
     * Add a cell to a table at a free coordinate.
     */
    public long createTableCell(long tableId, int row, int column, ItemDraft draft) {
        return transactions.inTransaction("Create table cell", () -> {
            DataTable table = getTable(tableId);
            if (row < 0 || column < 0) {
                throw new ValidationException(String.format("Invalid coordinate (%d, %d)", row, column));
            }
            if (itemRows.findCell(tableId, row, column).isPresent()) {
                throw new ConflictException(String.format(
                    "Table %d already has a cell at (%d, %d)", tableId, row, column));
            }

            long id = insertItem(table.getCollectionId(), draft, ItemPlacement.tableCell(tableId, row, column));
            tables.touch(tableId);
            log.debug("Cell added: table {} ({}, {}) ID {}", tableId, row, column, id);
            return id;
        });
    }

    // ---------------------------------------------------------------- reads

    /**
     * Load an item with plaintext content and its tags.
     * A sensitive payload that cannot be decrypted comes back as {@link Item#CORRUPT_CONTENT_MARKER}.
     */
    public Item readItem(long itemId) {
        Item stored = itemRows.find(itemId).orElseThrow(() -> NotFoundException.of("Item", itemId));
        Item item = present(stored);
        if (stored.getPlacement() instanceof ItemPlacement.TableCell cell) {
            item = item.withRowLabel(rowLabel(cell.tableId(), cell.row()));
        }
        return item;
    }

    public Optional<Item> findItem(long itemId) {
        return itemRows.exists(itemId) ? Optional.of(readItem(itemId)) : Optional.empty();
    }

    public List<Item> itemsInCollection(long collectionId) {
        return itemRows.findByCollection(collectionId).stream().map(this::present).toList();
    }

    /**
     * Steps of a list in position order.
     */
    public List<Item> stepsOf(long listId) {
        getList(listId);
        return itemRows.findByList(listId).stream().map(this::present).toList();
    }

    /**
     * Cells of a table ordered by row then column, with row labels filled in.
     */
    public List<Item> cellsOf(long tableId) {
        getTable(tableId);
        List<Item> cells = itemRows.findByTable(tableId).stream().map(this::present).toList();

        Map<Integer, String> keys = new HashMap<>();
        for (Item cell : cells) {
            ItemPlacement.TableCell placement = (ItemPlacement.TableCell) cell.getPlacement();
            if (placement.column() == 0) {
                keys.put(placement.row(), cell.getContent());
            }
        }
        return cells.stream()
            .map(cell -> {
                int row = ((ItemPlacement.TableCell) cell.getPlacement()).row();
                return cell.withRowLabel(rowLabelOf(keys.get(row), row));
            })
            .toList();
    }

    /**
     * Display key of a table row: the content of its column-0 cell, or {@code row_<n>}.
     * Computed from current data on every call, so a key edit is visible on the whole row at once.
     */
    public String rowLabel(long tableId, int row) {
        String key = itemRows.findCell(tableId, row, 0)
            .map(this::present)
            .map(Item::getContent)
            .orElse(null);
        return rowLabelOf(key, row);
    }

    public int countSteps(long listId) {
        return itemRows.countInList(listId);
    }

    public int countCells(long tableId) {
        return itemRows.countInTable(tableId);
    }

    // ---------------------------------------------------------------- updates

    /**
     * Apply a partial update. Content of an item that is or becomes sensitive is stored
     * encrypted, never twice; content of an item that stops being sensitive is decrypted,
     * failing with {@link CorruptContentException} when that is impossible.
     * Content, new or kept, is validated against the resulting kind. Already-protected
     * content is accepted only for an item that is sensitive after the update.
     */
    public void updateItem(long itemId, ItemUpdate update) {
        transactions.run("Update item", () -> {
            Item stored = itemRows.find(itemId).orElseThrow(() -> NotFoundException.of("Item", itemId));

            boolean wasSensitive = stored.isSensitive();
            boolean willBeSensitive = update.getSensitive() != null ? update.getSensitive() : wasSensitive;
            ContentKind kind = update.getKind() != null ? update.getKind() : stored.getKind();

            Map<String, Object> columns = ItemRowStore.columns();
            if (update.getLabel() != null) {
                columns.put("label", requireText(update.getLabel(), "Label"));
            }

            String incoming = update.getContent();
            if (incoming != null) {
                if (protectionGateway.isEncrypted(incoming)) {
                    if (!willBeSensitive) {
                        throw new ValidationException("Protected content can only be stored on a sensitive item");
                    }
                    contentValidator.validate(protectionGateway.decrypt(incoming), kind);
                } else {
                    contentValidator.validate(incoming, kind);
                }
                columns.put("content", protect(incoming, willBeSensitive));
            } else {
                // Existing content must still fit a changed kind
                if (update.getKind() != null) {
                    String current = wasSensitive
                        ? protectionGateway.decrypt(stored.getContent())
                        : stored.getContent();
                    contentValidator.validate(current, kind);
                }
                if (willBeSensitive && !wasSensitive) {
                    columns.put("content", protect(stored.getContent(), true));
                } else if (!willBeSensitive && wasSensitive) {
                    columns.put("content", protectionGateway.decrypt(stored.getContent()));
                }
            }

            if (update.getKind() != null) {
                columns.put("kind", update.getKind().name());
            }
            if (update.getSensitive() != null) {
                columns.put("is_sensitive", willBeSensitive ? 1 : 0);
            }
            if (update.getFavorite() != null) {
                columns.put("is_favorite", update.getFavorite() ? 1 : 0);
            }
            if (update.getColor() != null) {
                columns.put("color", update.getColor());
            }
            if (update.getDescription() != null) {
                columns.put("description", update.getDescription());
            }
            if (update.getFileSize() != null) {
                columns.put("file_size", update.getFileSize());
            }

            itemRows.update(itemId, columns);

            if (update.getTags() != null) {
                tagManager.replaceItemTags(itemId, update.getTags());
            }
            log.info("Item updated: ID {} ({})", itemId, columns.keySet());
        });
    }

    public void recordUsage(long itemId) {
        transactions.run("Record item usage", () -> {
            if (!itemRows.exists(itemId)) {
                throw NotFoundException.of("Item", itemId);
            }
            itemRows.recordUsage(itemId);
        });
    }

    // ---------------------------------------------------------------- deletes

    /**
     * Delete an item, decrementing its tags first. Deleting a list step closes the gap it leaves.
     */
    public void deleteItem(long itemId) {
        transactions.run("Delete item", () -> {
            Item stored = itemRows.find(itemId).orElseThrow(() -> NotFoundException.of("Item", itemId));
            if (stored.isListStep()) {
                orderingEngine.deleteStep(itemId);
            } else {
                tagManager.releaseItem(itemId);
                itemRows.delete(itemId);
            }
            log.info("Item deleted: ID {}", itemId);
        });
    }

    // ---------------------------------------------------------------- internals

    private long insertItem(long collectionId, ItemDraft draft, ItemPlacement placement) {
        validateDraft(draft);
        ContentKind kind = draft.getKind() != null ? draft.getKind() : contentValidator.detect(draft.getContent());
        contentValidator.validate(draft.getContent(), kind);

        Item row = Item.builder()
            .collectionId(collectionId)
            .label(draft.getLabel().strip())
            .content(protect(draft.getContent(), draft.isSensitive()))
            .kind(kind)
            .sensitive(draft.isSensitive())
            .favorite(draft.isFavorite())
            .color(draft.getColor())
            .description(draft.getDescription())
            .fileSize(draft.getFileSize())
            .placement(placement)
            .build();

        long id = itemRows.insert(row);
        for (String tag : TagManager.normalizeAll(draft.getTags())) {
            tagManager.associate(id, tag);
        }
        return id;
    }

    private void validateDraft(ItemDraft draft) {
        if (draft == null) {
            throw new ValidationException("Item fields are required");
        }
        requireText(draft.getLabel(), "Label");
        requireText(draft.getContent(), "Content");
        TagManager.normalizeAll(draft.getTags());
    }

    private String protect(String content, boolean sensitive) {
        if (!sensitive || protectionGateway.isEncrypted(content)) {
            return content;
        }
        return protectionGateway.encrypt(content);
    }

    /**
     * Turn a stored row into the caller's view: plaintext content and tags.
     */
    private Item present(Item stored) {
        Item item = stored.withTags(tagManager.tagsForItem(stored.getId()));
        if (!stored.isSensitive()) {
            return item;
        }
        try {
            return item.withContent(protectionGateway.decrypt(stored.getContent()));
        } catch (CorruptContentException e) {
            log.warn("Failed to decrypt item {}: {}", stored.getId(), e.getMessage());
            return item.withContent(Item.CORRUPT_CONTENT_MARKER).withContentCorrupt(true);
        }
    }

    /**
     * Row key made safe for grouping: spaces become underscores, anything but letters,
     * digits, '_' and '-' is dropped, at most 50 characters.
     */
    static String rowLabelOf(String key, int row) {
        if (key == null) {
            return "row_" + row;
        }
        StringBuilder label = new StringBuilder();
        for (char c : key.strip().replace(' ', '_').toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                label.append(c);
            }
        }
        if (label.length() == 0) {
            return "row_" + row;
        }
        return label.length() > ROW_LABEL_MAX ? label.substring(0, ROW_LABEL_MAX) : label.toString();
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " cannot be empty");
        }
        return value.strip();
    }
}
