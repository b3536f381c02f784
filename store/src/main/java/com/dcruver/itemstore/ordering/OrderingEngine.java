package com.dcruver.itemstore.ordering;

import com.dcruver.itemstore.domain.Item;
import com.dcruver.itemstore.domain.ItemPlacement;
import com.dcruver.itemstore.domain.NotFoundException;
import com.dcruver.itemstore.domain.ValidationException;
import com.dcruver.itemstore.store.ItemRowStore;
import com.dcruver.itemstore.store.StoreTransactions;
import com.dcruver.itemstore.tags.TagManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.List;

/**
 * Keeps the positions of a list's steps equal to 1..N with no gaps or duplicates.
 *
 * Moves shift only the band of steps between the old and new position; steps
 * outside the band keep their positions.
 */
@Component
@Slf4j
public class OrderingEngine {

    private final JdbcTemplate jdbcTemplate;
    private final ItemRowStore itemRows;
    private final TagManager tagManager;
    private final StoreTransactions transactions;

    public OrderingEngine(DataSource dataSource, ItemRowStore itemRows, TagManager tagManager,
                          StoreTransactions transactions) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.itemRows = itemRows;
        this.tagManager = tagManager;
        this.transactions = transactions;
    }

    /**
     * Position a step appended to the list would take.
     */
    public int nextPosition(long listId) {
        requireList(listId);
        return itemRows.countInList(listId) + 1;
    }

    /**
     * Make room at {@code position} by pushing that step and every later one down by one.
     * Valid positions are 1..N+1; N+1 needs no shifting.
     */
    public void openSlot(long listId, int position) {
        transactions.run("Open list slot", () -> {
            int next = nextPosition(listId);
            if (position < 1 || position > next) {
                throw new ValidationException(
                    String.format("Position %d out of range 1..%d for list %d", position, next, listId));
            }
            int shifted = jdbcTemplate.update(
                "UPDATE items SET position = position + 1 WHERE list_id = ? AND position >= ?",
                listId, position);
            log.debug("Opened slot {} in list {} ({} steps shifted)", position, listId, shifted);
        });
    }

    /**
     * Move a step to a new position within its list.
     * Steps between the two positions shift by one toward the vacated slot.
     */
    public void moveStep(long itemId, int newPosition) {
        transactions.run("Move list step", () -> {
            ItemPlacement.ListStep step = requireStep(itemId);
            int oldPosition = step.position();
            long listId = step.listId();

            if (newPosition == oldPosition) {
                log.debug("Step {} already at position {}", itemId, newPosition);
                return;
            }

            int size = itemRows.countInList(listId);
            if (newPosition < 1 || newPosition > size) {
                throw new ValidationException(
                    String.format("Position %d out of range 1..%d for list %d", newPosition, size, listId));
            }

            if (newPosition < oldPosition) {
                jdbcTemplate.update("""
                    UPDATE items SET position = position + 1
                    WHERE list_id = ? AND position >= ? AND position < ?
                    """, listId, newPosition, oldPosition);
            } else {
                jdbcTemplate.update("""
                    UPDATE items SET position = position - 1
                    WHERE list_id = ? AND position > ? AND position <= ?
                    """, listId, oldPosition, newPosition);
            }
            jdbcTemplate.update("UPDATE items SET position = ? WHERE id = ?", newPosition, itemId);

            log.info("Step {} moved from position {} to {} in list {}", itemId, oldPosition, newPosition, listId);
        });
    }

    /**
     * Delete a step and close the gap it leaves.
     */
    public void deleteStep(long itemId) {
        transactions.run("Delete list step", () -> {
            ItemPlacement.ListStep step = requireStep(itemId);

            tagManager.releaseItem(itemId);
            itemRows.delete(itemId);
            int shifted = jdbcTemplate.update(
                "UPDATE items SET position = position - 1 WHERE list_id = ? AND position > ?",
                step.listId(), step.position());

            log.info("Step {} deleted from list {} ({} later steps shifted)", itemId, step.listId(), shifted);
        });
    }

    /**
     * Reassign positions 1..N keeping the current order; ties go to the step created first.
     * Repairs a list whose positions have gaps or duplicates.
     *
     * @return number of steps whose position changed
     */
    public int renumberList(long listId) {
        return transactions.inTransaction("Renumber list", () -> {
            requireList(listId);
            List<Item> steps = itemRows.findByList(listId);
            int changed = 0;
            for (int i = 0; i < steps.size(); i++) {
                Item step = steps.get(i);
                int expected = i + 1;
                if (((ItemPlacement.ListStep) step.getPlacement()).position() != expected) {
                    jdbcTemplate.update("UPDATE items SET position = ? WHERE id = ?", expected, step.getId());
                    changed++;
                }
            }
            if (changed > 0) {
                log.warn("Renumbered list {}: {} of {} steps repositioned", listId, changed, steps.size());
            }
            return changed;
        });
    }

    /**
     * Positions of the list's steps in step order.
     */
    public List<Integer> positions(long listId) {
        requireList(listId);
        return jdbcTemplate.queryForList(
            "SELECT position FROM items WHERE list_id = ? ORDER BY position, created_at, id",
            Integer.class, listId);
    }

    private void requireList(long listId) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM lists WHERE id = ?", Integer.class, listId);
        if (count == null || count == 0) {
            throw NotFoundException.of("List", listId);
        }
    }

    private ItemPlacement.ListStep requireStep(long itemId) {
        Item item = itemRows.find(itemId).orElseThrow(() -> NotFoundException.of("Item", itemId));
        if (!(item.getPlacement() instanceof ItemPlacement.ListStep step)) {
            throw new ValidationException("Item " + itemId + " is not a list step");
        }
        return step;
    }
}
