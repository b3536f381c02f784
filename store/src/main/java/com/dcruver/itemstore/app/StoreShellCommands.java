package com.dcruver.itemstore.app;

import com.dcruver.itemstore.domain.ContentKind;
import com.dcruver.itemstore.domain.Item;
import com.dcruver.itemstore.domain.ItemCollection;
import com.dcruver.itemstore.domain.ItemPlacement;
import com.dcruver.itemstore.domain.ItemUpdate;
import com.dcruver.itemstore.domain.StepList;
import com.dcruver.itemstore.domain.Tag;
import com.dcruver.itemstore.domain.TableMatrix;
import com.dcruver.itemstore.domain.TagStatistics;
import com.dcruver.itemstore.ordering.OrderingEngine;
import com.dcruver.itemstore.repo.ItemRepository;
import com.dcruver.itemstore.table.CoordinateEngine;
import com.dcruver.itemstore.tags.TagManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.List;

/**
 * Spring Shell commands for inspecting and maintaining the item store.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class StoreShellCommands {

    private final ItemRepository repository;
    private final TagManager tagManager;
    private final OrderingEngine orderingEngine;
    private final CoordinateEngine coordinateEngine;
    private final ObjectMapper objectMapper;

    @ShellMethod(key = "status", value = "Show collections with their lists and tables")
    public String status() {
        try {
            List<ItemCollection> collections = repository.allCollections();
            if (collections.isEmpty()) {
                return "Store is empty.";
            }

            StringBuilder sb = new StringBuilder();
            sb.append("Item Store Status\n");
            sb.append("=================\n\n");
            for (ItemCollection collection : collections) {
                int items = repository.itemsInCollection(collection.getId()).size();
                sb.append(String.format("%s (ID: %d) - %d items\n", collection.getName(), collection.getId(), items));
                for (StepList list : repository.listsInCollection(collection.getId())) {
                    sb.append(String.format("  list  %s (ID: %d): %d steps\n",
                        list.getName(), list.getId(), repository.countSteps(list.getId())));
                }
                repository.tablesInCollection(collection.getId()).forEach(table ->
                    sb.append(String.format("  table %s (ID: %d): %d cells\n",
                        table.getName(), table.getId(), repository.countCells(table.getId()))));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Status failed", e);
            return "Failed to get status: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tags list", value = "List tags with their usage counts")
    public String listTags(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Only tags containing this text") String query) {
        try {
            List<Tag> tags = query == null ? tagManager.listTags() : tagManager.searchTags(query);
            if (tags.isEmpty()) {
                return "No tags found.";
            }
            StringBuilder sb = new StringBuilder();
            for (Tag tag : tags) {
                sb.append(String.format("%-30s %5d\n", tag.getName(), tag.getUsageCount()));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Listing tags failed", e);
            return "Failed to list tags: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tags stats", value = "Show tag statistics")
    public String tagStatistics(@ShellOption(defaultValue = "10", help = "Number of top tags") int top) {
        try {
            TagStatistics stats = tagManager.statistics(top);
            StringBuilder sb = new StringBuilder();
            sb.append("Tag Statistics:\n");
            sb.append(String.format("- Total tags: %d\n", stats.getTotalTags()));
            sb.append(String.format("- In use: %d\n", stats.getTagsInUse()));
            sb.append(String.format("- Unused: %d\n", stats.getUnusedTags()));
            sb.append(String.format("- Average tags per item: %.2f\n", stats.getAverageTagsPerItem()));
            if (!stats.getTopTags().isEmpty()) {
                sb.append("\nTop tags:\n");
                stats.getTopTags().forEach(tag ->
                    sb.append(String.format("  %s (%d)\n", tag.getName(), tag.getUsageCount())));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Tag statistics failed", e);
            return "Failed to compute tag statistics: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tags prune", value = "Delete tags no item uses")
    public String pruneTags() {
        try {
            int deleted = tagManager.pruneUnusedTags();
            return String.format("Pruned %d unused tags.", deleted);
        } catch (Exception e) {
            log.error("Tag prune failed", e);
            return "Failed to prune tags: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tags recount", value = "Recompute tag usage counters from their associations")
    public String recountTags() {
        try {
            int repaired = tagManager.recountAll();
            return repaired == 0
                ? "All tag counters are consistent."
                : String.format("Repaired %d tag counters.", repaired);
        } catch (Exception e) {
            log.error("Tag recount failed", e);
            return "Failed to recount tags: " + e.getMessage();
        }
    }

    @ShellMethod(key = "list show", value = "Show the steps of a list in order")
    public String showList(@ShellOption(help = "List ID") long listId) {
        try {
            StepList list = repository.getList(listId);
            List<Item> steps = repository.stepsOf(listId);

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%s (%d steps)\n", list.getName(), steps.size()));
            for (Item step : steps) {
                int position = ((ItemPlacement.ListStep) step.getPlacement()).position();
                sb.append(String.format("%3d. %s: %s\n", position, step.getLabel(), displayContent(step)));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Showing list {} failed", listId, e);
            return "Failed to show list: " + e.getMessage();
        }
    }

    @ShellMethod(key = "list renumber", value = "Repair the step positions of a list")
    public String renumberList(@ShellOption(help = "List ID") long listId) {
        try {
            repository.getList(listId);
            int changed = orderingEngine.renumberList(listId);
            return changed == 0
                ? "Positions already contiguous."
                : String.format("Renumbered %d steps.", changed);
        } catch (Exception e) {
            log.error("Renumbering list {} failed", listId, e);
            return "Failed to renumber list: " + e.getMessage();
        }
    }

    @ShellMethod(key = "table export", value = "Export a table as a JSON matrix")
    public String exportTable(@ShellOption(help = "Table name") String name) {
        try {
            long tableId = repository.findTableByName(name)
                .orElseThrow(() -> new IllegalArgumentException("No table named '" + name + "'"))
                .getId();
            TableMatrix matrix = coordinateEngine.exportToMatrix(tableId);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(matrix);
        } catch (Exception e) {
            log.error("Exporting table '{}' failed", name, e);
            return "Failed to export table: " + e.getMessage();
        }
    }

    @ShellMethod(key = "item show", value = "Show one item")
    public String showItem(@ShellOption(help = "Item ID") long itemId) {
        try {
            Item item = repository.readItem(itemId);
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%s (ID: %d)\n", item.getLabel(), item.getId()));
            sb.append(String.format("- Kind: %s\n", item.getKind()));
            sb.append(String.format("- Placement: %s\n", describe(item.getPlacement())));
            if (item.getRowLabel() != null) {
                sb.append(String.format("- Row: %s\n", item.getRowLabel()));
            }
            sb.append(String.format("- Sensitive: %s\n", item.isSensitive()));
            sb.append(String.format("- Tags: %s\n", item.getTags().isEmpty() ? "-" : String.join(", ", item.getTags())));
            sb.append(String.format("- Used: %d times\n", item.getUseCount()));
            sb.append(String.format("- Content: %s\n", displayContent(item)));
            return sb.toString();
        } catch (Exception e) {
            log.error("Showing item {} failed", itemId, e);
            return "Failed to show item: " + e.getMessage();
        }
    }

    @ShellMethod(key = "item retype", value = "Change the content kind of an item")
    public String retypeItem(
        @ShellOption(help = "Item ID") long itemId,
        @ShellOption(help = "TEXT, URL, CODE or PATH") String kind) {
        try {
            ContentKind parsed = ContentKind.parse(kind);
            repository.updateItem(itemId, ItemUpdate.builder().kind(parsed).build());
            return String.format("Item %d is now %s.", itemId, parsed);
        } catch (Exception e) {
            log.error("Retyping item {} failed", itemId, e);
            return "Failed to retype item: " + e.getMessage();
        }
    }

    private static String displayContent(Item item) {
        if (item.isSensitive() && !item.isContentCorrupt()) {
            return "********";
        }
        return item.getContent();
    }

    private static String describe(ItemPlacement placement) {
        if (placement instanceof ItemPlacement.ListStep step) {
            return String.format("step %d of list %d", step.position(), step.listId());
        }
        if (placement instanceof ItemPlacement.TableCell cell) {
            return String.format("cell (%d, %d) of table %d", cell.row(), cell.column(), cell.tableId());
        }
        return "standalone";
    }
}
