package com.formatengine.printing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.formatengine.ir.Condition;
import com.formatengine.ir.ConditionResolver;
import com.formatengine.ir.Info;
import com.formatengine.ir.PrintItem;

/**
 * Identity-tagged view over IR for one pass.
 *
 * <p>Conditions and infos are given sequential integer ids the first time they are seen.
 * The ids live here rather than on the IR objects, so the same IR can be printed
 * by several passes at once. Condition branches are materialized on first request and
 * the same list is returned afterwards.</p>
 *
 * <p>Not thread safe; each pass owns its graph.</p>
 */
public final class PreparedGraph {
    private final Map<PrintItem, Integer> ids = new IdentityHashMap<>();
    private final List<PrintItem> arena = new ArrayList<>();
    private final Map<Condition, List<PrintItem>> truePaths = new IdentityHashMap<>();
    private final Map<Condition, List<PrintItem>> falsePaths = new IdentityHashMap<>();
    private final Map<Condition, ConditionResolver> resolvers = new IdentityHashMap<>();
    private List<PrintItem> rootItems = Collections.emptyList();

    PreparedGraph() {
    }

    void setRootItems(List<PrintItem> rootItems) {
        this.rootItems = rootItems;
    }

    public List<PrintItem> getRootItems() {
        return rootItems;
    }

    /**
     * Returns the id of a condition or info, assigning the next one if it has none.
     */
    public int tag(PrintItem item) {
        if (!(item instanceof Condition) && !(item instanceof Info)) {
            throw new IllegalArgumentException("Only conditions and infos have ids: " + item);
        }
        Integer id = ids.get(item);
        if (id != null) {
            return id;
        }
        int newId = arena.size();
        arena.add(item);
        ids.put(item, newId);
        return newId;
    }

    /**
     * The id of an item, or -1 when it has not been tagged.
     */
    public int findId(PrintItem item) {
        Integer id = ids.get(item);
        return id != null ? id : -1;
    }

    public PrintItem getItem(int id) {
        return arena.get(id);
    }

    /**
     * Number of ids assigned so far.
     */
    public int size() {
        return arena.size();
    }

    public List<PrintItem> getTruePath(Condition condition) {
        return truePaths.computeIfAbsent(condition,
                c -> GraphPreparer.materialize(c.getTruePath(), this));
    }

    public List<PrintItem> getFalsePath(Condition condition) {
        return falsePaths.computeIfAbsent(condition,
                c -> GraphPreparer.materialize(c.getFalsePath(), this));
    }

    /**
     * The resolver the engine invokes for a condition, wrapped so that every condition
     * or info it looks up is tagged.
     */
    public ConditionResolver getResolver(Condition condition) {
        return resolvers.computeIfAbsent(condition, c -> GraphPreparer.wrapResolver(c, this));
    }
}
