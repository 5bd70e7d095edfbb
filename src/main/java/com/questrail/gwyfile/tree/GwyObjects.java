package com.questrail.gwyfile.tree;

import com.questrail.gwyfile.tree.memory.MemoryGwyObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Store-level helpers for creating objects and enumerating container contents.
 *
 * <p>Enumeration follows the rules of the GWY container layout: a channel
 * exists wherever {@code /N/data} holds a {@code GwyDataField} object, a graph
 * wherever {@code /0/graph/graph/N} holds a {@code GwyGraphModel} object. Ids
 * are reported in item order and are not required to be contiguous.</p>
 */
public final class GwyObjects
{
    public static final String CONTAINER = "GwyContainer";
    public static final String DATA_FIELD = "GwyDataField";
    public static final String GRAPH_MODEL = "GwyGraphModel";

    private static final Pattern CHANNEL_KEY = Pattern.compile("^/(\\d+)/data$");
    private static final Pattern GRAPH_KEY = Pattern.compile("^/0/graph/graph/(\\d+)$");

    private GwyObjects() {}

    /**
     * Creates a new, empty {@code GwyContainer}.
     */
    public static GwyObject newContainer() {
        return new MemoryGwyObject(CONTAINER);
    }

    /**
     * Creates a new, empty object of the given type name.
     */
    public static GwyObject newObject(String name) {
        return new MemoryGwyObject(name);
    }

    /**
     * Lists ids of all channels present in a container.
     *
     * @throws GwyTreeException if {@code container} is not a {@code GwyContainer}
     */
    public static List<Integer> enumerateChannelIds(GwyObject container) {
        return enumerate(container, CHANNEL_KEY, DATA_FIELD);
    }

    /**
     * Lists ids of all graphs present in a container.
     *
     * @throws GwyTreeException if {@code container} is not a {@code GwyContainer}
     */
    public static List<Integer> enumerateGraphIds(GwyObject container) {
        return enumerate(container, GRAPH_KEY, GRAPH_MODEL);
    }

    private static List<Integer> enumerate(GwyObject container, Pattern key, String objectName) {
        Objects.requireNonNull(container, "container");
        if (!CONTAINER.equals(container.name())) {
            throw new GwyTreeException("/",
                    "Expected " + CONTAINER + " but found " + container.name());
        }

        List<Integer> ids = new ArrayList<>();
        for (String item : container.itemNames()) {
            Matcher m = key.matcher(item);
            if (!m.matches()) {
                continue;
            }
            int id;
            try {
                id = Integer.parseInt(m.group(1));
            } catch (NumberFormatException e) {
                // Digits beyond int range cannot name a channel or graph.
                continue;
            }
            if (container.itemType(item).orElseThrow() != GwyItemType.OBJECT) {
                continue;
            }
            GwyObject value = container.getObject(item).orElseThrow();
            if (objectName.equals(value.name())) {
                ids.add(id);
            }
        }
        return ids;
    }
}
