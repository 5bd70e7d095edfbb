package com.questrail.gwyfile.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class GwyObjectsTest
{
    @Test
    void enumeratesChannelsHoldingDataFields()
    {
        GwyObject container = GwyObjects.newContainer();
        container.add(GwyItem.newObject("/0/data", GwyObjects.newObject(GwyObjects.DATA_FIELD)));
        container.add(GwyItem.newString("/0/data/title", "Height"));
        container.add(GwyItem.newObject("/5/data", GwyObjects.newObject(GwyObjects.DATA_FIELD)));
        container.add(GwyItem.newObject("/2/mask", GwyObjects.newObject(GwyObjects.DATA_FIELD)));
        container.add(GwyItem.newObject("/3/data", GwyObjects.newObject("GwySIUnit")));
        container.add(GwyItem.newDouble("/4/data", 1.0));

        assertEquals(List.of(0, 5), GwyObjects.enumerateChannelIds(container));
    }

    @Test
    void enumeratesGraphsHoldingGraphModels()
    {
        GwyObject container = GwyObjects.newContainer();
        container.add(GwyItem.newObject("/0/graph/graph/1", GwyObjects.newObject(GwyObjects.GRAPH_MODEL)));
        container.add(GwyItem.newBool("/0/graph/graph/1/visible", true));
        container.add(GwyItem.newObject("/0/graph/graph/3", GwyObjects.newObject(GwyObjects.GRAPH_MODEL)));
        container.add(GwyItem.newObject("/1/graph/graph/2", GwyObjects.newObject(GwyObjects.GRAPH_MODEL)));

        assertEquals(List.of(1, 3), GwyObjects.enumerateGraphIds(container));
    }

    @Test
    void emptyContainerHasNoEntities()
    {
        GwyObject container = GwyObjects.newContainer();

        assertTrue(GwyObjects.enumerateChannelIds(container).isEmpty());
        assertTrue(GwyObjects.enumerateGraphIds(container).isEmpty());
    }

    @Test
    void enumerationRequiresContainer()
    {
        GwyObject field = GwyObjects.newObject(GwyObjects.DATA_FIELD);

        assertThrows(GwyTreeException.class, () -> GwyObjects.enumerateChannelIds(field));
    }
}
