package com.questrail.gwyfile.tree.memory;

import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyItemType;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyTreeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MemoryGwyObjectTest
{
    @Test
    void absentItemsReadAsEmpty()
    {
        MemoryGwyObject object = new MemoryGwyObject("GwyContainer");

        assertTrue(object.getBool("/0/data/visible").isEmpty());
        assertTrue(object.getObject("/0/data").isEmpty());
        assertTrue(object.itemType("/0/data").isEmpty());
    }

    @Test
    void addKeepsExistingItem()
    {
        MemoryGwyObject object = new MemoryGwyObject("GwyContainer");

        assertTrue(object.add(GwyItem.newString("/0/data/title", "Height")));
        assertFalse(object.add(GwyItem.newString("/0/data/title", "Phase")));

        assertEquals("Height", object.getString("/0/data/title").orElseThrow());
    }

    @Test
    void wrongKindIsAnError()
    {
        MemoryGwyObject object = new MemoryGwyObject("GwyContainer");
        object.add(GwyItem.newInt32("/0/base/range-type", 2));

        GwyTreeException e = assertThrows(GwyTreeException.class,
                () -> object.getDouble("/0/base/range-type"));
        assertEquals("/0/base/range-type", e.path());
        assertEquals(GwyItemType.INT32, object.itemType("/0/base/range-type").orElseThrow());
    }

    @Test
    void itemNamesFollowInsertionOrder()
    {
        MemoryGwyObject object = new MemoryGwyObject("GwyContainer");
        object.add(GwyItem.newBool("b", true));
        object.add(GwyItem.newBool("a", false));
        object.add(GwyItem.newBool("c", true));

        assertEquals(List.of("b", "a", "c"), object.itemNames());
    }

    @Test
    void doubleArraysAreCopied()
    {
        MemoryGwyObject object = new MemoryGwyObject("GwyDataField");
        double[] samples = { 1.0, 2.0 };
        object.add(GwyItem.newDoubleArray("data", samples));
        samples[0] = 99.0;

        double[] read = object.getDoubleArray("data").orElseThrow();
        assertArrayEquals(new double[] { 1.0, 2.0 }, read);
        read[1] = 42.0;
        assertArrayEquals(new double[] { 1.0, 2.0 }, object.getDoubleArray("data").orElseThrow());
    }

    @Test
    void objectCannotContainItself()
    {
        MemoryGwyObject object = new MemoryGwyObject("GwyContainer");

        assertThrows(GwyTreeException.class, () -> object.add(GwyItem.newObject("/self", object)));
    }

    @Test
    void closeRunsHooksOnceAndBlocksAccess()
    {
        MemoryGwyObject object = new MemoryGwyObject("GwyContainer");
        List<String> calls = new ArrayList<>();
        object.onClose(() -> calls.add("first"));
        object.onClose(() -> calls.add("second"));

        object.close();
        object.close();

        assertEquals(List.of("first", "second"), calls);
        assertTrue(object.isClosed());
        assertThrows(GwyTreeException.class, () -> object.getBool("x"));
        assertThrows(GwyTreeException.class, () -> object.add(GwyItem.newBool("x", true)));
    }

    @Test
    void hookAfterCloseRunsImmediately()
    {
        GwyObject object = new MemoryGwyObject("GwyContainer");
        object.close();

        List<String> calls = new ArrayList<>();
        object.onClose(() -> calls.add("late"));

        assertEquals(List.of("late"), calls);
    }
}
