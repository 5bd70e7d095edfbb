package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyObjects;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class GwyObjectRetentionTest
{
    private final GwyObjectRetention retention = new GwyObjectRetention();

    @Test
    void retainsInRegistrationOrder()
    {
        GwyObject owner = GwyObjects.newContainer();
        GwyObject first = GwyObjects.newObject(GwyObjects.GRAPH_MODEL);
        GwyObject second = GwyObjects.newObject(GwyObjects.GRAPH_MODEL);

        retention.retain(owner, first);
        retention.retain(owner, second);

        assertEquals(List.of(first, second), retention.retained(owner));
        assertEquals(1, retention.ownerCount());
    }

    @Test
    void closingOwnerReleasesOnlyItsEntries()
    {
        GwyObject a = GwyObjects.newContainer();
        GwyObject b = GwyObjects.newContainer();
        retention.retain(a, GwyObjects.newObject(GwyObjects.GRAPH_MODEL));
        retention.retain(b, GwyObjects.newObject(GwyObjects.GRAPH_MODEL));

        a.close();

        assertTrue(retention.retained(a).isEmpty());
        assertEquals(1, retention.retained(b).size());
    }

    @Test
    void closedOwnerCannotRetain()
    {
        GwyObject owner = GwyObjects.newContainer();
        owner.close();

        assertThrows(IllegalStateException.class,
                () -> retention.retain(owner, GwyObjects.newObject(GwyObjects.GRAPH_MODEL)));
        assertEquals(0, retention.ownerCount());
    }

    @Test
    void ownersAreComparedByIdentity()
    {
        GwyObject a = GwyObjects.newContainer();
        GwyObject b = GwyObjects.newContainer();
        retention.retain(a, GwyObjects.newObject(GwyObjects.GRAPH_MODEL));

        assertTrue(retention.retained(b).isEmpty());
        retention.release(b);
        assertEquals(1, retention.ownerCount());
    }

    @Test
    void distinctOwnersMayRegisterConcurrently() throws Exception
    {
        int owners = 8;
        int perOwner = 200;
        ExecutorService executor = Executors.newFixedThreadPool(owners);
        CountDownLatch start = new CountDownLatch(1);
        List<GwyObject> trees = new ArrayList<>();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < owners; i++) {
                GwyObject tree = GwyObjects.newContainer();
                trees.add(tree);
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int k = 0; k < perOwner; k++) {
                        retention.retain(tree, GwyObjects.newObject(GwyObjects.GRAPH_MODEL));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (GwyObject tree : trees) {
            assertEquals(perOwner, retention.retained(tree).size());
            tree.close();
        }
        assertEquals(0, retention.ownerCount());
    }
}
