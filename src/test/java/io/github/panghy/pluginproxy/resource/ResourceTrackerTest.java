package io.github.panghy.pluginproxy.resource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for ResourceTracker and ResourceRef.
 */
public class ResourceTrackerTest {

  private static final int BASE = 0x1000;

  private ResourceTracker tracker;
  private ResourceTracker.ReleaseNotifier notifier;

  static class TestResource extends PluginResource {
    int releasedCount;
    Runnable onRelease;

    TestResource(int instance, int hostResource) {
      super(new WireResourceId(instance, hostResource));
    }

    @Override
    protected void lastReferenceReleased(ResourceTracker tracker) {
      releasedCount++;
      if (onRelease != null) {
        onRelease.run();
      }
    }
  }

  @BeforeEach
  public void setUp() {
    tracker = new ResourceTracker(BASE);
    notifier = mock(ResourceTracker.ReleaseNotifier.class);
    when(notifier.notifyPeerRelease(any())).thenReturn(true);
    tracker.setReleaseNotifier(notifier);
  }

  @Test
  public void testLastReleaseNotifiesPeerOnce() {
    TestResource resource = new TestResource(1, 42);
    int handle = tracker.addResource(resource);
    assertTrue(handle > BASE);

    assertTrue(tracker.addRefResource(handle));
    assertEquals(2, tracker.getRefCount(handle));

    assertTrue(tracker.releaseResource(handle));
    verify(notifier, never()).notifyPeerRelease(any());
    assertSame(resource, tracker.getResourceObject(handle));

    assertTrue(tracker.releaseResource(handle));
    verify(notifier, times(1)).notifyPeerRelease(new WireResourceId(1, 42));
    assertEquals(1, resource.releasedCount);
    assertNull(tracker.getResourceObject(handle));
    assertEquals(0, tracker.lookupByIdentity(new WireResourceId(1, 42)));

    // the count never goes below zero
    assertFalse(tracker.releaseResource(handle));
    verify(notifier, times(1)).notifyPeerRelease(any());
    assertEquals(0, tracker.getRefCount(handle));
  }

  @Test
  public void testRemovalHappensBeforeNotificationAndCleanup() {
    TestResource resource = new TestResource(1, 5);
    int handle = tracker.addResource(resource);
    resource.onRelease = () -> assertEquals(0, tracker.size());

    tracker.releaseResource(handle);

    var order = inOrder(notifier);
    order.verify(notifier).notifyPeerRelease(new WireResourceId(1, 5));
    order.verify(notifier).resourceRemoved(new WireResourceId(1, 5));
    assertEquals(1, resource.releasedCount);
  }

  @Test
  public void testReleaseWithoutNotifyingPeer() {
    int handle = tracker.addResource(new TestResource(1, 5));
    tracker.releaseResource(handle, false);

    verify(notifier, never()).notifyPeerRelease(any());
    verify(notifier).resourceRemoved(new WireResourceId(1, 5));
  }

  @Test
  public void testDegenerateIdentityIsRefused() {
    assertEquals(0, tracker.addResource(new TestResource(1, 0)));
    assertEquals(0, tracker.addResource(new TestResource(0, 9)));
    assertEquals(0, tracker.addResource(null));
    assertEquals(0, tracker.size());
  }

  @Test
  public void testUnknownHandlesAreNoOps() {
    assertFalse(tracker.addRefResource(12345));
    assertFalse(tracker.releaseResource(12345));
    assertFalse(tracker.releaseResource(0));
    assertNull(tracker.getResourceObject(0));
    verify(notifier, never()).notifyPeerRelease(any());
  }

  @Test
  public void testHandlesAreUniqueAndNeverZero() {
    Set<Integer> handles = new HashSet<>();
    for (int i = 1; i <= 100; i++) {
      int handle = tracker.addResource(new TestResource(1, i));
      assertTrue(handle != 0);
      assertTrue(handles.add(handle));
    }
    assertEquals(100, tracker.size());
  }

  @Test
  public void testHandleAllocationSkipsLiveHandlesAfterWrap() {
    ResourceTracker small = new ResourceTracker(Integer.MAX_VALUE - 2);
    int first = small.addResource(new TestResource(1, 1));
    int second = small.addResource(new TestResource(1, 2));
    assertEquals(Integer.MAX_VALUE - 1, first);
    assertEquals(Integer.MAX_VALUE, second);

    small.releaseResource(first);
    int third = small.addResource(new TestResource(1, 3));
    assertEquals(Integer.MAX_VALUE - 1, third);
  }

  @Test
  public void testDuplicateIdentityReusesHandle() {
    int handle = tracker.addResource(new TestResource(3, 8));
    assertEquals(handle, tracker.addResource(new TestResource(3, 8)));
    assertEquals(2, tracker.getRefCount(handle));
    assertEquals(1, tracker.size());
  }

  @Test
  public void testAddOrReuseIsIdempotent() {
    WireResourceId id = new WireResourceId(2, 77);
    List<WireResourceId> created = new ArrayList<>();
    int first = tracker.addOrReuse(id, wireId -> {
      created.add(wireId);
      return new TestResource(wireId.instance(), wireId.hostResource());
    });
    int second = tracker.addOrReuse(id, wireId -> {
      created.add(wireId);
      return new TestResource(wireId.instance(), wireId.hostResource());
    });

    assertEquals(first, second);
    assertEquals(1, created.size());
    assertEquals(2, tracker.getRefCount(first));
    assertEquals(first, tracker.lookupByIdentity(id));
    assertEquals(0, tracker.addOrReuse(WireResourceId.NULL, wireId -> new TestResource(1, 1)));
  }

  @Test
  public void testCleanupMayReenterTracker() {
    TestResource parent = new TestResource(1, 1);
    TestResource child = new TestResource(1, 2);
    int parentHandle = tracker.addResource(parent);
    int childHandle = tracker.addResource(child);
    parent.onRelease = () -> tracker.releaseResource(childHandle);

    tracker.releaseResource(parentHandle);

    assertEquals(0, tracker.size());
    assertEquals(1, child.releasedCount);
    verify(notifier).notifyPeerRelease(new WireResourceId(1, 2));
  }

  @Test
  public void testInvalidateInstanceDropsOnlyThatInstance() {
    TestResource a = new TestResource(1, 1);
    TestResource b = new TestResource(1, 2);
    TestResource other = new TestResource(2, 1);
    int aHandle = tracker.addResource(a);
    tracker.addRefResource(aHandle);
    tracker.addResource(b);
    tracker.addResource(other);

    assertEquals(2, tracker.invalidateInstance(1));
    assertEquals(1, tracker.size());
    assertEquals(0, tracker.countForInstance(1));
    assertEquals(1, tracker.countForInstance(2));
    assertEquals(1, a.releasedCount);
    assertEquals(1, b.releasedCount);
    verify(notifier, never()).notifyPeerRelease(any());
    verify(notifier).resourceRemoved(new WireResourceId(1, 1));
    verify(notifier).resourceRemoved(new WireResourceId(1, 2));
  }

  @Test
  public void testGetAsChecksType() {
    int handle = tracker.addResource(new TestResource(1, 1));
    assertSame(tracker.getResourceObject(handle), tracker.getAs(handle, TestResource.class));
    assertNull(tracker.getAs(handle, OtherResource.class));
  }

  static class OtherResource extends PluginResource {
    OtherResource() {
      super(new WireResourceId(9, 9));
    }
  }

  @Test
  public void testResourceRefReleasesExactlyOnce() {
    int handle = tracker.addResource(new TestResource(1, 1));
    try (ResourceRef ref = tracker.acquire(handle)) {
      assertEquals(2, tracker.getRefCount(handle));
      assertTrue(ref.get(TestResource.class) != null);
    }
    assertEquals(1, tracker.getRefCount(handle));

    ResourceRef owned = tracker.adopt(handle);
    owned.close();
    owned.close();
    assertTrue(owned.isClosed());
    assertEquals(0, tracker.size());
    verify(notifier, times(1)).notifyPeerRelease(any());
    assertThrows(IllegalStateException.class, () -> owned.get(TestResource.class));

    assertNull(tracker.acquire(handle));
    assertNull(tracker.adopt(handle));
  }
}
