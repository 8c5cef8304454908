package net.jodah.rechannel.internal.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Collections {
  public static <K, V> Map<K, V> synchronizedLinkedMap() {
    return java.util.Collections.<K, V>synchronizedMap(new LinkedHashMap<K, V>());
  }

  public static <T> Set<T> synchronizedLinkedSet() {
    return java.util.Collections.<T>synchronizedSet(new LinkedHashSet<T>());
  }

  /**
   * Returns an ordered copy of the values of the synchronized {@code map}, taken while holding the
   * map's lock.
   */
  public static <V> List<V> snapshotValues(Map<?, V> map) {
    synchronized (map) {
      return new ArrayList<V>(map.values());
    }
  }

  /**
   * Returns an ordered copy of the synchronized {@code map}, taken while holding the map's lock.
   */
  public static <K, V> Map<K, V> snapshot(Map<K, V> map) {
    synchronized (map) {
      return new LinkedHashMap<K, V>(map);
    }
  }

  /**
   * Returns an ordered copy of the synchronized {@code set}, taken while holding the set's lock.
   */
  public static <T> List<T> snapshot(Set<T> set) {
    synchronized (set) {
      return new ArrayList<T>(set);
    }
  }
}
