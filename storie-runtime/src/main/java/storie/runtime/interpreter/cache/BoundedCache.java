package storie.runtime.interpreter.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 */
public interface BoundedCache<K, V> {

    /**
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    void put(K key, V value);

    /**
     * 如果不存在则计算并缓存；计算函数抛出的异常原样传出，且不缓存
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    long size();

    void clear();

    CacheStats getStats();
}
