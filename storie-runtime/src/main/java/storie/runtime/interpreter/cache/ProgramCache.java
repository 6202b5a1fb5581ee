package storie.runtime.interpreter.cache;

import com.storielang.compiler.StorieCompiler;
import com.storielang.compiler.ast.decl.Program;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 已编译程序缓存，键为 (文件名, 源码)
 *
 * <p>Program 不可变，可在多个事件和运行时之间共享。编译失败不会被缓存。</p>
 */
public final class ProgramCache {

    private static final Logger LOG = Logger.getLogger(ProgramCache.class.getName());

    private final BoundedCache<Key, Program> cache;

    public ProgramCache(int maximumSize) {
        this.cache = new CaffeineCache<>(maximumSize);
    }

    /**
     * 返回缓存的程序，未命中时编译并缓存
     */
    public Program compile(String source, String fileName) {
        Program program = cache.computeIfAbsent(new Key(fileName, source),
                k -> StorieCompiler.compile(k.source, k.fileName));
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Program cache [" + fileName + "]: " + cache.getStats());
        }
        return program;
    }

    public long size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }

    public CacheStats getStats() {
        return cache.getStats();
    }

    private static final class Key {
        final String fileName;
        final String source;

        Key(String fileName, String source) {
            this.fileName = fileName;
            this.source = source;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return Objects.equals(fileName, other.fileName) && source.equals(other.source);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hashCode(fileName) + source.hashCode();
        }
    }
}
