package storie.runtime.interpreter;

import com.storielang.compiler.ast.decl.Program;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 事件名 -> 已编译程序
 *
 * <p>同名注册会覆盖旧程序。保持注册顺序。</p>
 */
public final class EventRegistry {

    private final Map<String, Program> events = new LinkedHashMap<>();

    /**
     * 注册（或覆盖）事件
     *
     * @return 被覆盖的旧程序，没有则为 null
     */
    public Program register(String name, Program program) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Event name must not be empty");
        }
        if (program == null) {
            throw new IllegalArgumentException("Event program must not be null");
        }
        return events.put(name, program);
    }

    public Program get(String name) {
        return events.get(name);
    }

    public boolean contains(String name) {
        return events.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(events.keySet());
    }
}
