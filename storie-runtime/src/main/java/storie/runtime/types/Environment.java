package storie.runtime.types;

import storie.runtime.StorieException;
import storie.runtime.StorieNull;
import storie.runtime.StorieValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 运行时环境（作用域）
 *
 * <p>名称到值的映射，加上可为空的父环境，构成查找链：</p>
 * <ul>
 *   <li>{@link #get} / {@link #assign} 由内向外查找第一个绑定</li>
 *   <li>{@link #assign} 在整条链上都找不到时，在<b>当前</b>帧（调用它的环境）创建绑定，而不是根环境</li>
 *   <li>{@link #define} 只作用于当前帧，无条件覆盖，不查找祖先</li>
 * </ul>
 */
public final class Environment {

    private final Environment parent;
    private final Map<String, StorieValue> values = new LinkedHashMap<>();

    /**
     * 创建全局环境
     */
    public Environment() {
        this.parent = null;
    }

    /**
     * 创建子环境
     */
    public Environment(Environment parent) {
        this.parent = parent;
    }

    public boolean isGlobal() {
        return parent == null;
    }

    /**
     * 在当前帧定义（或覆盖）变量
     */
    public void define(String name, StorieValue value) {
        values.put(name, value != null ? value : StorieNull.NIL);
    }

    /**
     * 获取变量值
     *
     * @throws StorieException 整条链上都未绑定
     */
    public StorieValue get(String name) {
        StorieValue value = tryGet(name);
        if (value == null) {
            throw new StorieException("Undefined variable: " + name);
        }
        return value;
    }

    /**
     * 尝试获取变量值（不抛异常），未绑定返回 null
     */
    public StorieValue tryGet(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            StorieValue value = env.values.get(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * 赋值：修改链上最近的绑定；不存在时在当前帧创建
     */
    public void assign(String name, StorieValue value) {
        if (value == null) value = StorieNull.NIL;
        for (Environment env = this; env != null; env = env.parent) {
            if (env.values.containsKey(name)) {
                env.values.put(name, value);
                return;
            }
        }
        values.put(name, value);
    }

    /**
     * 检查变量是否在链上存在
     */
    public boolean contains(String name) {
        return tryGet(name) != null;
    }

    /**
     * 检查变量是否在当前帧定义
     */
    public boolean containsLocal(String name) {
        return values.containsKey(name);
    }

    /**
     * 获取当前帧的所有变量名（按定义顺序）
     */
    public Set<String> getLocalNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * 到根环境的距离，全局环境为 0
     */
    public int depth() {
        int depth = 0;
        for (Environment env = parent; env != null; env = env.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Environment{\n");
        for (Map.Entry<String, StorieValue> e : values.entrySet()) {
            sb.append("  ").append(e.getKey()).append(" = ")
              .append(e.getValue()).append("\n");
        }
        sb.append("}");
        if (parent != null) {
            sb.append(" -> parent");
        }
        return sb.toString();
    }
}
