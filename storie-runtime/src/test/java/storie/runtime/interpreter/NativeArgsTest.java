package storie.runtime.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import storie.runtime.StorieBoolean;
import storie.runtime.StorieFloat;
import storie.runtime.StorieInt;
import storie.runtime.StorieNull;
import storie.runtime.StorieString;
import storie.runtime.StorieValue;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("原生函数参数读取")
class NativeArgsTest {

    private NativeArgs args(StorieValue... values) {
        return NativeArgs.of("fn", Arrays.asList(values));
    }

    @Test
    @DisplayName("int 接受浮点数并截断")
    void intCoercion() {
        NativeArgs a = args(StorieInt.of(7), StorieFloat.of(3.9), StorieFloat.of(-1.5));
        assertThat(a.expectInt(0)).isEqualTo(7);
        assertThat(a.expectInt(1)).isEqualTo(3);
        assertThat(a.expectInt(2)).isEqualTo(-1);
    }

    @Test
    @DisplayName("float 接受整数")
    void floatCoercion() {
        NativeArgs a = args(StorieInt.of(2), StorieFloat.of(0.5));
        assertThat(a.expectFloat(0)).isEqualTo(2.0);
        assertThat(a.expectFloat(1)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("bool 按真值接受任意值")
    void boolCoercion() {
        NativeArgs a = args(StorieBoolean.TRUE, StorieInt.of(0), StorieString.of("x"), StorieNull.NIL);
        assertThat(a.expectBool(0)).isTrue();
        assertThat(a.expectBool(1)).isFalse();
        assertThat(a.expectBool(2)).isTrue();
        assertThat(a.expectBool(3)).isFalse();
    }

    @Test
    @DisplayName("类型不符")
    void typeMismatch() {
        NativeArgs a = args(StorieString.of("10"), StorieInt.of(1));
        assertThatThrownBy(() -> a.expectInt(0))
                .isInstanceOf(StorieRuntimeException.class)
                .hasMessage("fn: Expected int, got String");
        assertThatThrownBy(() -> a.expectString(1))
                .hasMessage("fn: Expected string, got Int");
        assertThatThrownBy(() -> args(StorieNull.NIL).expectFloat(0))
                .hasMessage("fn: Expected float, got Nil");
    }

    @Test
    @DisplayName("缺少参数")
    void missingArgument() {
        NativeArgs a = NativeArgs.of("fn", Collections.emptyList());
        assertThatThrownBy(() -> a.expectString(0))
                .isInstanceOf(StorieRuntimeException.class)
                .hasMessage("fn: Missing string argument at index 0");
        assertThat(a.get(3)).isSameAs(StorieNull.NIL);
    }

    @Test
    @DisplayName("可选参数")
    void optionalArguments() {
        NativeArgs a = args(StorieInt.of(5), StorieNull.NIL);
        assertThat(a.optionalInt(0, 1)).isEqualTo(5);
        assertThat(a.optionalInt(1, 1)).isEqualTo(1);
        assertThat(a.optionalString(2, "black")).isEqualTo("black");
        assertThat(a.optionalFloat(3, 1.5)).isEqualTo(1.5);
        assertThat(a.optional(1, StorieString.of("d"))).isEqualTo(StorieString.of("d"));
        assertThat(a.optional(0, StorieString.of("d"))).isEqualTo(StorieInt.of(5));
    }

    @Test
    @DisplayName("没有函数名时不加前缀")
    void noPrefix() {
        assertThatThrownBy(() -> NativeArgs.of(null, Collections.emptyList()).expectInt(0))
                .hasMessage("Missing int argument at index 0");
    }
}
