package storie.runtime;

import com.storielang.compiler.ErrorKind;

/**
 * 一次事件触发的结果
 *
 * <p>成功时 {@link #isOk()} 为 true；失败时携带错误种类、消息和原始异常。
 * 未注册的事件视为成功（什么也不做）。</p>
 */
public final class EventOutcome {

    private static final EventOutcome OK = new EventOutcome(null, null, null, null);

    private final String event;
    private final ErrorKind kind;
    private final String message;
    private final RuntimeException cause;

    private EventOutcome(String event, ErrorKind kind, String message, RuntimeException cause) {
        this.event = event;
        this.kind = kind;
        this.message = message;
        this.cause = cause;
    }

    public static EventOutcome ok() {
        return OK;
    }

    public static EventOutcome failed(String event, ErrorKind kind, String message, RuntimeException cause) {
        return new EventOutcome(event, kind, message, cause);
    }

    public boolean isOk() {
        return kind == null;
    }

    public boolean isFailed() {
        return kind != null;
    }

    /** 失败的事件名，成功时为 null */
    public String getEvent() {
        return event;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public RuntimeException getCause() {
        return cause;
    }

    @Override
    public String toString() {
        if (isOk()) return "EventOutcome{ok}";
        return "EventOutcome{" + event + ", " + kind + ": " + message + "}";
    }
}
