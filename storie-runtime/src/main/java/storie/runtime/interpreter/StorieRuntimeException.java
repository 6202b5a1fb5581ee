package storie.runtime.interpreter;

import com.storielang.compiler.ErrorKind;
import com.storielang.compiler.ast.SourceLocation;
import storie.runtime.StorieException;

/**
 * 脚本执行期间的错误
 *
 * <p>带位置时，{@link #getMessage()} 在原始消息后追加出错行和指示符：</p>
 * <pre>
 * Undefined variable: y
 *   --> render:2:5
 *   |
 * 2 | x = y + 1
 *   |     ^
 * </pre>
 */
public class StorieRuntimeException extends StorieException {

    private final SourceLocation location;
    private final String sourceLine;

    public StorieRuntimeException(String message) {
        this(message, null, null, null);
    }

    public StorieRuntimeException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public StorieRuntimeException(String message, SourceLocation location, String sourceLine) {
        this(message, location, sourceLine, null);
    }

    public StorieRuntimeException(String message, SourceLocation location, String sourceLine, Throwable cause) {
        super(message, cause);
        this.location = location;
        this.sourceLine = sourceLine;
    }

    public ErrorKind getKind() {
        return ErrorKind.RUNTIME;
    }

    /** 出错的源码位置，宿主直接抛出时为 null */
    public SourceLocation getLocation() {
        return location;
    }

    public boolean hasLocation() {
        return location != null && location.isKnown();
    }

    public String getSourceLine() {
        return sourceLine;
    }

    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (!hasLocation()) {
            return getRawMessage();
        }
        StringBuilder sb = new StringBuilder(getRawMessage()).append('\n');
        sb.append("  --> ").append(location);
        if (sourceLine != null && !sourceLine.isEmpty()) {
            appendSnippet(sb);
        }
        return sb.toString();
    }

    private void appendSnippet(StringBuilder sb) {
        String gutter = String.valueOf(location.getLine());
        String blank = pad(gutter.length(), ' ');
        sb.append('\n').append(blank).append(" |");
        sb.append('\n').append(gutter).append(" | ").append(sourceLine);
        sb.append('\n').append(blank).append(" | ")
          .append(pad(Math.max(0, location.getColumn() - 1), ' '))
          .append(pad(Math.max(1, location.getLength()), '^'));
    }

    private static String pad(int n, char c) {
        char[] chars = new char[n];
        java.util.Arrays.fill(chars, c);
        return new String(chars);
    }
}
