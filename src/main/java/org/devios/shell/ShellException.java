package org.devios.shell;

import java.util.List;
import java.util.Objects;

/**
 * 命令执行失败。由处理器抛出，分发器捕获后转换为错误结果。
 * <p>
 * {@link #hints()} 是附加在错误之后的提示行（INFO），例如受限模式下的“输入 deviser start”提示。
 */
public class ShellException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> hints;

    public ShellException(ErrorKind kind, String message) {
        this(kind, message, List.of());
    }

    public ShellException(ErrorKind kind, String message, List<String> hints) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.hints = List.copyOf(hints);
    }

    public ErrorKind kind() {
        return kind;
    }

    public List<String> hints() {
        return hints;
    }
}
