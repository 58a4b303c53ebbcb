package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.ShellException;
import org.devios.shell.fs.AccessKind;
import org.devios.shell.fs.DirectoryNode;
import org.devios.shell.fs.Node;
import org.devios.shell.fs.ResolvedPath;
import org.devios.shell.session.Language;
import org.devios.shell.session.ShellSession;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 单次命令调用的上下文：会话、解析后的命令行，以及共享协作者。
 */
public final class CommandContext {

    private final ShellSession session;
    private final CommandLine line;
    private final ShellEnvironment environment;
    private final Function<String, CommandOutcome> reentry;

    CommandContext(ShellSession session, CommandLine line, ShellEnvironment environment,
                   Function<String, CommandOutcome> reentry) {
        this.session = session;
        this.line = line;
        this.environment = environment;
        this.reentry = reentry;
    }

    public ShellSession session() {
        return session;
    }

    public CommandLine line() {
        return line;
    }

    public ShellEnvironment environment() {
        return environment;
    }

    public Language language() {
        return session.language();
    }

    public String text(String code, Object... args) {
        return environment.messages().get(session.language(), code, args);
    }

    /**
     * 按当前目录解析路径；受限模式下途经被隐藏的目录（哪怕随后又用 {@code ..} 退出）都视为不存在。
     */
    public Optional<ResolvedPath> resolveVisible(String pathExpr) {
        return environment.resolver().resolve(pathExpr, session.cwd(),
                name -> environment.gate().isRootChildHidden(session, name));
    }

    public DirectoryNode currentDirectory() {
        Node node = environment.tree().lookup(session.cwd())
                .orElseThrow(() -> new IllegalStateException("当前目录已不在树中：" + session.cwd()));
        if (!(node instanceof DirectoryNode dir)) {
            throw new IllegalStateException("当前目录不是目录：" + session.cwd());
        }
        return dir;
    }

    public boolean can(Node node, AccessKind kind) {
        return environment.permissions().check(node, session.toActor(), kind);
    }

    public boolean owns(Node node) {
        return environment.permissions().isOwner(node, session.toActor());
    }

    public ShellException fail(ErrorKind kind, String code, Object... args) {
        return new ShellException(kind, text(code, args));
    }

    public ShellException fail(ErrorKind kind, List<String> hints, String code, Object... args) {
        return new ShellException(kind, text(code, args), hints);
    }

    /**
     * 重新进入分发器执行另一条命令（sudo 认证成功后执行挂起的命令）。
     */
    public CommandOutcome dispatch(String commandLine) {
        return reentry.apply(commandLine);
    }
}
