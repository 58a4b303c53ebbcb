package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.ShellException;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.session.ShellSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 命令分发器：把一行输入变成一次 {@link CommandOutcome}。
 * <p>
 * 检查顺序：
 * <ol>
 *   <li>等待 sudo 密码时，整行交给 {@link AuthCommands#answer}；</li>
 *   <li>管道 / 重定向语法直接拒绝；</li>
 *   <li>递归强制删除转去诱饵流程（受限模式下同样生效）；</li>
 *   <li>受限模式的命令门禁，隐藏的命令与不存在的命令报同样的错误；</li>
 *   <li>按 {@link CommandName} 找到唯一的处理器。</li>
 * </ol>
 * 处理器抛出的 {@link ShellException} 在这里统一转换为一条 ERROR 结果（外加可选的提示行），
 * 不会传播到调用方。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final ShellEnvironment environment;
    private final Choreography choreography;
    private final AuthCommands auth;
    private final Map<CommandName, CommandHandler> handlers;

    public CommandDispatcher(ShellEnvironment environment, Choreography choreography, AuthCommands auth,
                             List<CommandModule> modules) {
        this.environment = environment;
        this.choreography = choreography;
        this.auth = auth;
        this.handlers = Collections.unmodifiableMap(register(modules));
    }

    /**
     * 按默认命令集组装。
     */
    public static CommandDispatcher standard(ShellEnvironment environment, Choreography choreography) {
        ManualPages manualPages = new ManualPages();
        AuthCommands auth = new AuthCommands(
                environment.properties().getSudoSecret(), environment.properties().getMaxAuthAttempts());
        List<CommandModule> modules = List.of(
                new NavigationCommands(manualPages),
                new FileCommands(choreography),
                new SystemCommands(manualPages, choreography),
                new PortfolioCommands(),
                new ServiceCommands(choreography, environment.properties().getServiceUser()),
                auth);
        return new CommandDispatcher(environment, choreography, auth, modules);
    }

    public CommandOutcome dispatch(ShellSession session, String rawLine) {
        CommandLine line = CommandLine.parse(rawLine);
        CommandContext ctx = new CommandContext(session, line, environment, next -> dispatch(session, next));
        boolean secret = session.isAwaitingSecret();
        try {
            if (secret) {
                return auth.answer(ctx, rawLine == null ? "" : rawLine);
            }
            return route(ctx);
        } catch (ShellException e) {
            log.debug("命令 {} 失败：{}", secret ? "<sudo 密码>" : line.normalizedName(), e.kind());
            List<ResultRecord> records = new ArrayList<>();
            records.add(ResultRecord.error(e.kind(), e.getMessage()));
            e.hints().forEach(hint -> records.add(ResultRecord.info(hint)));
            return CommandOutcome.of(records);
        } catch (RuntimeException e) {
            log.error("命令 {} 执行异常", secret ? "<sudo 密码>" : line.normalizedName(), e);
            return CommandOutcome.of(ResultRecord.error(ErrorKind.INTERNAL, ctx.text("error.internal")));
        }
    }

    private CommandOutcome route(CommandContext ctx) {
        CommandLine line = ctx.line();
        String raw = line.raw();
        if (raw.contains("|")) {
            throw ctx.fail(ErrorKind.UNSUPPORTED, "error.unsupported.pipe");
        }
        if (raw.contains(">")) {
            throw ctx.fail(ErrorKind.UNSUPPORTED, "error.unsupported.redirect");
        }
        if (line.isRecursiveForceDelete()) {
            log.info("拦截到递归强制删除，启动诱饵流程");
            return choreography.prank(ctx.session());
        }

        log.debug("分发命令 {}", line.normalizedName());
        if (!environment.gate().isCommandAvailable(ctx.session(), line.name())) {
            throw ctx.fail(ErrorKind.COMMAND_NOT_FOUND,
                    List.of(ctx.text("error.restricted.hint.start"), ctx.text("error.restricted.hint.help")),
                    "error.restricted.unknown", line.name());
        }
        Optional<CommandName> name = CommandName.fromToken(line.name());
        if (name.isEmpty()) {
            if (line.hasOptionToken()) {
                throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "error.invalidOption", line.name(), line.argsJoined());
            }
            throw ctx.fail(ErrorKind.COMMAND_NOT_FOUND, "error.command.notFound", line.name());
        }
        return handlers.get(name.get()).handle(ctx);
    }

    private static Map<CommandName, CommandHandler> register(List<CommandModule> modules) {
        Map<CommandName, CommandHandler> registry = new EnumMap<>(CommandName.class);
        for (CommandModule module : modules) {
            Map<CommandName, CommandHandler> contributed = new HashMap<>();
            module.registerInto(contributed);
            for (Map.Entry<CommandName, CommandHandler> entry : contributed.entrySet()) {
                if (registry.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                    throw new IllegalStateException("命令重复注册：" + entry.getKey().token());
                }
            }
        }
        Set<CommandName> missing = EnumSet.allOf(CommandName.class);
        missing.removeAll(registry.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("以下命令没有处理器：" + missing);
        }
        return registry;
    }
}
