package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.session.AuthChallenge;
import org.devios.shell.session.ShellSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * sudo 与密码应答。
 * <p>
 * 状态机：未提权 → (sudo 命令) → 等待密码 → 正确：提权并立即执行挂起的命令；
 * 错误：次数 +1，达到上限时丢弃挂起的命令并报告锁定，否则继续等待。
 */
public class AuthCommands implements CommandModule {

    private static final Logger log = LoggerFactory.getLogger(AuthCommands.class);

    private final String secret;
    private final int maxAttempts;

    public AuthCommands(String secret, int maxAttempts) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("sudo 密码不能为空");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必须 >= 1");
        }
        this.secret = secret;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public void registerInto(Map<CommandName, CommandHandler> registry) {
        registry.put(CommandName.SUDO, this::sudo);
    }

    /**
     * 已提权时直接执行；否则保存命令并进入等待密码状态。
     */
    CommandOutcome sudo(CommandContext ctx) {
        CommandLine line = ctx.line();
        if (!line.hasArgs()) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "sudo.missing");
        }
        String pending = line.argsJoined();
        ShellSession session = ctx.session();
        if (session.isPrivileged()) {
            return ctx.dispatch(pending);
        }
        session.beginChallenge(pending);
        log.debug("sudo 等待 {} 的密码", session.actor());
        return CommandOutcome.of(ResultRecord.system(ctx.text("sudo.prompt", session.actor())));
    }

    /**
     * 处理等待密码状态下提交的一行。密码本身不会写入日志或历史。
     */
    public CommandOutcome answer(CommandContext ctx, String submitted) {
        ShellSession session = ctx.session();
        AuthChallenge challenge = session.authChallenge()
                .orElseThrow(() -> new IllegalStateException("当前没有等待中的 sudo 认证"));
        if (secret.equals(submitted.trim())) {
            session.elevate();
            session.clearChallenge();
            log.info("sudo 认证成功，{} 已提权", session.actor());
            return ctx.dispatch(challenge.pendingCommand()).prepend(ResultRecord.system(""));
        }
        AuthChallenge failed = session.recordFailedAttempt();
        if (failed.attempts() >= maxAttempts) {
            session.clearChallenge();
            log.warn("sudo 连续 {} 次认证失败，已丢弃挂起的命令", failed.attempts());
            throw ctx.fail(ErrorKind.AUTH_LOCKOUT, "sudo.lockout", String.valueOf(failed.attempts()));
        }
        log.warn("sudo 认证失败（第 {} 次）", failed.attempts());
        throw ctx.fail(ErrorKind.AUTH_FAILURE, "sudo.failure");
    }
}
