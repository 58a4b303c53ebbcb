package org.devios.shell.command;

/**
 * 单个命令的处理器。失败时抛出 {@link org.devios.shell.ShellException}。
 */
@FunctionalInterface
public interface CommandHandler {

    CommandOutcome handle(CommandContext context);
}
