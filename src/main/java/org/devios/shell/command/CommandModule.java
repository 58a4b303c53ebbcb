package org.devios.shell.command;

import java.util.Map;

/**
 * 一组相关命令，启动时把各自的处理器登记到分发器。
 */
public interface CommandModule {

    void registerInto(Map<CommandName, CommandHandler> registry);
}
