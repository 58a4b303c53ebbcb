package org.devios.shell.command;

import java.util.Locale;
import java.util.Optional;

/**
 * 支持的命令（封闭集合）。每个值在 {@link CommandDispatcher} 中恰好对应一个处理器。
 */
public enum CommandName {
    HELP,
    ABOUT,
    SKILLS,
    PROJECTS,
    CONTACT,
    GITHUB,
    THEME,
    CLEAR,
    LS,
    PWD,
    WHOAMI,
    DATE,
    CD,
    CAT,
    MKDIR,
    TOUCH,
    CHMOD,
    CHOWN,
    FIND,
    MAN,
    ECHO,
    UNAME,
    EXIT,
    LOGOUT,
    RM,
    SUDO,
    ID,
    LANG,
    DEVISER;

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CommandName> fromToken(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        for (CommandName value : values()) {
            if (value.token().equalsIgnoreCase(token)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
